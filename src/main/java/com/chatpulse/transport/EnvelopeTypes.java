package com.chatpulse.transport;

/** Envelope {@code type} values understood by the runtime. */
public final class EnvelopeTypes {

    // Outbound
    public static final String QR_REQUEST = "qr_request";
    public static final String PAIRING_REQUEST = "pairing_request";
    public static final String SESSION_RESTORE = "session_restore";
    public static final String OPERATION = "operation";

    // Inbound
    public static final String QR_UPDATE = "qr_update";
    public static final String PAIRING_CODE = "pairing_code";
    public static final String AUTH_SUCCESS = "auth_success";
    public static final String AUTH_FAILURE = "auth_failure";
    public static final String ACK = "ack";
    public static final String ERROR = "error";

    private EnvelopeTypes() {}

    /** True for inbound types consumed by the authentication flows. */
    public static boolean isAuthControl(String type) {
        return QR_UPDATE.equals(type)
                || PAIRING_CODE.equals(type)
                || AUTH_SUCCESS.equals(type)
                || AUTH_FAILURE.equals(type);
    }
}
