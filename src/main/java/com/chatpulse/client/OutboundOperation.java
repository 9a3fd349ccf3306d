package com.chatpulse.client;

import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Application-level request to send something to the service. {@code target} and
 * {@code action} form the rate-limit key; {@code body} is passed through untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboundOperation {

    /** Recipient or channel the operation addresses. */
    private String target;

    /** Operation verb, e.g. {@code send_message} or {@code mark_read}. */
    private String action;

    private Map<String, Object> body;
}
