package com.chatpulse.transport;

/** Callbacks raised by a {@link Transport}. Invoked on transport threads; implementations must not block. */
public interface TransportListener {

    void onMessage(Envelope envelope);

    void onClose(int code, String reason);

    void onPong();

    void onError(Throwable error);
}
