package com.titiplex.mist.core.session;

public enum SessionPhase {
    NO_SESSION,
    HANDSHAKE_SENT,
    HANDSHAKE_RECEIVED,
    ESTABLISHED_AWAITING_FIRST_MESSAGE,
    ESTABLISHED;

    public boolean isEstablished() {
        return this == ESTABLISHED || this == ESTABLISHED_AWAITING_FIRST_MESSAGE;
    }
}
