package com.titiplex.mist.core.orchestrator;

public enum RejectionReason {
    UNKNOWN_SENDER,
    NO_SESSION,
    DECRYPTION_FAILED,
    HANDSHAKE_REJECTED,
    MALFORMED,
    STORAGE_FAILED
}
