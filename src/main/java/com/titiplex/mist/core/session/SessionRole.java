package com.titiplex.mist.core.session;

public enum SessionRole {
    INITIATOR,
    RESPONDER
}
