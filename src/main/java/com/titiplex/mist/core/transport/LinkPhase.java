package com.titiplex.mist.core.transport;

public enum LinkPhase {
    IDLE,
    NEGOTIATING,
    OPEN,
    CLOSED
}
