package com.titiplex.mist.core.signaling.payload;

public record PresencePayload(boolean online) implements SignalingPayload {
    @Override
    public void validate() {
    }
}
