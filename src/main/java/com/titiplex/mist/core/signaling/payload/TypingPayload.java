package com.titiplex.mist.core.signaling.payload;

public record TypingPayload(boolean typing) implements SignalingPayload {
    @Override
    public void validate() {
    }
}
