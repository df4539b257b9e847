package com.titiplex.mist.core.signaling;

@FunctionalInterface
public interface SignalingHandler {
    void onEnvelope(SignalingEnvelope envelope);
}
