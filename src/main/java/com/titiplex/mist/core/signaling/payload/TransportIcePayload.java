package com.titiplex.mist.core.signaling.payload;

public record TransportIcePayload(String linkId, String candidate) implements SignalingPayload {

    @Override
    public void validate() {
        SignalingPayload.require(linkId != null && !linkId.isBlank(), "linkId missing");
        SignalingPayload.require(SignalingPayload.isCandidate(candidate), "malformed candidate");
    }
}
