package com.titiplex.mist.core.signaling.payload;

import java.util.List;

public record TransportOfferPayload(String linkId, List<String> candidates) implements SignalingPayload {

    @Override
    public void validate() {
        SignalingPayload.require(linkId != null && !linkId.isBlank(), "linkId missing");
        SignalingPayload.require(candidates != null, "candidates missing");
        SignalingPayload.require(candidates.stream().allMatch(SignalingPayload::isCandidate), "malformed candidate");
    }
}
