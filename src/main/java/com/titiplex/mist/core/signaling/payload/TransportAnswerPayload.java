package com.titiplex.mist.core.signaling.payload;

import java.util.List;

// abandonedLinkId : notre propre offre, lâchée au profit de celle à laquelle on répond (collision)
public record TransportAnswerPayload(String linkId, List<String> candidates, String abandonedLinkId)
        implements SignalingPayload {

    public TransportAnswerPayload(String linkId, List<String> candidates) {
        this(linkId, candidates, null);
    }

    @Override
    public void validate() {
        SignalingPayload.require(linkId != null && !linkId.isBlank(), "linkId missing");
        SignalingPayload.require(candidates != null, "candidates missing");
        SignalingPayload.require(candidates.stream().allMatch(SignalingPayload::isCandidate), "malformed candidate");
        SignalingPayload.require(!linkId.equals(abandonedLinkId), "answer abandons its own link");
    }
}
