package com.titiplex.mist.core.model;

public record ContactRecord(
        PeerKey publicKey,
        String displayName,
        TrustOrigin trustOrigin,
        long establishedAt   // epoch ms
) {
}
