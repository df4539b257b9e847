package com.titiplex.mist.core.crypto.engine;

import com.titiplex.mist.core.model.PeerKey;

public record IdentityKeyPair(
        byte[] publicKey,   // Ed25519, 32 octets
        byte[] privateKey   // seed Ed25519, 32 octets
) {
    public PeerKey peerKey() {
        return PeerKey.of(publicKey);
    }
}
