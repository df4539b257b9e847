package com.titiplex.mist.core.crypto.engine;

public record SignedPrekey(
        int id,
        byte[] publicKey,   // X25519
        byte[] privateKey,
        byte[] signature,   // Ed25519(identity, publicKey)
        long timestamp
) {
}
