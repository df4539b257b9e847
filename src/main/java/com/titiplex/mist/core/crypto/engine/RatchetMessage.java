package com.titiplex.mist.core.crypto.engine;

public record RatchetMessage(
        byte[] dhPublic,
        int previousChainLength,
        int messageNumber,
        byte[] nonce,
        byte[] ciphertext
) {
}
