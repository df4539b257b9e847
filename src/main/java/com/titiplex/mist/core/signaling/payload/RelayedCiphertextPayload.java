package com.titiplex.mist.core.signaling.payload;

import com.titiplex.mist.core.signaling.InvalidEnvelopeException;

import java.util.Base64;

public record RelayedCiphertextPayload(String ciphertext) implements SignalingPayload {

    public static RelayedCiphertextPayload of(byte[] frame) {
        return new RelayedCiphertextPayload(Base64.getEncoder().encodeToString(frame));
    }

    public byte[] bytes() {
        return Base64.getDecoder().decode(ciphertext);
    }

    @Override
    public void validate() {
        SignalingPayload.require(ciphertext != null && !ciphertext.isEmpty(), "ciphertext missing");
        try {
            Base64.getDecoder().decode(ciphertext);
        } catch (IllegalArgumentException e) {
            throw new InvalidEnvelopeException("ciphertext is not base64", e);
        }
    }
}
