package com.titiplex.mist.core.orchestrator;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.titiplex.mist.core.crypto.engine.RatchetMessage;
import com.titiplex.mist.core.signaling.payload.HandshakeInitPayload;

import java.io.IOException;
import java.io.UncheckedIOException;

// {handshake?, message} en JSON ; le handshake est joint tant que le répondeur n'a rien envoyé
public record CiphertextFrame(HandshakeInitPayload handshake, RatchetMessage message) {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public byte[] toBytes() {
        try {
            return MAPPER.writeValueAsBytes(this);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static CiphertextFrame parse(byte[] bytes) {
        CiphertextFrame f;
        try {
            f = MAPPER.readValue(bytes, CiphertextFrame.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("unreadable frame", e);
        }
        RatchetMessage m = f == null ? null : f.message();
        if (m == null || m.dhPublic() == null || m.nonce() == null || m.ciphertext() == null)
            throw new IllegalArgumentException("frame without message");
        return f;
    }
}
