package com.titiplex.mist.core.signaling;

import com.titiplex.mist.core.signaling.payload.HandshakeInitPayload;
import com.titiplex.mist.core.signaling.payload.PresencePayload;
import com.titiplex.mist.core.signaling.payload.RelayedCiphertextPayload;
import com.titiplex.mist.core.signaling.payload.SignalingPayload;
import com.titiplex.mist.core.signaling.payload.TransportAnswerPayload;
import com.titiplex.mist.core.signaling.payload.TransportIcePayload;
import com.titiplex.mist.core.signaling.payload.TransportOfferPayload;
import com.titiplex.mist.core.signaling.payload.TypingPayload;

import java.util.Optional;

public enum EnvelopeType {
    HANDSHAKE_INIT("handshake-init", HandshakeInitPayload.class),
    TRANSPORT_OFFER("transport-offer", TransportOfferPayload.class),
    TRANSPORT_ANSWER("transport-answer", TransportAnswerPayload.class),
    TRANSPORT_ICE("transport-ice", TransportIcePayload.class),
    RELAYED_CIPHERTEXT("relayed-ciphertext", RelayedCiphertextPayload.class),
    PRESENCE("presence", PresencePayload.class),
    TYPING("typing", TypingPayload.class);

    private final String wireName;
    private final Class<? extends SignalingPayload> payloadClass;

    EnvelopeType(String wireName, Class<? extends SignalingPayload> payloadClass) {
        this.wireName = wireName;
        this.payloadClass = payloadClass;
    }

    public String wireName() {
        return wireName;
    }

    public Class<? extends SignalingPayload> payloadClass() {
        return payloadClass;
    }

    public static Optional<EnvelopeType> fromWire(String name) {
        for (EnvelopeType t : values()) {
            if (t.wireName.equals(name)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
