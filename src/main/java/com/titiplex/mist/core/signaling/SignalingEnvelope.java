package com.titiplex.mist.core.signaling;

import com.titiplex.mist.core.model.PeerKey;
import com.titiplex.mist.core.signaling.payload.SignalingPayload;

public record SignalingEnvelope(
        EnvelopeType type,
        PeerKey from,
        PeerKey to,
        SignalingPayload payload,
        long timestamp
) {
    public SignalingEnvelope {
        if (type == null || from == null || payload == null) throw new IllegalArgumentException("incomplete envelope");
        if (!type.payloadClass().isInstance(payload))
            throw new IllegalArgumentException(type.wireName() + " cannot carry " + payload.getClass().getSimpleName());
    }

    public <T extends SignalingPayload> T payload(Class<T> cls) {
        return cls.cast(payload);
    }
}
