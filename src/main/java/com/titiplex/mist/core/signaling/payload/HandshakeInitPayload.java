package com.titiplex.mist.core.signaling.payload;

import com.titiplex.mist.core.model.TrustOrigin;
import com.titiplex.mist.core.session.HandshakeMaterial;

import java.util.Base64;

public record HandshakeInitPayload(
        String ephemeralKey,       // base64
        int signedPrekeyId,
        Integer oneTimePrekeyId,
        String senderName,
        TrustOrigin trustOrigin
) implements SignalingPayload {

    public static HandshakeInitPayload of(HandshakeMaterial m, String senderName, TrustOrigin origin) {
        return new HandshakeInitPayload(Base64.getEncoder().encodeToString(m.ephemeralKey()),
                m.signedPrekeyId(), m.oneTimePrekeyId(), senderName, origin);
    }

    public HandshakeMaterial material() {
        return new HandshakeMaterial(Base64.getDecoder().decode(ephemeralKey), signedPrekeyId, oneTimePrekeyId);
    }

    @Override
    public void validate() {
        SignalingPayload.decodeKey(ephemeralKey, "ephemeralKey");
        SignalingPayload.require(signedPrekeyId > 0, "signedPrekeyId must be positive");
        SignalingPayload.require(oneTimePrekeyId == null || oneTimePrekeyId > 0, "oneTimePrekeyId must be positive");
        SignalingPayload.require(trustOrigin != null, "trustOrigin missing");
        SignalingPayload.require(senderName == null || senderName.length() <= 64, "senderName too long");
    }
}
