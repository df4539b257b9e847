package com.titiplex.mist.core.crypto.engine;

public record InitiatorAgreement(
        byte[] sharedSecret,
        byte[] ephemeralPublicKey,
        Integer usedOneTimePrekeyId
) {
}
