package com.titiplex.mist.core.session;

public record HandshakeMaterial(
        byte[] ephemeralKey,
        int signedPrekeyId,
        Integer oneTimePrekeyId   // null si le bundle n'en avait pas
) {
}
