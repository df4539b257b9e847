package com.titiplex.mist.core.crypto.engine;

public record PrekeyBundle(
        byte[] identityKey,
        int signedPrekeyId,
        byte[] signedPrekey,
        byte[] signedPrekeySignature,
        Integer oneTimePrekeyId,   // null si aucun
        byte[] oneTimePrekey
) {
    public boolean hasOneTimePrekey() {
        return oneTimePrekeyId != null && oneTimePrekey != null;
    }
}
