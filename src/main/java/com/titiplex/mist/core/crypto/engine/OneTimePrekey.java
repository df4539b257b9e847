package com.titiplex.mist.core.crypto.engine;

public record OneTimePrekey(int id, byte[] publicKey, byte[] privateKey) {
}
