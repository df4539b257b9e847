package com.titiplex.mist.core.model;

import java.util.Arrays;
import java.util.Base64;

public final class PeerKey implements Comparable<PeerKey> {
    public static final int LENGTH = 32;

    private final byte[] bytes;
    private final String base64;

    private PeerKey(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH)
            throw new IllegalArgumentException("public key must be " + LENGTH + " bytes");
        this.bytes = bytes.clone();
        this.base64 = Base64.getEncoder().encodeToString(bytes);
    }

    public static PeerKey of(byte[] bytes) {
        return new PeerKey(bytes);
    }

    public static PeerKey fromBase64(String b64) {
        if (b64 == null) throw new IllegalArgumentException("empty public key");
        return new PeerKey(Base64.getDecoder().decode(b64.trim()));
    }

    public static PeerKey fromUrlSafe(String urlSafe) {
        if (urlSafe == null) throw new IllegalArgumentException("empty public key");
        return new PeerKey(Base64.getUrlDecoder().decode(urlSafe.trim()));
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public String base64() {
        return base64;
    }

    public String urlSafe() {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    public String shortId() {
        return base64.substring(0, 8);
    }

    // ordre lexicographique sur la forme base64, identique des deux côtés
    @Override
    public int compareTo(PeerKey o) {
        return base64.compareTo(o.base64);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PeerKey other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return shortId() + "...";
    }
}
