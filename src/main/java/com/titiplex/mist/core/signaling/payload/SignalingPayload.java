package com.titiplex.mist.core.signaling.payload;

import com.titiplex.mist.core.signaling.InvalidEnvelopeException;

public interface SignalingPayload {

    void validate();

    static void require(boolean condition, String message) {
        if (!condition) throw new InvalidEnvelopeException(message);
    }

    static byte[] decodeKey(String b64, String field) {
        require(b64 != null && !b64.isBlank(), field + " missing");
        byte[] raw;
        try {
            raw = java.util.Base64.getDecoder().decode(b64);
        } catch (IllegalArgumentException e) {
            throw new InvalidEnvelopeException(field + " is not base64", e);
        }
        require(raw.length == 32, field + " must be 32 bytes");
        return raw;
    }

    static boolean isCandidate(String c) {
        if (c == null) return false;
        int colon = c.lastIndexOf(':');
        if (colon <= 0 || colon == c.length() - 1) return false;
        try {
            int port = Integer.parseInt(c.substring(colon + 1));
            return port > 0 && port < 65536;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
