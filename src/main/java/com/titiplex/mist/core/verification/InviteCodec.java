package com.titiplex.mist.core.verification;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.titiplex.mist.core.crypto.engine.CryptoEngine;
import com.titiplex.mist.core.crypto.engine.IdentityKeyPair;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;

/**
 * Invitations signées.
 * <p>
 * Format : {@code MIST1.<base64url(payload)>.<base64url(sig)>}, payload JSON {@code {kind, card, code, exp}},
 * signature Ed25519 de l'identité portée par la carte. La vérification contrôle signature puis expiration.
 */
@Component
public class InviteCodec {
    public static final String PREFIX = "MIST1";
    private static final SecureRandom RNG = new SecureRandom();

    public enum Kind {
        /** Lien partagé (24 h). */
        INVITE,
        /** QR affiché en face à face (5 min). */
        VERIFICATION
    }

    public record Parsed(Kind kind, ContactCard card, String code, long expiresAt) {
    }

    public static class Payload {
        public Kind kind;
        public ContactCard card;
        public String code;
        public long exp;   // epoch secondes
    }

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final CryptoEngine engine;

    public InviteCodec(CryptoEngine engine) {
        this.engine = engine;
    }

    public String create(Kind kind, ContactCard card, IdentityKeyPair identity, Duration ttl, long nowMs) {
        byte[] codeBytes = new byte[9];
        RNG.nextBytes(codeBytes);
        Payload p = new Payload();
        p.kind = kind;
        p.card = card;
        p.code = b64(codeBytes);
        p.exp = (nowMs + ttl.toMillis()) / 1000;
        try {
            byte[] payload = mapper.writeValueAsBytes(p);
            byte[] sig = engine.sign(identity, payload);
            return PREFIX + "." + b64(payload) + "." + b64(sig);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public Parsed parseAndVerify(String link, long nowMs) {
        if (link == null || link.isBlank()) throw new InviteException("empty invite");
        String[] parts = link.trim().split("\\.");
        if (parts.length != 3 || !parts[0].equals(PREFIX)) throw new InviteException("bad format");
        byte[] payload;
        byte[] sig;
        try {
            payload = Base64.getUrlDecoder().decode(parts[1]);
            sig = Base64.getUrlDecoder().decode(parts[2]);
        } catch (IllegalArgumentException e) {
            throw new InviteException("bad encoding", e);
        }
        Payload p;
        try {
            p = mapper.readValue(payload, Payload.class);
        } catch (IOException e) {
            throw new InviteException("bad payload", e);
        }
        if (p.kind == null || p.card == null || p.code == null) throw new InviteException("incomplete payload");
        p.card.validate();
        if (!engine.verify(Base64.getDecoder().decode(p.card.pk()), payload, sig))
            throw new InviteException("bad signature");
        if (nowMs / 1000 > p.exp) throw new InviteException("invite expired");
        return new Parsed(p.kind, p.card, p.code, p.exp * 1000);
    }

    private static String b64(byte[] b) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(b);
    }
}
