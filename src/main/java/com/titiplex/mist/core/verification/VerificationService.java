package com.titiplex.mist.core.verification;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.titiplex.mist.core.crypto.IdentityService;
import com.titiplex.mist.core.crypto.NodeState;
import com.titiplex.mist.core.model.TrustOrigin;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;

@Service
public class VerificationService {
    public static final Duration INVITE_TTL = Duration.ofHours(24);
    public static final Duration VERIFICATION_TTL = Duration.ofMinutes(5);

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final IdentityService identity;
    private final InviteCodec codec;
    private final NodeState ns;

    public VerificationService(IdentityService identity, InviteCodec codec, NodeState ns) {
        this.identity = identity;
        this.codec = codec;
        this.ns = ns;
    }

    public ContactCard localCard() {
        return ContactCard.of(identity.localBundle(), ns.displayName);
    }

    // chaque invitation emporte son propre prekey à usage unique
    private ContactCard inviteCard() {
        return ContactCard.of(identity.reserveBundle(), ns.displayName);
    }

    public String localCardJson() {
        try {
            return mapper.writeValueAsString(localCard());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public ContactCard parseCard(String json) {
        try {
            ContactCard card = mapper.readValue(json, ContactCard.class);
            card.validate();
            return card;
        } catch (IOException e) {
            throw new InviteException("unreadable contact card", e);
        }
    }

    public String createInvite(long nowMs) {
        return codec.create(InviteCodec.Kind.INVITE, inviteCard(), identity.identity(), INVITE_TTL, nowMs);
    }

    public String createVerificationCode(long nowMs) {
        return codec.create(InviteCodec.Kind.VERIFICATION, inviteCard(), identity.identity(), VERIFICATION_TTL,
                nowMs);
    }

    public InviteCodec.Parsed parse(String link, long nowMs) {
        return codec.parseAndVerify(link, nowMs);
    }

    public static TrustOrigin originOf(InviteCodec.Kind kind) {
        return kind == InviteCodec.Kind.VERIFICATION ? TrustOrigin.DIRECT_VERIFICATION : TrustOrigin.SHARED_LINK;
    }
}
