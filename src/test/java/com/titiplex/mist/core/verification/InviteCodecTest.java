package com.titiplex.mist.core.verification;

import com.titiplex.mist.core.crypto.engine.CryptoEngine;
import com.titiplex.mist.core.crypto.engine.Curve25519CryptoEngine;
import com.titiplex.mist.core.crypto.engine.IdentityKeyPair;
import com.titiplex.mist.core.crypto.engine.OneTimePrekey;
import com.titiplex.mist.core.crypto.engine.PrekeyBundle;
import com.titiplex.mist.core.crypto.engine.SignedPrekey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InviteCodecTest {

    private static final long NOW = 1_700_000_000_000L;

    private final CryptoEngine engine = new Curve25519CryptoEngine();
    private final InviteCodec codec = new InviteCodec(engine);
    private IdentityKeyPair bob;
    private ContactCard card;

    static ContactCard cardOf(CryptoEngine engine, IdentityKeyPair id, String name) {
        SignedPrekey spk = engine.generateSignedPrekey(id, 1);
        OneTimePrekey otk = engine.generateOneTimePrekeys(1, 1).get(0);
        return ContactCard.of(new PrekeyBundle(id.publicKey(), spk.id(), spk.publicKey(), spk.signature(),
                otk.id(), otk.publicKey()), name);
    }

    @BeforeEach
    void setUp() {
        bob = engine.generateIdentity();
        card = cardOf(engine, bob, "bob");
    }

    @Test
    void validInviteCarriesTheCard() {
        String link = codec.create(InviteCodec.Kind.INVITE, card, bob, Duration.ofHours(24), NOW);
        assertThat(link).startsWith("MIST1.");

        InviteCodec.Parsed parsed = codec.parseAndVerify(link, NOW + Duration.ofHours(23).toMillis());
        assertThat(parsed.kind()).isEqualTo(InviteCodec.Kind.INVITE);
        assertThat(parsed.card()).isEqualTo(card);
        assertThat(parsed.card().peerKey()).isEqualTo(bob.peerKey());
        assertThat(parsed.card().bundle().oneTimePrekeyId()).isEqualTo(1);
        assertThat(parsed.code()).isNotBlank();
        assertThat(parsed.expiresAt()).isEqualTo((NOW + Duration.ofHours(24).toMillis()) / 1000 * 1000);
    }

    @Test
    void expiredInviteIsRejected() {
        String link = codec.create(InviteCodec.Kind.VERIFICATION, card, bob, Duration.ofMinutes(5), NOW);
        assertThat(codec.parseAndVerify(link, NOW + Duration.ofMinutes(4).toMillis()).kind())
                .isEqualTo(InviteCodec.Kind.VERIFICATION);
        assertThatThrownBy(() -> codec.parseAndVerify(link, NOW + Duration.ofMinutes(6).toMillis()))
                .isInstanceOf(InviteException.class)
                .hasMessageContaining("expired");
    }

    @Test
    void tamperedPayloadIsRejected() {
        String link = codec.create(InviteCodec.Kind.INVITE, card, bob, Duration.ofHours(24), NOW);
        String[] parts = link.split("\\.");
        char c = parts[1].charAt(10);
        String altered = parts[0] + "." + parts[1].substring(0, 10) + (c == 'A' ? 'B' : 'A')
                + parts[1].substring(11) + "." + parts[2];

        assertThatThrownBy(() -> codec.parseAndVerify(altered, NOW)).isInstanceOf(InviteException.class);
    }

    @Test
    void inviteSignedByAnotherIdentityIsRejected() {
        IdentityKeyPair mallory = engine.generateIdentity();
        String link = codec.create(InviteCodec.Kind.INVITE, card, mallory, Duration.ofHours(24), NOW);

        assertThatThrownBy(() -> codec.parseAndVerify(link, NOW))
                .isInstanceOf(InviteException.class)
                .hasMessageContaining("signature");
    }

    @Test
    void garbageIsRejected() {
        assertThatThrownBy(() -> codec.parseAndVerify("", NOW)).isInstanceOf(InviteException.class);
        assertThatThrownBy(() -> codec.parseAndVerify("MIST2.a.b", NOW)).isInstanceOf(InviteException.class);
        assertThatThrownBy(() -> codec.parseAndVerify("MIST1.!!!.???", NOW)).isInstanceOf(InviteException.class);
    }
}
