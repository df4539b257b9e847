package com.titiplex.mist.core.crypto.engine;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Curve25519CryptoEngineTest {

    private final CryptoEngine engine = new Curve25519CryptoEngine();

    private static PrekeyBundle bundle(IdentityKeyPair id, SignedPrekey spk, OneTimePrekey otk) {
        return new PrekeyBundle(id.publicKey(), spk.id(), spk.publicKey(), spk.signature(),
                otk == null ? null : otk.id(), otk == null ? null : otk.publicKey());
    }

    @Test
    void identityRestoresFromItsPrivateKey() {
        IdentityKeyPair id = engine.generateIdentity();
        IdentityKeyPair restored = engine.restoreIdentity(id.privateKey());
        assertThat(restored.publicKey()).isEqualTo(id.publicKey());
    }

    @Test
    void signatureVerifiesOnlyForTheSigner() {
        IdentityKeyPair alice = engine.generateIdentity();
        IdentityKeyPair bob = engine.generateIdentity();
        byte[] msg = "payload".getBytes(StandardCharsets.UTF_8);
        byte[] sig = engine.sign(alice, msg);

        assertThat(engine.verify(alice.publicKey(), msg, sig)).isTrue();
        assertThat(engine.verify(bob.publicKey(), msg, sig)).isFalse();
        msg[0] ^= 1;
        assertThat(engine.verify(alice.publicKey(), msg, sig)).isFalse();
    }

    @Test
    void edwardsAndMontgomeryConversionsAgree() {
        IdentityKeyPair id = engine.generateIdentity();
        byte[] fromPrivate = Curve25519.x25519Public(Curve25519.edPrivateToX25519(id.privateKey()));
        byte[] fromPublic = Curve25519.edPublicToX25519(id.publicKey());
        assertThat(fromPrivate).isEqualTo(fromPublic);
    }

    @Test
    void bothSidesDeriveTheSameSecretWithOneTimePrekey() {
        IdentityKeyPair alice = engine.generateIdentity();
        IdentityKeyPair bob = engine.generateIdentity();
        SignedPrekey spk = engine.generateSignedPrekey(bob, 1);
        OneTimePrekey otk = engine.generateOneTimePrekeys(1, 1).get(0);

        InitiatorAgreement a = engine.initiatorAgree(alice, bundle(bob, spk, otk));
        byte[] b = engine.responderAgree(bob, spk, otk, alice.publicKey(), a.ephemeralPublicKey());

        assertThat(a.usedOneTimePrekeyId()).isEqualTo(1);
        assertThat(a.sharedSecret()).hasSize(32).isEqualTo(b);
    }

    @Test
    void bothSidesDeriveTheSameSecretWithoutOneTimePrekey() {
        IdentityKeyPair alice = engine.generateIdentity();
        IdentityKeyPair bob = engine.generateIdentity();
        SignedPrekey spk = engine.generateSignedPrekey(bob, 4);

        InitiatorAgreement a = engine.initiatorAgree(alice, bundle(bob, spk, null));
        byte[] b = engine.responderAgree(bob, spk, null, alice.publicKey(), a.ephemeralPublicKey());

        assertThat(a.usedOneTimePrekeyId()).isNull();
        assertThat(a.sharedSecret()).isEqualTo(b);
    }

    @Test
    void prekeySignedByAnotherIdentityIsRejected() {
        IdentityKeyPair alice = engine.generateIdentity();
        IdentityKeyPair bob = engine.generateIdentity();
        IdentityKeyPair mallory = engine.generateIdentity();
        SignedPrekey forged = engine.generateSignedPrekey(mallory, 1);

        PrekeyBundle b = new PrekeyBundle(bob.publicKey(), forged.id(), forged.publicKey(), forged.signature(),
                null, null);
        assertThatThrownBy(() -> engine.initiatorAgree(alice, b)).isInstanceOf(SignatureInvalidException.class);
    }

    @Test
    void oneTimePrekeysHaveConsecutiveIds() {
        List<OneTimePrekey> keys = engine.generateOneTimePrekeys(10, 3);
        assertThat(keys).extracting(OneTimePrekey::id).containsExactly(10, 11, 12);
    }

    @Test
    void sessionsBuiltFromTheHandshakeTalkToEachOther() {
        IdentityKeyPair alice = engine.generateIdentity();
        IdentityKeyPair bob = engine.generateIdentity();
        SignedPrekey spk = engine.generateSignedPrekey(bob, 1);

        InitiatorAgreement a = engine.initiatorAgree(alice, bundle(bob, spk, null));
        RatchetSession initiator = engine.initInitiator(a.sharedSecret(), spk.publicKey());
        byte[] ss = engine.responderAgree(bob, spk, null, alice.publicKey(), a.ephemeralPublicKey());
        RatchetSession responder = engine.initResponder(ss, spk.privateKey(), spk.publicKey(), a.ephemeralPublicKey());

        RatchetMessage hello = initiator.encrypt("hello".getBytes(StandardCharsets.UTF_8));
        assertThat(new String(responder.decrypt(hello), StandardCharsets.UTF_8)).isEqualTo("hello");
        RatchetMessage hi = responder.encrypt("hi".getBytes(StandardCharsets.UTF_8));
        assertThat(new String(initiator.decrypt(hi), StandardCharsets.UTF_8)).isEqualTo("hi");

        RatchetSession reloaded = engine.deserialize(initiator.serialize());
        RatchetMessage again = reloaded.encrypt("again".getBytes(StandardCharsets.UTF_8));
        assertThat(new String(responder.decrypt(again), StandardCharsets.UTF_8)).isEqualTo("again");
    }
}
