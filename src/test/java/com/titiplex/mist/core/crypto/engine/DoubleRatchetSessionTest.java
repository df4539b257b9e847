package com.titiplex.mist.core.crypto.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DoubleRatchetSessionTest {

    private DoubleRatchetSession alice;
    private DoubleRatchetSession bob;

    @BeforeEach
    void setUp() {
        byte[] secret = new byte[32];
        Curve25519.RNG.nextBytes(secret);
        byte[][] prekey = Curve25519.newX25519KeyPair();
        byte[][] ephemeral = Curve25519.newX25519KeyPair();
        // {publique, privée}
        alice = DoubleRatchetSession.initiator(secret, prekey[0]);
        bob = DoubleRatchetSession.responder(secret, prekey[1], prekey[0], ephemeral[0]);
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String str(byte[] b) {
        return new String(b, StandardCharsets.UTF_8);
    }

    @Test
    void responderWaitsForTheFirstMessage() {
        assertThat(alice.canSend()).isTrue();
        assertThat(bob.canSend()).isFalse();

        bob.decrypt(alice.encrypt(utf8("hello")));
        assertThat(bob.canSend()).isTrue();
    }

    @Test
    void conversationAcrossSeveralTurns() {
        for (int turn = 0; turn < 4; turn++) {
            RatchetMessage m1 = alice.encrypt(utf8("a" + turn));
            RatchetMessage m2 = alice.encrypt(utf8("b" + turn));
            assertThat(str(bob.decrypt(m1))).isEqualTo("a" + turn);
            assertThat(str(bob.decrypt(m2))).isEqualTo("b" + turn);
            RatchetMessage r = bob.encrypt(utf8("r" + turn));
            assertThat(str(alice.decrypt(r))).isEqualTo("r" + turn);
        }
    }

    @Test
    void outOfOrderMessagesAreDecryptedWithSkippedKeys() {
        RatchetMessage m0 = alice.encrypt(utf8("zero"));
        RatchetMessage m1 = alice.encrypt(utf8("one"));
        RatchetMessage m2 = alice.encrypt(utf8("two"));

        assertThat(str(bob.decrypt(m2))).isEqualTo("two");
        assertThat(str(bob.decrypt(m0))).isEqualTo("zero");
        assertThat(str(bob.decrypt(m1))).isEqualTo("one");
    }

    @Test
    void messagesFromAPreviousChainStillDecryptAfterARatchetStep() {
        RatchetMessage first = alice.encrypt(utf8("first"));
        RatchetMessage late = alice.encrypt(utf8("late"));
        bob.decrypt(first);
        alice.decrypt(bob.encrypt(utf8("reply")));
        RatchetMessage next = alice.encrypt(utf8("next"));

        assertThat(str(bob.decrypt(next))).isEqualTo("next");
        assertThat(str(bob.decrypt(late))).isEqualTo("late");
    }

    @Test
    void replayedMessageIsRejected() {
        RatchetMessage m = alice.encrypt(utf8("once"));
        bob.decrypt(m);
        assertThatThrownBy(() -> bob.decrypt(m)).isInstanceOf(DecryptionFailedException.class);
    }

    @Test
    void tamperedCiphertextLeavesStateUntouched() {
        RatchetMessage m = alice.encrypt(utf8("genuine"));
        byte[] before = bob.serialize();
        byte[] ct = m.ciphertext().clone();
        ct[0] ^= 0x40;
        RatchetMessage forged = new RatchetMessage(m.dhPublic(), m.previousChainLength(), m.messageNumber(),
                m.nonce(), ct);

        assertThatThrownBy(() -> bob.decrypt(forged)).isInstanceOf(DecryptionFailedException.class);
        assertThat(bob.serialize()).isEqualTo(before);
        assertThat(str(bob.decrypt(m))).isEqualTo("genuine");
    }

    @Test
    void tamperedHeaderIsRejected() {
        RatchetMessage m = alice.encrypt(utf8("header"));
        RatchetMessage forged = new RatchetMessage(m.dhPublic(), m.previousChainLength() + 1, m.messageNumber(),
                m.nonce(), m.ciphertext());
        assertThatThrownBy(() -> bob.decrypt(forged)).isInstanceOf(DecryptionFailedException.class);
        assertThat(str(bob.decrypt(m))).isEqualTo("header");
    }

    @Test
    void tooManySkippedMessagesAreRefused() {
        RatchetMessage last = null;
        for (int i = 0; i <= DoubleRatchetSession.MAX_SKIP + 1; i++) last = alice.encrypt(utf8("m" + i));
        RatchetMessage tooFar = last;
        assertThatThrownBy(() -> bob.decrypt(tooFar)).isInstanceOf(DecryptionFailedException.class);
    }

    @Test
    void serializedStateResumesTheConversation() {
        bob.decrypt(alice.encrypt(utf8("hello")));
        RatchetMessage pending = alice.encrypt(utf8("pending"));

        DoubleRatchetSession bob2 = DoubleRatchetSession.deserialize(bob.serialize());
        assertThat(bob2.canSend()).isTrue();
        assertThat(str(bob2.decrypt(pending))).isEqualTo("pending");
        assertThat(str(alice.decrypt(bob2.encrypt(utf8("hi"))))).isEqualTo("hi");
    }
}
