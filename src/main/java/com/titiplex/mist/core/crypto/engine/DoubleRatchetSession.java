package com.titiplex.mist.core.crypto.engine;

import com.fasterxml.jackson.databind.ObjectMapper;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Double Ratchet : chaîne racine HKDF-SHA256, chaînes symétriques HMAC-SHA256, AES-256-GCM.
 */
final class DoubleRatchetSession implements RatchetSession {
    static final int MAX_SKIP = 1000;

    private static final byte[] INFO_RATCHET = "Mist_Ratchet".getBytes(StandardCharsets.UTF_8);
    private static final byte MESSAGE_KEY_TAG = 0x01;
    private static final byte CHAIN_KEY_TAG = 0x03;
    private static final int NONCE_LENGTH = 12;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private State state;

    private DoubleRatchetSession(State state) {
        this.state = state;
    }

    static DoubleRatchetSession initiator(byte[] sharedSecret, byte[] peerPrekeyPublic) {
        State s = new State();
        byte[][] kp = Curve25519.newX25519KeyPair();
        s.dhSelfPublic = kp[0];
        s.dhSelfPrivate = kp[1];
        s.dhRemote = Curve25519.requireKey(peerPrekeyPublic).clone();
        byte[][] rk = kdfRoot(Curve25519.requireKey(sharedSecret), Curve25519.dh(s.dhSelfPrivate, s.dhRemote));
        s.rootKey = rk[0];
        s.sendChainKey = rk[1];
        return new DoubleRatchetSession(s);
    }

    static DoubleRatchetSession responder(byte[] sharedSecret, byte[] prekeyPrivate, byte[] prekeyPublic,
                                          byte[] peerEphemeralPublic) {
        State s = new State();
        s.dhSelfPublic = Curve25519.requireKey(prekeyPublic).clone();
        s.dhSelfPrivate = Curve25519.requireKey(prekeyPrivate).clone();
        s.rootKey = Curve25519.requireKey(sharedSecret).clone();
        s.peerEphemeral = Curve25519.requireKey(peerEphemeralPublic).clone();
        return new DoubleRatchetSession(s);
    }

    static DoubleRatchetSession deserialize(byte[] bytes) {
        try {
            State s = MAPPER.readValue(bytes, State.class);
            if (s.rootKey == null || s.dhSelfPrivate == null || s.dhSelfPublic == null)
                throw new CryptoException("Incomplete ratchet state");
            return new DoubleRatchetSession(s);
        } catch (IOException e) {
            throw new CryptoException("Unreadable ratchet state", e);
        }
    }

    @Override
    public synchronized RatchetMessage encrypt(byte[] plaintext) {
        if (state.sendChainKey == null) throw new CryptoException("No sending chain key");
        byte[] messageKey = Curve25519.hmac(state.sendChainKey, MESSAGE_KEY_TAG);
        byte[] nonce = new byte[NONCE_LENGTH];
        Curve25519.RNG.nextBytes(nonce);
        RatchetMessage header = new RatchetMessage(state.dhSelfPublic.clone(), state.previousSendCount,
                state.sendCount, nonce, null);
        byte[] ct = seal(messageKey, nonce, associatedData(header), plaintext);

        state.sendChainKey = Curve25519.hmac(state.sendChainKey, CHAIN_KEY_TAG);
        state.sendCount++;
        return new RatchetMessage(header.dhPublic(), header.previousChainLength(), header.messageNumber(), nonce, ct);
    }

    @Override
    public synchronized byte[] decrypt(RatchetMessage message) {
        if (message == null || message.dhPublic() == null || message.nonce() == null || message.ciphertext() == null)
            throw new DecryptionFailedException("Incomplete message");
        // on travaille sur une copie : l'état n'est remplacé qu'après authentification
        State work = state.copy();

        byte[] skipped = work.skipped.remove(skippedKey(message.dhPublic(), message.messageNumber()));
        if (skipped != null) {
            byte[] pt = open(skipped, message);
            state = work;
            return pt;
        }

        if (work.dhRemote == null || !Arrays.equals(work.dhRemote, message.dhPublic())) {
            skipMessageKeys(work, message.previousChainLength());
            dhRatchet(work, message.dhPublic());
        }
        skipMessageKeys(work, message.messageNumber());

        if (work.recvChainKey == null) throw new DecryptionFailedException("No receiving chain key");
        if (message.messageNumber() < work.recvCount)
            throw new DecryptionFailedException("Message already processed or too old");

        byte[] messageKey = Curve25519.hmac(work.recvChainKey, MESSAGE_KEY_TAG);
        work.recvChainKey = Curve25519.hmac(work.recvChainKey, CHAIN_KEY_TAG);
        work.recvCount++;

        byte[] pt = open(messageKey, message);
        state = work;
        return pt;
    }

    @Override
    public synchronized boolean canSend() {
        return state.sendChainKey != null;
    }

    @Override
    public synchronized byte[] serialize() {
        try {
            return MAPPER.writeValueAsBytes(state);
        } catch (IOException e) {
            throw new CryptoException("Cannot serialize ratchet state", e);
        }
    }

    private static void dhRatchet(State s, byte[] theirPublic) {
        Curve25519.requireKey(theirPublic);
        s.previousSendCount = s.sendCount;
        s.sendCount = 0;
        s.recvCount = 0;
        s.dhRemote = theirPublic.clone();

        byte[][] recv = kdfRoot(s.rootKey, Curve25519.dh(s.dhSelfPrivate, theirPublic));
        s.rootKey = recv[0];
        s.recvChainKey = recv[1];

        byte[][] kp = Curve25519.newX25519KeyPair();
        s.dhSelfPublic = kp[0];
        s.dhSelfPrivate = kp[1];

        byte[][] send = kdfRoot(s.rootKey, Curve25519.dh(s.dhSelfPrivate, theirPublic));
        s.rootKey = send[0];
        s.sendChainKey = send[1];
    }

    private static void skipMessageKeys(State s, int until) {
        if (s.recvChainKey == null) return;
        if (s.recvCount + MAX_SKIP < until) throw new DecryptionFailedException("Too many skipped messages");
        while (s.recvCount < until) {
            s.skipped.put(skippedKey(s.dhRemote, s.recvCount), Curve25519.hmac(s.recvChainKey, MESSAGE_KEY_TAG));
            s.recvChainKey = Curve25519.hmac(s.recvChainKey, CHAIN_KEY_TAG);
            s.recvCount++;
        }
        // les plus anciennes clés sautées sont oubliées au-delà de MAX_SKIP
        Iterator<String> it = s.skipped.keySet().iterator();
        while (s.skipped.size() > MAX_SKIP && it.hasNext()) {
            it.next();
            it.remove();
        }
    }

    private static byte[][] kdfRoot(byte[] rootKey, byte[] dhOutput) {
        byte[] out = Curve25519.hkdf(rootKey, dhOutput, INFO_RATCHET, 64);
        return new byte[][]{Arrays.copyOfRange(out, 0, 32), Arrays.copyOfRange(out, 32, 64)};
    }

    private static String skippedKey(byte[] dhPublic, int n) {
        return Base64.getEncoder().encodeToString(dhPublic) + ":" + n;
    }

    private static byte[] associatedData(RatchetMessage m) {
        return ByteBuffer.allocate(m.dhPublic().length + 8)
                .put(m.dhPublic())
                .putInt(m.previousChainLength())
                .putInt(m.messageNumber())
                .array();
    }

    private static byte[] seal(byte[] key, byte[] nonce, byte[] aad, byte[] plaintext) {
        try {
            Cipher c = Cipher.getInstance("AES/GCM/NoPadding");
            c.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(128, nonce));
            c.updateAAD(aad);
            return c.doFinal(plaintext);
        } catch (GeneralSecurityException e) {
            throw new CryptoException("AES-GCM encryption failed", e);
        }
    }

    private static byte[] open(byte[] key, RatchetMessage m) {
        try {
            Cipher c = Cipher.getInstance("AES/GCM/NoPadding");
            c.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(128, m.nonce()));
            c.updateAAD(associatedData(m));
            return c.doFinal(m.ciphertext());
        } catch (AEADBadTagException e) {
            throw new DecryptionFailedException("Bad authentication tag", e);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new DecryptionFailedException("AES-GCM decryption failed", e);
        }
    }

    /**
     * État sérialisé en JSON (champs publics, comme les enveloppes).
     */
    public static class State {
        public byte[] dhSelfPublic;
        public byte[] dhSelfPrivate;
        public byte[] dhRemote;
        public byte[] rootKey;
        public byte[] sendChainKey;
        public byte[] recvChainKey;
        public int sendCount;
        public int recvCount;
        public int previousSendCount;
        public byte[] peerEphemeral;
        public Map<String, byte[]> skipped = new LinkedHashMap<>();

        State copy() {
            State c = new State();
            c.dhSelfPublic = dhSelfPublic;
            c.dhSelfPrivate = dhSelfPrivate;
            c.dhRemote = dhRemote;
            c.rootKey = rootKey;
            c.sendChainKey = sendChainKey;
            c.recvChainKey = recvChainKey;
            c.sendCount = sendCount;
            c.recvCount = recvCount;
            c.previousSendCount = previousSendCount;
            c.peerEphemeral = peerEphemeral;
            c.skipped = new LinkedHashMap<>(skipped);
            return c;
        }
    }
}
