package com.titiplex.mist.core.crypto.engine;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * X3DH sur identités Ed25519 (converties en X25519) suivi d'un Double Ratchet.
 * <p>
 * Initiateur : DH1 = DH(IKa, SPKb), DH2 = DH(EKa, IKb), DH3 = DH(EKa, SPKb), DH4 = DH(EKa, OPKb).
 * Le répondeur calcule les mêmes valeurs dans le même ordre avec ses clés privées.
 */
public class Curve25519CryptoEngine implements CryptoEngine {
    private static final byte[] INFO_X3DH = "Mist_X3DH".getBytes(StandardCharsets.UTF_8);

    @Override
    public IdentityKeyPair generateIdentity() {
        byte[] seed = new byte[Curve25519.KEY_LENGTH];
        Curve25519.RNG.nextBytes(seed);
        return restoreIdentity(seed);
    }

    @Override
    public IdentityKeyPair restoreIdentity(byte[] privateKey) {
        byte[] seed = Curve25519.requireKey(privateKey).clone();
        return new IdentityKeyPair(Curve25519.ed25519Public(seed), seed);
    }

    @Override
    public SignedPrekey generateSignedPrekey(IdentityKeyPair identity, int id) {
        byte[][] kp = Curve25519.newX25519KeyPair();
        byte[] sig = Curve25519.sign(identity.privateKey(), kp[0]);
        return new SignedPrekey(id, kp[0], kp[1], sig, System.currentTimeMillis());
    }

    @Override
    public List<OneTimePrekey> generateOneTimePrekeys(int startId, int count) {
        List<OneTimePrekey> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            byte[][] kp = Curve25519.newX25519KeyPair();
            out.add(new OneTimePrekey(startId + i, kp[0], kp[1]));
        }
        return out;
    }

    @Override
    public byte[] sign(IdentityKeyPair identity, byte[] message) {
        return Curve25519.sign(identity.privateKey(), message);
    }

    @Override
    public boolean verify(byte[] identityPublicKey, byte[] message, byte[] signature) {
        return Curve25519.verify(identityPublicKey, message, signature);
    }

    @Override
    public InitiatorAgreement initiatorAgree(IdentityKeyPair identity, PrekeyBundle peerBundle) {
        if (!verify(peerBundle.identityKey(), peerBundle.signedPrekey(), peerBundle.signedPrekeySignature()))
            throw new SignatureInvalidException("Signed prekey " + peerBundle.signedPrekeyId()
                    + " is not signed by the announced identity");

        byte[] ownX = Curve25519.edPrivateToX25519(identity.privateKey());
        byte[] peerX = Curve25519.edPublicToX25519(peerBundle.identityKey());
        byte[][] ephemeral = Curve25519.newX25519KeyPair();

        ByteArrayOutputStream dh = new ByteArrayOutputStream();
        dh.writeBytes(Curve25519.dh(ownX, peerBundle.signedPrekey()));
        dh.writeBytes(Curve25519.dh(ephemeral[1], peerX));
        dh.writeBytes(Curve25519.dh(ephemeral[1], peerBundle.signedPrekey()));
        Integer usedOpk = null;
        if (peerBundle.hasOneTimePrekey()) {
            dh.writeBytes(Curve25519.dh(ephemeral[1], peerBundle.oneTimePrekey()));
            usedOpk = peerBundle.oneTimePrekeyId();
        }
        byte[] ss = Curve25519.hkdf(null, dh.toByteArray(), INFO_X3DH, Curve25519.KEY_LENGTH);
        return new InitiatorAgreement(ss, ephemeral[0], usedOpk);
    }

    @Override
    public byte[] responderAgree(IdentityKeyPair identity, SignedPrekey signedPrekey, OneTimePrekey oneTimePrekey,
                                 byte[] peerIdentityPublicKey, byte[] peerEphemeralPublicKey) {
        byte[] ownX = Curve25519.edPrivateToX25519(identity.privateKey());
        byte[] peerX = Curve25519.edPublicToX25519(peerIdentityPublicKey);
        Curve25519.requireKey(peerEphemeralPublicKey);

        ByteArrayOutputStream dh = new ByteArrayOutputStream();
        dh.writeBytes(Curve25519.dh(signedPrekey.privateKey(), peerX));
        dh.writeBytes(Curve25519.dh(ownX, peerEphemeralPublicKey));
        dh.writeBytes(Curve25519.dh(signedPrekey.privateKey(), peerEphemeralPublicKey));
        if (oneTimePrekey != null)
            dh.writeBytes(Curve25519.dh(oneTimePrekey.privateKey(), peerEphemeralPublicKey));
        return Curve25519.hkdf(null, dh.toByteArray(), INFO_X3DH, Curve25519.KEY_LENGTH);
    }

    @Override
    public RatchetSession initInitiator(byte[] sharedSecret, byte[] peerPrekeyPublicKey) {
        return DoubleRatchetSession.initiator(sharedSecret, peerPrekeyPublicKey);
    }

    @Override
    public RatchetSession initResponder(byte[] sharedSecret, byte[] prekeyPrivateKey, byte[] prekeyPublicKey,
                                        byte[] peerEphemeralPublicKey) {
        return DoubleRatchetSession.responder(sharedSecret, prekeyPrivateKey, prekeyPublicKey, peerEphemeralPublicKey);
    }

    @Override
    public RatchetSession deserialize(byte[] state) {
        return DoubleRatchetSession.deserialize(state);
    }
}
