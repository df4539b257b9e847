package com.titiplex.mist.core.crypto.engine;

import java.util.List;

public interface CryptoEngine {

    IdentityKeyPair generateIdentity();

    IdentityKeyPair restoreIdentity(byte[] privateKey);

    SignedPrekey generateSignedPrekey(IdentityKeyPair identity, int id);

    List<OneTimePrekey> generateOneTimePrekeys(int startId, int count);

    byte[] sign(IdentityKeyPair identity, byte[] message);

    boolean verify(byte[] identityPublicKey, byte[] message, byte[] signature);

    /**
     * X3DH côté initiateur ; lève {@link SignatureInvalidException} si le prekey n'est pas signé par l'identité.
     */
    InitiatorAgreement initiatorAgree(IdentityKeyPair identity, PrekeyBundle peerBundle);

    byte[] responderAgree(IdentityKeyPair identity, SignedPrekey signedPrekey, OneTimePrekey oneTimePrekey,
                          byte[] peerIdentityPublicKey, byte[] peerEphemeralPublicKey);

    RatchetSession initInitiator(byte[] sharedSecret, byte[] peerPrekeyPublicKey);

    RatchetSession initResponder(byte[] sharedSecret, byte[] prekeyPrivateKey, byte[] prekeyPublicKey,
                                 byte[] peerEphemeralPublicKey);

    RatchetSession deserialize(byte[] state);
}
