package com.titiplex.mist.core.crypto.engine;

/**
 * Session opaque : chaque appel réussi à {@link #encrypt} ou {@link #decrypt} fait avancer le ratchet.
 */
public interface RatchetSession {

    RatchetMessage encrypt(byte[] plaintext);

    /**
     * En cas d'échec l'état n'est pas modifié.
     */
    byte[] decrypt(RatchetMessage message);

    /**
     * Faux tant qu'un répondeur n'a reçu aucun message de l'initiateur.
     */
    boolean canSend();

    byte[] serialize();
}
