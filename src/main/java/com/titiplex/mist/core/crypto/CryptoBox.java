package com.titiplex.mist.core.crypto;

import com.titiplex.mist.core.crypto.engine.CryptoException;
import org.bouncycastle.crypto.generators.SCrypt;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

// format : saltLen(4) || salt || nonce(12) || ciphertext
public final class CryptoBox {
    private static final SecureRandom RNG = new SecureRandom();
    private static final byte[] MAGIC = "MISTBK1".getBytes(StandardCharsets.US_ASCII);

    private CryptoBox() {
    }

    static byte[] deriveKey(String passphrase, byte[] salt) {
        return SCrypt.generate(passphrase.getBytes(StandardCharsets.UTF_8), salt, 1 << 15, 8, 1, 32);
    }

    public static byte[] encrypt(String passphrase, byte[] plaintext) {
        if (passphrase == null || passphrase.isEmpty()) throw new IllegalArgumentException("empty passphrase");
        try {
            byte[] salt = new byte[16];
            RNG.nextBytes(salt);
            byte[] key = deriveKey(passphrase, salt);
            byte[] nonce = new byte[12];
            RNG.nextBytes(nonce);

            Cipher c = Cipher.getInstance("AES/GCM/NoPadding");
            c.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(128, nonce));
            c.updateAAD(MAGIC);
            byte[] ct = c.doFinal(plaintext);

            ByteBuffer bb = ByteBuffer.allocate(4 + salt.length + nonce.length + ct.length);
            bb.putInt(salt.length).put(salt).put(nonce).put(ct);
            return bb.array();
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Backup encryption failed", e);
        }
    }

    public static byte[] decrypt(String passphrase, byte[] blob) {
        try {
            ByteBuffer bb = ByteBuffer.wrap(blob);
            int saltLen = bb.getInt();
            if (saltLen <= 0 || saltLen > 64) throw new CryptoException("Corrupted backup");
            byte[] salt = new byte[saltLen];
            bb.get(salt);
            byte[] nonce = new byte[12];
            bb.get(nonce);
            byte[] ct = new byte[bb.remaining()];
            bb.get(ct);

            byte[] key = deriveKey(passphrase, salt);
            Cipher c = Cipher.getInstance("AES/GCM/NoPadding");
            c.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(128, nonce));
            c.updateAAD(MAGIC);
            return c.doFinal(ct);
        } catch (AEADBadTagException e) {
            throw new CryptoException("Wrong passphrase or corrupted backup", e);
        } catch (GeneralSecurityException | BufferUnderflowException e) {
            throw new CryptoException("Corrupted backup", e);
        }
    }
}
