package com.titiplex.mist.core.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Set;

// format : nonce(12) || ciphertext
@Component
public class LocalSecrets {
    private static final Logger log = LoggerFactory.getLogger(LocalSecrets.class);
    private static final SecureRandom RNG = new SecureRandom();

    private final Path dir;
    private final Path deviceKeyPath;
    private byte[] cachedKey;

    public LocalSecrets(@Value("${app.data.dir}") String dataDir) {
        this.dir = Paths.get(dataDir);
        this.deviceKeyPath = dir.resolve("device.key");
    }

    private synchronized byte[] key() {
        if (cachedKey != null) return cachedKey;
        try {
            Files.createDirectories(dir);
            if (!Files.exists(deviceKeyPath)) {
                byte[] k = new byte[32];
                RNG.nextBytes(k);
                Files.write(deviceKeyPath, k, StandardOpenOption.CREATE_NEW);
                try {
                    Files.setPosixFilePermissions(deviceKeyPath, Set.of(
                            PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE));
                } catch (UnsupportedOperationException e) {
                    log.debug("Non-POSIX filesystem, device key permissions left as is");
                }
                cachedKey = k;
            } else {
                cachedKey = Files.readAllBytes(deviceKeyPath);
            }
            return cachedKey;
        } catch (IOException e) {
            throw new IllegalStateException("Cannot access device key " + deviceKeyPath, e);
        }
    }

    public byte[] seal(byte[] plaintext) {
        try {
            byte[] nonce = new byte[12];
            RNG.nextBytes(nonce);
            Cipher c = Cipher.getInstance("AES/GCM/NoPadding");
            c.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key(), "AES"), new GCMParameterSpec(128, nonce));
            byte[] ct = c.doFinal(plaintext);
            byte[] blob = new byte[nonce.length + ct.length];
            System.arraycopy(nonce, 0, blob, 0, nonce.length);
            System.arraycopy(ct, 0, blob, nonce.length, ct.length);
            return blob;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Sealing failed", e);
        }
    }

    public byte[] open(byte[] blob) {
        if (blob == null || blob.length < 12 + 16) throw new IllegalStateException("Sealed blob too short");
        try {
            Cipher c = Cipher.getInstance("AES/GCM/NoPadding");
            c.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key(), "AES"), new GCMParameterSpec(128, blob, 0, 12));
            return c.doFinal(blob, 12, blob.length - 12);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Sealed blob cannot be opened with this device key", e);
        }
    }

    public String sealString(String plaintext) {
        return Base64.getEncoder().encodeToString(seal(plaintext.getBytes(StandardCharsets.UTF_8)));
    }

    public String openString(String blobB64) {
        return new String(open(Base64.getDecoder().decode(blobB64)), StandardCharsets.UTF_8);
    }
}
