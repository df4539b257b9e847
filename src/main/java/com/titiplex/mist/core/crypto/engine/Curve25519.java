package com.titiplex.mist.core.crypto.engine;

import org.bouncycastle.crypto.agreement.X25519Agreement;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Arrays;

final class Curve25519 {
    static final int KEY_LENGTH = 32;
    static final SecureRandom RNG = new SecureRandom();

    private static final BigInteger P = BigInteger.ONE.shiftLeft(255).subtract(BigInteger.valueOf(19));

    private Curve25519() {
    }

    static byte[][] newX25519KeyPair() {
        X25519PrivateKeyParameters priv = new X25519PrivateKeyParameters(RNG);
        return new byte[][]{priv.generatePublicKey().getEncoded(), priv.getEncoded()};
    }

    static byte[] x25519Public(byte[] privateKey) {
        return new X25519PrivateKeyParameters(requireKey(privateKey), 0).generatePublicKey().getEncoded();
    }

    static byte[] dh(byte[] privateKey, byte[] publicKey) {
        try {
            X25519Agreement agreement = new X25519Agreement();
            agreement.init(new X25519PrivateKeyParameters(requireKey(privateKey), 0));
            byte[] out = new byte[agreement.getAgreementSize()];
            agreement.calculateAgreement(new X25519PublicKeyParameters(requireKey(publicKey), 0), out, 0);
            return out;
        } catch (IllegalStateException e) {
            throw new CryptoException("X25519 agreement failed", e);
        }
    }

    static byte[] ed25519Public(byte[] seed) {
        return new Ed25519PrivateKeyParameters(requireKey(seed), 0).generatePublicKey().getEncoded();
    }

    static byte[] sign(byte[] seed, byte[] message) {
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, new Ed25519PrivateKeyParameters(requireKey(seed), 0));
        signer.update(message, 0, message.length);
        return signer.generateSignature();
    }

    static boolean verify(byte[] publicKey, byte[] message, byte[] signature) {
        if (publicKey == null || publicKey.length != KEY_LENGTH || signature == null || signature.length != 64)
            return false;
        try {
            Ed25519Signer verifier = new Ed25519Signer();
            verifier.init(false, new Ed25519PublicKeyParameters(publicKey, 0));
            verifier.update(message, 0, message.length);
            return verifier.verifySignature(signature);
        } catch (IllegalArgumentException e) {
            // point invalide
            return false;
        }
    }

    // RFC 8032 : SHA-512 du seed, 32 premiers octets clampés
    static byte[] edPrivateToX25519(byte[] seed) {
        SHA512Digest sha = new SHA512Digest();
        sha.update(requireKey(seed), 0, KEY_LENGTH);
        byte[] h = new byte[sha.getDigestSize()];
        sha.doFinal(h, 0);
        byte[] x = Arrays.copyOf(h, KEY_LENGTH);
        x[0] &= (byte) 248;
        x[31] &= 127;
        x[31] |= 64;
        return x;
    }

    // u = (1 + y) / (1 - y) mod p
    static byte[] edPublicToX25519(byte[] edPublic) {
        byte[] le = requireKey(edPublic).clone();
        le[31] &= 0x7f;
        BigInteger y = new BigInteger(1, reverse(le));
        if (y.compareTo(P) >= 0) throw new CryptoException("Invalid Ed25519 public key");
        BigInteger denominator = BigInteger.ONE.subtract(y).mod(P);
        if (denominator.signum() == 0) throw new CryptoException("Invalid Ed25519 public key");
        BigInteger u = BigInteger.ONE.add(y).multiply(denominator.modInverse(P)).mod(P);
        return toLittleEndian(u);
    }

    static byte[] hkdf(byte[] salt, byte[] ikm, byte[] info, int length) {
        HKDFBytesGenerator gen = new HKDFBytesGenerator(new SHA256Digest());
        gen.init(new HKDFParameters(ikm, salt, info));
        byte[] out = new byte[length];
        gen.generateBytes(out, 0, length);
        return out;
    }

    static byte[] hmac(byte[] key, byte tag) {
        HMac mac = new HMac(new SHA256Digest());
        mac.init(new KeyParameter(key));
        mac.update(tag);
        byte[] out = new byte[mac.getMacSize()];
        mac.doFinal(out, 0);
        return out;
    }

    static byte[] requireKey(byte[] key) {
        if (key == null || key.length != KEY_LENGTH)
            throw new CryptoException("Key must be " + KEY_LENGTH + " bytes");
        return key;
    }

    private static byte[] toLittleEndian(BigInteger v) {
        byte[] be = v.toByteArray();
        byte[] out = new byte[KEY_LENGTH];
        for (int i = 0; i < KEY_LENGTH && i < be.length; i++) {
            out[i] = be[be.length - 1 - i];
        }
        return out;
    }

    private static byte[] reverse(byte[] in) {
        byte[] out = new byte[in.length];
        for (int i = 0; i < in.length; i++) out[i] = in[in.length - 1 - i];
        return out;
    }
}
