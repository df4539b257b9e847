package com.titiplex.mist.core.verification;

import com.titiplex.mist.core.crypto.engine.PrekeyBundle;
import com.titiplex.mist.core.model.PeerKey;

import java.util.Base64;

public record ContactCard(
        int v,
        String pk,       // identité Ed25519, base64
        String spk,      // prekey signé X25519, base64
        int spkId,
        String sig,      // signature du prekey par l'identité
        String opk,
        Integer opkId,
        String name
) {
    public static final int VERSION = 1;

    public static ContactCard of(PrekeyBundle b, String name) {
        Base64.Encoder enc = Base64.getEncoder();
        return new ContactCard(VERSION, enc.encodeToString(b.identityKey()), enc.encodeToString(b.signedPrekey()),
                b.signedPrekeyId(), enc.encodeToString(b.signedPrekeySignature()),
                b.hasOneTimePrekey() ? enc.encodeToString(b.oneTimePrekey()) : null,
                b.hasOneTimePrekey() ? b.oneTimePrekeyId() : null,
                name);
    }

    public PeerKey peerKey() {
        return PeerKey.fromBase64(pk);
    }

    public PrekeyBundle bundle() {
        Base64.Decoder dec = Base64.getDecoder();
        boolean withOpk = opk != null && opkId != null;
        return new PrekeyBundle(dec.decode(pk), spkId, dec.decode(spk), dec.decode(sig),
                withOpk ? opkId : null, withOpk ? dec.decode(opk) : null);
    }

    public void validate() {
        if (v != VERSION) throw new InviteException("unsupported card version " + v);
        try {
            Base64.Decoder dec = Base64.getDecoder();
            if (pk == null || dec.decode(pk).length != 32) throw new InviteException("bad identity key");
            if (spk == null || dec.decode(spk).length != 32) throw new InviteException("bad signed prekey");
            if (sig == null || dec.decode(sig).length != 64) throw new InviteException("bad prekey signature");
            if (opk != null && dec.decode(opk).length != 32) throw new InviteException("bad one-time prekey");
        } catch (IllegalArgumentException e) {
            throw new InviteException("card field is not base64", e);
        }
        if (spkId <= 0) throw new InviteException("bad signed prekey id");
        if (name != null && name.length() > 64) throw new InviteException("name too long");
    }
}
