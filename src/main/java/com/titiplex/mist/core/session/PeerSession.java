package com.titiplex.mist.core.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.titiplex.mist.core.crypto.engine.CryptoEngine;
import com.titiplex.mist.core.crypto.engine.CryptoException;
import com.titiplex.mist.core.crypto.engine.RatchetSession;
import com.titiplex.mist.core.model.PeerKey;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.locks.ReentrantLock;

final class PeerSession {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    final PeerKey peer;
    final SessionRole role;
    final ReentrantLock lock = new ReentrantLock();

    SessionPhase phase;
    RatchetSession ratchet;
    long version;
    // initiateur : vrai dès le premier message reçu du répondeur
    boolean acknowledged;
    HandshakeMaterial handshake;
    // retirée du registre : plus rien ne doit être persisté pour elle
    boolean destroyed;

    PeerSession(PeerKey peer, SessionRole role, SessionPhase phase, RatchetSession ratchet, HandshakeMaterial handshake) {
        this.peer = peer;
        this.role = role;
        this.phase = phase;
        this.ratchet = ratchet;
        this.handshake = handshake;
    }

    static SessionPhase settled(SessionPhase phase) {
        return switch (phase) {
            case HANDSHAKE_SENT -> SessionPhase.ESTABLISHED;
            case HANDSHAKE_RECEIVED -> SessionPhase.ESTABLISHED_AWAITING_FIRST_MESSAGE;
            default -> phase;
        };
    }

    byte[] snapshot() {
        Snapshot s = new Snapshot();
        s.role = role;
        s.phase = settled(phase);
        s.acknowledged = acknowledged;
        if (handshake != null) {
            s.handshakeEphemeral = handshake.ephemeralKey();
            s.handshakeSignedPrekeyId = handshake.signedPrekeyId();
            s.handshakeOneTimePrekeyId = handshake.oneTimePrekeyId();
        }
        s.ratchet = ratchet.serialize();
        try {
            return MAPPER.writeValueAsBytes(s);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    void rollback(CryptoEngine engine, byte[] snapshot, long previousVersion) {
        Snapshot s = read(snapshot);
        ratchet = engine.deserialize(s.ratchet);
        phase = s.phase;
        acknowledged = s.acknowledged;
        version = previousVersion;
    }

    static PeerSession restore(CryptoEngine engine, PeerKey peer, byte[] snapshot, long version) {
        Snapshot s = read(snapshot);
        if (s.role == null || s.phase == null || s.ratchet == null)
            throw new CryptoException("Incomplete session snapshot for " + peer);
        HandshakeMaterial hm = s.handshakeEphemeral == null ? null
                : new HandshakeMaterial(s.handshakeEphemeral, s.handshakeSignedPrekeyId, s.handshakeOneTimePrekeyId);
        PeerSession ps = new PeerSession(peer, s.role, settled(s.phase), engine.deserialize(s.ratchet), hm);
        ps.acknowledged = s.acknowledged;
        ps.version = version;
        return ps;
    }

    private static Snapshot read(byte[] bytes) {
        try {
            return MAPPER.readValue(bytes, Snapshot.class);
        } catch (IOException e) {
            throw new CryptoException("Unreadable session snapshot", e);
        }
    }

    public static class Snapshot {
        public SessionRole role;
        public SessionPhase phase;
        public boolean acknowledged;
        public byte[] handshakeEphemeral;
        public int handshakeSignedPrekeyId;
        public Integer handshakeOneTimePrekeyId;
        public byte[] ratchet;
    }
}
