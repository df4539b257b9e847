package com.titiplex.mist.core.session;

import com.titiplex.mist.core.contacts.ContactDirectory;
import com.titiplex.mist.core.crypto.IdentityService;
import com.titiplex.mist.core.crypto.engine.CryptoEngine;
import com.titiplex.mist.core.crypto.engine.CryptoException;
import com.titiplex.mist.core.crypto.engine.InitiatorAgreement;
import com.titiplex.mist.core.crypto.engine.OneTimePrekey;
import com.titiplex.mist.core.crypto.engine.PrekeyBundle;
import com.titiplex.mist.core.crypto.engine.RatchetMessage;
import com.titiplex.mist.core.crypto.engine.RatchetSession;
import com.titiplex.mist.core.crypto.engine.SignatureInvalidException;
import com.titiplex.mist.core.crypto.engine.SignedPrekey;
import com.titiplex.mist.core.model.ContactRecord;
import com.titiplex.mist.core.model.PeerKey;
import com.titiplex.mist.core.model.TrustOrigin;
import com.titiplex.mist.core.store.Repository;
import com.titiplex.mist.core.store.StoreException;
import com.titiplex.mist.core.store.StoredSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

// au plus une session par pair ; chaque mutation est persistée avant de rendre la main, sinon annulée
@Service
public class SessionManager {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final CryptoEngine engine;
    private final IdentityService identity;
    private final ContactDirectory contacts;
    private final Repository repo;
    private final Map<PeerKey, PeerSession> sessions = new ConcurrentHashMap<>();

    public SessionManager(CryptoEngine engine, IdentityService identity, ContactDirectory contacts, Repository repo) {
        this.engine = engine;
        this.identity = identity;
        this.contacts = contacts;
        this.repo = repo;
    }

    public synchronized int restore() {
        sessions.clear();
        for (StoredSession s : repo.listSessions()) {
            try {
                sessions.put(s.peer(), PeerSession.restore(engine, s.peer(), s.state(), s.version()));
            } catch (CryptoException e) {
                log.error("Session for {} could not be restored: {}", s.peer(), e.getMessage());
            }
        }
        log.info("{} session(s) restored", sessions.size());
        return sessions.size();
    }

    public HandshakeMaterial initiateHandshake(PeerKey peer, PrekeyBundle bundle) {
        return initiateHandshake(peer, bundle, peer.shortId(), TrustOrigin.SHARED_LINK);
    }

    public synchronized HandshakeMaterial initiateHandshake(PeerKey peer, PrekeyBundle bundle,
                                                            String displayName, TrustOrigin origin) {
        if (sessions.containsKey(peer))
            throw new AlreadyEstablishedException(peer, "Session with " + peer + " already exists");
        if (!Arrays.equals(bundle.identityKey(), peer.bytes()))
            throw new SignatureInvalidException("Prekey bundle does not belong to " + peer);

        InitiatorAgreement agreement = engine.initiatorAgree(identity.identity(), bundle);
        RatchetSession ratchet = engine.initInitiator(agreement.sharedSecret(), bundle.signedPrekey());
        HandshakeMaterial material = new HandshakeMaterial(agreement.ephemeralPublicKey(), bundle.signedPrekeyId(),
                agreement.usedOneTimePrekeyId());

        PeerSession ps = new PeerSession(peer, SessionRole.INITIATOR, SessionPhase.HANDSHAKE_SENT, ratchet, material);
        register(ps);
        contacts.addIfAbsent(new ContactRecord(peer, displayName, origin, System.currentTimeMillis()));
        log.info("Handshake initiated with {} (spk={}, opk={})", peer, material.signedPrekeyId(),
                material.oneTimePrekeyId());
        return material;
    }

    public boolean acceptHandshake(PeerKey peer, HandshakeMaterial material) {
        return acceptHandshake(peer, material, peer.shortId(), TrustOrigin.SHARED_LINK);
    }

    public synchronized boolean acceptHandshake(PeerKey peer, HandshakeMaterial material,
                                                String displayName, TrustOrigin origin) {
        if (sessions.containsKey(peer)) {
            log.info("Duplicate handshake from {} ignored", peer);
            return false;
        }
        SignedPrekey spk = identity.findSignedPrekey(material.signedPrekeyId())
                .orElseThrow(() -> new HandshakeRejectedException(peer,
                        "Unknown signed prekey " + material.signedPrekeyId()));
        OneTimePrekey otk = null;
        if (material.oneTimePrekeyId() != null) {
            otk = identity.findOneTimePrekey(material.oneTimePrekeyId())
                    .orElseThrow(() -> new HandshakeRejectedException(peer,
                            "Unknown or already used one-time prekey " + material.oneTimePrekeyId()));
        }

        RatchetSession ratchet;
        try {
            byte[] ss = engine.responderAgree(identity.identity(), spk, otk, peer.bytes(), material.ephemeralKey());
            ratchet = engine.initResponder(ss, spk.privateKey(), spk.publicKey(), material.ephemeralKey());
        } catch (CryptoException e) {
            throw new HandshakeRejectedException(peer, "Key agreement failed: " + e.getMessage());
        }

        PeerSession ps = new PeerSession(peer, SessionRole.RESPONDER, SessionPhase.HANDSHAKE_RECEIVED, ratchet, null);
        register(ps);
        if (otk != null) identity.consumeOneTimePrekey(otk.id());
        contacts.addIfAbsent(new ContactRecord(peer, displayName, origin, System.currentTimeMillis()));
        log.info("Handshake accepted from {} (spk={}, opk={})", peer, material.signedPrekeyId(),
                material.oneTimePrekeyId());
        return true;
    }

    public RatchetMessage encryptFor(PeerKey peer, byte[] plaintext) {
        PeerSession ps = require(peer);
        ps.lock.lock();
        try {
            if (ps.destroyed) throw missing(peer);
            if (ps.phase == SessionPhase.ESTABLISHED_AWAITING_FIRST_MESSAGE || !ps.ratchet.canSend())
                throw new RoleOrderingViolationException(peer,
                        "Responder cannot send to " + peer + " before receiving a first message");
            byte[] before = ps.snapshot();
            long previousVersion = ps.version;
            RatchetMessage msg = ps.ratchet.encrypt(plaintext);
            persistOrRollback(ps, before, previousVersion);
            return msg;
        } finally {
            ps.lock.unlock();
        }
    }

    // un échec de déchiffrement laisse la session inchangée
    public byte[] decryptFrom(PeerKey peer, RatchetMessage message) {
        PeerSession ps = require(peer);
        ps.lock.lock();
        try {
            if (ps.destroyed) throw missing(peer);
            byte[] before = ps.snapshot();
            long previousVersion = ps.version;
            byte[] plaintext = ps.ratchet.decrypt(message);
            if (ps.phase == SessionPhase.ESTABLISHED_AWAITING_FIRST_MESSAGE) {
                ps.phase = SessionPhase.ESTABLISHED;
                log.info("Session with {} fully established", peer);
            }
            if (ps.role == SessionRole.INITIATOR) ps.acknowledged = true;
            persistOrRollback(ps, before, previousVersion);
            return plaintext;
        } finally {
            ps.lock.unlock();
        }
    }

    public Optional<HandshakeMaterial> pendingHandshake(PeerKey peer) {
        PeerSession ps = sessions.get(peer);
        if (ps == null || ps.role != SessionRole.INITIATOR) return Optional.empty();
        ps.lock.lock();
        try {
            return ps.acknowledged ? Optional.empty() : Optional.ofNullable(ps.handshake);
        } finally {
            ps.lock.unlock();
        }
    }

    public boolean hasSession(PeerKey peer) {
        return sessions.containsKey(peer);
    }

    public SessionPhase phaseOf(PeerKey peer) {
        PeerSession ps = sessions.get(peer);
        return ps == null ? SessionPhase.NO_SESSION : ps.phase;
    }

    public boolean isEstablished(PeerKey peer) {
        return phaseOf(peer).isEstablished();
    }

    public Optional<SessionRole> roleOf(PeerKey peer) {
        PeerSession ps = sessions.get(peer);
        return ps == null ? Optional.empty() : Optional.of(ps.role);
    }

    public List<PeerKey> peers() {
        return new ArrayList<>(sessions.keySet());
    }

    // attend la fin d'un chiffrement ou déchiffrement en cours sur ce pair
    public synchronized void removePeer(PeerKey peer) {
        boolean removed = destroy(peer);
        repo.deleteSession(peer);
        contacts.remove(peer);
        if (removed) log.info("Session with {} removed", peer);
    }

    public synchronized void discardSession(PeerKey peer) {
        if (destroy(peer)) {
            repo.deleteSession(peer);
            log.info("Unconfirmed session with {} discarded", peer);
        }
    }

    public synchronized void clear() {
        for (PeerKey peer : peers()) destroy(peer);
        contacts.clear();
    }

    public void flush() {
        repo.flush();
    }

    private PeerSession require(PeerKey peer) {
        PeerSession ps = sessions.get(peer);
        if (ps != null) return ps;
        throw missing(peer);
    }

    private SessionException missing(PeerKey peer) {
        if (contacts.isKnown(peer))
            return new NoSessionException(peer, "Known contact " + peer + " has no session");
        return new UnknownSenderException(peer, "No contact and no session for " + peer);
    }

    private boolean destroy(PeerKey peer) {
        PeerSession ps = sessions.get(peer);
        if (ps == null) return false;
        ps.lock.lock();
        try {
            ps.destroyed = true;
            sessions.remove(peer, ps);
        } finally {
            ps.lock.unlock();
        }
        return true;
    }

    private void register(PeerSession ps) {
        ps.version = 1;
        repo.saveSession(new StoredSession(ps.peer, ps.role.name(), ps.snapshot(), ps.version,
                System.currentTimeMillis()));
        sessions.put(ps.peer, ps);
        ps.phase = PeerSession.settled(ps.phase);
    }

    private void persistOrRollback(PeerSession ps, byte[] before, long previousVersion) {
        if (ps.destroyed || sessions.get(ps.peer) != ps) return;
        ps.version = previousVersion + 1;
        try {
            repo.saveSession(new StoredSession(ps.peer, ps.role.name(), ps.snapshot(), ps.version,
                    System.currentTimeMillis()));
        } catch (StoreException e) {
            ps.rollback(engine, before, previousVersion);
            throw e;
        }
    }
}
