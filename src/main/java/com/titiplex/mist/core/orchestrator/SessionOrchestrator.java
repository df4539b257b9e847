package com.titiplex.mist.core.orchestrator;

import com.titiplex.mist.core.config.ConfigService;
import com.titiplex.mist.core.contacts.ContactDirectory;
import com.titiplex.mist.core.crypto.IdentityService;
import com.titiplex.mist.core.crypto.NodeState;
import com.titiplex.mist.core.crypto.engine.CryptoException;
import com.titiplex.mist.core.crypto.engine.RatchetMessage;
import com.titiplex.mist.core.loop.EventLoop;
import com.titiplex.mist.core.model.ContactRecord;
import com.titiplex.mist.core.model.PeerKey;
import com.titiplex.mist.core.model.TrustOrigin;
import com.titiplex.mist.core.session.HandshakeMaterial;
import com.titiplex.mist.core.session.HandshakeRejectedException;
import com.titiplex.mist.core.session.NoSessionException;
import com.titiplex.mist.core.session.SessionManager;
import com.titiplex.mist.core.session.UnknownSenderException;
import com.titiplex.mist.core.signaling.ConnectionState;
import com.titiplex.mist.core.signaling.EnvelopeType;
import com.titiplex.mist.core.signaling.InvalidEnvelopeException;
import com.titiplex.mist.core.signaling.SignalingChannel;
import com.titiplex.mist.core.signaling.SignalingEnvelope;
import com.titiplex.mist.core.signaling.SignalingHandler;
import com.titiplex.mist.core.signaling.SignalingUnavailableException;
import com.titiplex.mist.core.signaling.payload.HandshakeInitPayload;
import com.titiplex.mist.core.signaling.payload.PresencePayload;
import com.titiplex.mist.core.signaling.payload.TypingPayload;
import com.titiplex.mist.core.store.Repository;
import com.titiplex.mist.core.store.StoreException;
import com.titiplex.mist.core.transport.LinkPhase;
import com.titiplex.mist.core.transport.TransportRouter;
import com.titiplex.mist.core.verification.ContactCard;
import com.titiplex.mist.core.verification.InviteCodec;
import com.titiplex.mist.core.verification.InviteException;
import com.titiplex.mist.core.verification.VerificationService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

// les enveloppes reçues avant la fin du démarrage sont traitées ensuite, dans l'ordre
@Service
public class SessionOrchestrator implements TransportRouter.Listener {
    private static final Logger log = LoggerFactory.getLogger(SessionOrchestrator.class);
    private static final long MAINTENANCE_PERIOD_MS = 60 * 60 * 1000L;

    private final NodeState ns;
    private final ConfigService config;
    private final IdentityService identity;
    private final ContactDirectory contacts;
    private final SessionManager sessions;
    private final SignalingChannel signaling;
    private final TransportRouter router;
    private final VerificationService verification;
    private final Repository repo;
    private final EventLoop loop;
    private final String configuredName;
    private final boolean eagerConnect;
    private final long retryInitialMs;
    private final long retryMaxMs;

    private final List<SessionEventListener> listeners = new CopyOnWriteArrayList<>();
    private final List<Runnable> deferred = new ArrayList<>();
    private volatile boolean booted;
    private volatile boolean stopped;
    private boolean handlersRegistered;
    private EventLoop.Handle maintenance;
    private EventLoop.Handle signalingRetry;

    public SessionOrchestrator(NodeState ns, ConfigService config, IdentityService identity,
                               ContactDirectory contacts, SessionManager sessions, SignalingChannel signaling,
                               TransportRouter router, VerificationService verification, Repository repo,
                               EventLoop loop,
                               @Value("${app.display-name:}") String configuredName,
                               @Value("${app.transport.eager-connect:true}") boolean eagerConnect,
                               @Value("${app.signaling.backoff-initial-ms:500}") long retryInitialMs,
                               @Value("${app.signaling.backoff-max-ms:30000}") long retryMaxMs) {
        this.ns = ns;
        this.config = config;
        this.identity = identity;
        this.contacts = contacts;
        this.sessions = sessions;
        this.signaling = signaling;
        this.router = router;
        this.verification = verification;
        this.repo = repo;
        this.loop = loop;
        this.configuredName = configuredName;
        this.eagerConnect = eagerConnect;
        this.retryInitialMs = Math.max(1, retryInitialMs);
        this.retryMaxMs = Math.max(this.retryInitialMs, retryMaxMs);
    }

    public void addListener(SessionEventListener l) {
        listeners.add(l);
    }

    public void removeListener(SessionEventListener l) {
        listeners.remove(l);
    }

    // ---------- Cycle de vie ----------

    public synchronized void start() {
        if (booted) return;
        stopped = false;
        config.tryRestore(ns);
        identity.ensureIdentity(ns, configuredName);
        identity.ensurePrekeys();
        identity.rotateSignedPrekeyIfDue(loop.now());

        contacts.restore();
        sessions.restore();

        registerHandlers();

        try {
            signaling.connect(ns.self());
        } catch (SignalingUnavailableException e) {
            log.warn("Signaling unavailable at boot, retrying in background: {}", e.getMessage());
            scheduleSignalingRetry(retryInitialMs);
        }
        config.saveProfile(ns);

        maintenance = loop.scheduleAtFixedRate(this::maintain, MAINTENANCE_PERIOD_MS, MAINTENANCE_PERIOD_MS);
        booted = true;
        loop.execute(this::drainDeferred);
        if (signaling.isConnected()) loop.execute(this::onSignalingUp);
        log.info("Node {} ({}) started", ns.self(), ns.displayName);
    }

    @PreDestroy
    public synchronized void stop() {
        if (!booted || stopped) return;
        stopped = true;
        booted = false;
        if (maintenance != null) maintenance.cancel();
        if (signalingRetry != null) signalingRetry.cancel();
        signaling.send(EnvelopeType.PRESENCE, null, new PresencePayload(false));
        router.closeAll();
        signaling.disconnect();
        sessions.flush();
        repo.close();
        log.info("Node {} stopped", ns.self());
    }

    public boolean isStarted() {
        return booted;
    }

    public PeerKey self() {
        return ns.self();
    }

    // ---------- Façade ----------

    public boolean sendPlaintext(PeerKey peer, byte[] plaintext) {
        RatchetMessage message = sessions.encryptFor(peer, plaintext);
        HandshakeInitPayload handshake = sessions.pendingHandshake(peer)
                .map(m -> HandshakeInitPayload.of(m, ns.displayName, originOf(peer)))
                .orElse(null);
        return router.send(peer, new CiphertextFrame(handshake, message).toBytes());
    }

    public PeerKey addContact(ContactCard card, TrustOrigin origin) {
        card.validate();
        PeerKey peer = card.peerKey();
        if (peer.equals(ns.self())) throw new InviteException("cannot add own card");
        boolean known = contacts.isKnown(peer);
        String name = card.name() == null || card.name().isBlank() ? peer.shortId() : card.name();
        HandshakeMaterial material = sessions.initiateHandshake(peer, card.bundle(), name, origin);
        if (!signaling.send(EnvelopeType.HANDSHAKE_INIT, peer, HandshakeInitPayload.of(material, ns.displayName, origin)))
            log.info("Handshake to {} not published now, it will ride along the first message", peer);
        if (!known) fire(l -> l.onFriendAdded(peer, origin));
        if (eagerConnect) router.connect(peer);
        return peer;
    }

    public PeerKey acceptInvite(String link) {
        InviteCodec.Parsed parsed = verification.parse(link, loop.now());
        return addContact(parsed.card(), VerificationService.originOf(parsed.kind()));
    }

    public PeerKey scanCard(String cardJson) {
        return addContact(verification.parseCard(cardJson), TrustOrigin.DIRECT_VERIFICATION);
    }

    public ContactCard localCard() {
        return verification.localCard();
    }

    public String localCardJson() {
        return verification.localCardJson();
    }

    public String createInvite() {
        return verification.createInvite(loop.now());
    }

    public String createVerificationCode() {
        return verification.createVerificationCode(loop.now());
    }

    public boolean sendTyping(PeerKey peer, boolean typing) {
        if (!contacts.isKnown(peer)) return false;
        return signaling.send(EnvelopeType.TYPING, peer, new TypingPayload(typing));
    }

    public void removeContact(PeerKey peer) {
        router.disconnect(peer);
        sessions.removePeer(peer);
    }

    public List<ContactRecord> contacts() {
        return contacts.list();
    }

    public byte[] exportBackup(String passphrase) {
        return identity.exportBackup(passphrase, ns.displayName);
    }

    public synchronized PeerKey resetIdentity() {
        signaling.send(EnvelopeType.PRESENCE, null, new PresencePayload(false));
        router.closeAll();
        signaling.disconnect();
        sessions.clear();
        identity.resetIdentity(ns);
        router.start(ns.self(), this);
        try {
            signaling.connect(ns.self());
            loop.execute(this::onSignalingUp);
        } catch (SignalingUnavailableException e) {
            log.warn("Signaling unavailable after reset, retrying in background: {}", e.getMessage());
            scheduleSignalingRetry(retryInitialMs);
        }
        return ns.self();
    }

    // ---------- Gestionnaires (boucle d'événements) ----------

    private void registerHandlers() {
        if (handlersRegistered) return;
        handlersRegistered = true;
        signaling.subscribe(EnvelopeType.HANDSHAKE_INIT, afterBoot(this::onHandshakeInit));
        signaling.subscribe(EnvelopeType.PRESENCE, afterBoot(this::onPresence));
        signaling.subscribe(EnvelopeType.TYPING, afterBoot(this::onTyping));
        signaling.addStateListener(this::onConnectionState);
        router.start(ns.self(), this);
    }

    void onHandshakeInit(SignalingEnvelope env) {
        acceptHandshake(env.from(), env.payload(HandshakeInitPayload.class), true);
    }

    private HandshakeOutcome acceptHandshake(PeerKey peer, HandshakeInitPayload p, boolean announce) {
        boolean known = contacts.isKnown(peer);
        String name = p.senderName() == null || p.senderName().isBlank() ? peer.shortId() : p.senderName();
        try {
            if (!sessions.acceptHandshake(peer, p.material(), name, p.trustOrigin())) return HandshakeOutcome.DUPLICATE;
        } catch (HandshakeRejectedException e) {
            log.warn("Handshake from {} rejected: {}", peer, e.getMessage());
            fire(l -> l.onMessageRejected(peer, RejectionReason.HANDSHAKE_REJECTED));
            return HandshakeOutcome.REJECTED;
        }
        if (announce && !known) fire(l -> l.onFriendAdded(peer, p.trustOrigin()));
        return HandshakeOutcome.ACCEPTED;
    }

    @Override
    public void onCiphertext(PeerKey peer, byte[] bytes) {
        if (!booted) {
            defer(() -> onCiphertext(peer, bytes));
            return;
        }
        CiphertextFrame frame;
        try {
            frame = CiphertextFrame.parse(bytes);
            if (frame.handshake() != null) frame.handshake().validate();
        } catch (IllegalArgumentException | InvalidEnvelopeException e) {
            log.warn("Malformed frame from {}: {}", peer, e.getMessage());
            fire(l -> l.onMessageRejected(peer, RejectionReason.MALFORMED));
            return;
        }

        boolean known = contacts.isKnown(peer);
        boolean fresh = false;
        if (frame.handshake() != null && !sessions.hasSession(peer)) {
            // le nouveau contact n'est annoncé qu'une fois le message joint déchiffré
            HandshakeOutcome outcome = acceptHandshake(peer, frame.handshake(), false);
            if (outcome == HandshakeOutcome.REJECTED) return;
            fresh = outcome == HandshakeOutcome.ACCEPTED;
        }

        try {
            byte[] plaintext = sessions.decryptFrom(peer, frame.message());
            if (fresh && !known) {
                TrustOrigin origin = frame.handshake().trustOrigin();
                fire(l -> l.onFriendAdded(peer, origin));
            }
            fire(l -> l.onMessageDecrypted(peer, plaintext));
        } catch (UnknownSenderException e) {
            log.warn("Message from unknown sender {} dropped", peer);
            fire(l -> l.onMessageRejected(peer, RejectionReason.UNKNOWN_SENDER));
        } catch (NoSessionException e) {
            log.warn("Message from {} but no session", peer);
            fire(l -> l.onMessageRejected(peer, RejectionReason.NO_SESSION));
        } catch (CryptoException e) {
            log.warn("Message from {} could not be decrypted: {}", peer, e.getMessage());
            // un handshake joint à un message invalide n'établit rien
            if (fresh) {
                if (known) sessions.discardSession(peer);
                else sessions.removePeer(peer);
            }
            fire(l -> l.onMessageRejected(peer, RejectionReason.DECRYPTION_FAILED));
        } catch (StoreException e) {
            log.error("Message from {} decrypted but session could not be saved", peer, e);
            fire(l -> l.onMessageRejected(peer, RejectionReason.STORAGE_FAILED));
        }
    }

    @Override
    public void onLinkStateChanged(PeerKey peer, LinkPhase phase) {
        fire(l -> l.onTransportStateChanged(peer, phase));
    }

    void onPresence(SignalingEnvelope env) {
        if (!contacts.isKnown(env.from())) return;
        boolean online = env.payload(PresencePayload.class).online();
        fire(l -> l.onPresenceChanged(env.from(), online));
        if (!online) router.disconnect(env.from());
    }

    void onTyping(SignalingEnvelope env) {
        if (!contacts.isKnown(env.from())) return;
        boolean typing = env.payload(TypingPayload.class).typing();
        fire(l -> l.onTyping(env.from(), typing));
    }

    // ---------- Interne ----------

    private void onConnectionState(ConnectionState state) {
        // après une reconnexion on réannonce la présence
        if (state == ConnectionState.CONNECTED && booted) loop.execute(this::onSignalingUp);
    }

    private void onSignalingUp() {
        if (!booted) return;
        signaling.send(EnvelopeType.PRESENCE, null, new PresencePayload(true));
        if (!eagerConnect) return;
        for (PeerKey peer : sessions.peers()) {
            if (sessions.isEstablished(peer)) router.connect(peer);
        }
    }

    private void scheduleSignalingRetry(long delayMs) {
        signalingRetry = loop.schedule(() -> {
            if (stopped) return;
            try {
                signaling.connect(ns.self());
            } catch (SignalingUnavailableException e) {
                long next = Math.min(delayMs * 2, retryMaxMs);
                log.warn("Signaling still unavailable, next attempt in {} ms", next);
                scheduleSignalingRetry(next);
            }
        }, delayMs);
    }

    private void maintain() {
        if (identity.rotateSignedPrekeyIfDue(loop.now())) log.info("Contact cards now carry the new signed prekey");
    }

    private SignalingHandler afterBoot(SignalingHandler h) {
        return env -> {
            if (booted) h.onEnvelope(env);
            else defer(() -> h.onEnvelope(env));
        };
    }

    private void defer(Runnable r) {
        synchronized (deferred) {
            deferred.add(r);
        }
    }

    private void drainDeferred() {
        List<Runnable> pending;
        synchronized (deferred) {
            pending = new ArrayList<>(deferred);
            deferred.clear();
        }
        if (!pending.isEmpty()) log.debug("Processing {} envelope(s) received during boot", pending.size());
        pending.forEach(Runnable::run);
    }

    private TrustOrigin originOf(PeerKey peer) {
        Optional<ContactRecord> c = contacts.find(peer);
        return c.map(ContactRecord::trustOrigin).orElse(TrustOrigin.SHARED_LINK);
    }

    private enum HandshakeOutcome {
        ACCEPTED,
        DUPLICATE,
        REJECTED
    }

    private void fire(Consumer<SessionEventListener> event) {
        for (SessionEventListener l : listeners) {
            try {
                event.accept(l);
            } catch (RuntimeException e) {
                log.error("Session event listener failed", e);
            }
        }
    }
}
