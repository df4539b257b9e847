package com.titiplex.mist.core.transport;

import com.titiplex.mist.core.loop.EventLoop;
import com.titiplex.mist.core.model.PeerKey;
import com.titiplex.mist.core.signaling.EnvelopeType;
import com.titiplex.mist.core.signaling.SignalingChannel;
import com.titiplex.mist.core.signaling.SignalingEnvelope;
import com.titiplex.mist.core.signaling.Subscription;
import com.titiplex.mist.core.signaling.payload.RelayedCiphertextPayload;
import com.titiplex.mist.core.signaling.payload.TransportAnswerPayload;
import com.titiplex.mist.core.signaling.payload.TransportIcePayload;
import com.titiplex.mist.core.signaling.payload.TransportOfferPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

// collision d'offres : la plus petite clé (base64) garde son offre, l'autre répond
@Service
public class TransportRouter {
    private static final Logger log = LoggerFactory.getLogger(TransportRouter.class);

    public interface Listener {
        void onCiphertext(PeerKey peer, byte[] bytes);

        void onLinkStateChanged(PeerKey peer, LinkPhase phase);
    }

    private final SignalingChannel signaling;
    private final DirectChannelFactory channels;
    private final EventLoop loop;
    private final long negotiationTimeoutMs;
    private final long idleTimeoutMs;

    private final Map<PeerKey, TransportLink> links = new HashMap<>();
    private final List<Subscription> subscriptions = new ArrayList<>();
    private PeerKey self;
    private Listener listener;
    private EventLoop.Handle idleSweep;
    private boolean candidateSinkRegistered;

    public TransportRouter(SignalingChannel signaling, DirectChannelFactory channels, EventLoop loop,
                           @Value("${app.transport.negotiation-timeout-ms:10000}") long negotiationTimeoutMs,
                           @Value("${app.transport.idle-timeout-ms:300000}") long idleTimeoutMs) {
        this.signaling = signaling;
        this.channels = channels;
        this.loop = loop;
        this.negotiationTimeoutMs = negotiationTimeoutMs;
        this.idleTimeoutMs = idleTimeoutMs;
    }

    public synchronized void start(PeerKey selfKey, Listener listener) {
        this.self = selfKey;
        this.listener = listener;
        if (!subscriptions.isEmpty()) return;
        subscriptions.add(signaling.subscribe(EnvelopeType.TRANSPORT_OFFER, this::onOffer));
        subscriptions.add(signaling.subscribe(EnvelopeType.TRANSPORT_ANSWER, this::onAnswer));
        subscriptions.add(signaling.subscribe(EnvelopeType.TRANSPORT_ICE, this::onIce));
        subscriptions.add(signaling.subscribe(EnvelopeType.RELAYED_CIPHERTEXT, this::onRelayed));
        if (!candidateSinkRegistered) {
            candidateSinkRegistered = true;
            channels.onLateCandidate(c -> loop.execute(() -> announceLocalCandidate(c)));
        }
        long period = Math.max(1000, Math.min(idleTimeoutMs / 2, 30_000));
        idleSweep = loop.scheduleAtFixedRate(this::sweepIdle, period, period);
    }

    public synchronized boolean connect(PeerKey peer) {
        TransportLink existing = links.get(peer);
        if (existing != null && (existing.phase == LinkPhase.NEGOTIATING || existing.phase == LinkPhase.OPEN))
            return false;
        TransportLink link = new TransportLink(peer, UUID.randomUUID().toString(), true, loop.now());
        links.put(peer, link);
        notifyPhase(link);
        boolean sent = signaling.send(EnvelopeType.TRANSPORT_OFFER, peer,
                new TransportOfferPayload(link.linkId(), channels.localCandidates()));
        if (!sent) log.warn("Transport offer to {} not published, link will time out", peer);
        armTimeout(link);
        log.debug("Offer {} sent to {}", link.linkId(), peer);
        return true;
    }

    public synchronized boolean send(PeerKey peer, byte[] bytes) {
        TransportLink link = links.get(peer);
        if (link != null && link.phase == LinkPhase.OPEN && link.channel != null) {
            if (link.channel.send(bytes)) {
                link.lastActivity = loop.now();
                return true;
            }
            log.debug("Direct send to {} failed, falling back to relay", peer);
        }
        return signaling.send(EnvelopeType.RELAYED_CIPHERTEXT, peer, RelayedCiphertextPayload.of(bytes));
    }

    public synchronized void disconnect(PeerKey peer) {
        TransportLink link = links.get(peer);
        if (link != null && link.phase != LinkPhase.CLOSED) {
            log.info("Closing link to {}", peer);
            closeLink(link);
        }
    }

    public synchronized void closeAll() {
        if (idleSweep != null) {
            idleSweep.cancel();
            idleSweep = null;
        }
        for (TransportLink link : new ArrayList<>(links.values())) {
            if (link.phase != LinkPhase.CLOSED) closeLink(link);
        }
        subscriptions.forEach(Subscription::unsubscribe);
        subscriptions.clear();
    }

    public synchronized LinkPhase phaseOf(PeerKey peer) {
        TransportLink link = links.get(peer);
        return link == null ? LinkPhase.IDLE : link.phase;
    }

    public synchronized String linkIdOf(PeerKey peer) {
        TransportLink link = links.get(peer);
        return link == null ? null : link.linkId();
    }

    public synchronized void announceLocalCandidate(String candidate) {
        for (TransportLink link : links.values()) {
            if (link.phase != LinkPhase.NEGOTIATING) continue;
            signaling.send(EnvelopeType.TRANSPORT_ICE, link.peer(), new TransportIcePayload(link.linkId(), candidate));
        }
    }

    // ---------- Gestionnaires de signalisation (boucle d'événements) ----------

    synchronized void onOffer(SignalingEnvelope env) {
        PeerKey peer = env.from();
        TransportOfferPayload offer = env.payload(TransportOfferPayload.class);
        TransportLink link = links.get(peer);

        String abandoned = null;
        if (link != null && link.phase != LinkPhase.CLOSED) {
            if (link.linkId().equals(offer.linkId())) return; // doublon
            if (offer.linkId().equals(link.abandonedRemoteLinkId)) {
                log.debug("Late offer {} from {} was abandoned in a glare, ignored", offer.linkId(), peer);
                return;
            }
        }
        if (link != null && link.phase == LinkPhase.NEGOTIATING) {
            if (link.initiatedLocally()) {
                if (self.compareTo(peer) < 0) {
                    log.debug("Glare with {}: our offer wins, incoming {} ignored", peer, offer.linkId());
                    return;
                }
                log.debug("Glare with {}: dropping our offer {} for {}", peer, link.linkId(), offer.linkId());
                abandoned = link.linkId();
            }
            discard(link);
        } else if (link != null && link.phase == LinkPhase.OPEN) {
            log.info("Fresh offer from {} supersedes open link {}", peer, link.linkId());
            discard(link);
        }

        TransportLink answer = new TransportLink(peer, offer.linkId(), false, loop.now());
        links.put(peer, answer);
        notifyPhase(answer);
        if (!openChannel(answer, offer.candidates())) return;
        signaling.send(EnvelopeType.TRANSPORT_ANSWER, peer,
                new TransportAnswerPayload(answer.linkId(), channels.localCandidates(), abandoned));
        armTimeout(answer);
    }

    synchronized void onAnswer(SignalingEnvelope env) {
        PeerKey peer = env.from();
        TransportAnswerPayload answer = env.payload(TransportAnswerPayload.class);
        TransportLink link = links.get(peer);
        if (link == null || link.phase != LinkPhase.NEGOTIATING || !link.initiatedLocally()
                || !link.linkId().equals(answer.linkId())) {
            log.debug("Stale answer {} from {} ignored", answer.linkId(), peer);
            return;
        }
        if (link.channel != null) return; // doublon
        link.abandonedRemoteLinkId = answer.abandonedLinkId();
        openChannel(link, answer.candidates());
    }

    synchronized void onIce(SignalingEnvelope env) {
        TransportIcePayload ice = env.payload(TransportIcePayload.class);
        TransportLink link = links.get(env.from());
        if (link == null || link.phase != LinkPhase.NEGOTIATING || !link.linkId().equals(ice.linkId())) return;
        if (link.channel != null) link.channel.addCandidate(ice.candidate());
    }

    void onRelayed(SignalingEnvelope env) {
        byte[] bytes = env.payload(RelayedCiphertextPayload.class).bytes();
        Listener l;
        synchronized (this) {
            l = listener;
        }
        if (l != null) l.onCiphertext(env.from(), bytes);
    }

    // ---------- Interne ----------

    private boolean openChannel(TransportLink link, List<String> remoteCandidates) {
        try {
            link.channel = channels.open(link.linkId(), link.peer(), remoteCandidates, new LinkListener(link));
            return true;
        } catch (IOException e) {
            log.warn("Direct channel {} to {} cannot be opened: {}", link.linkId(), link.peer(), e.getMessage());
            closeLink(link);
            return false;
        }
    }

    private void armTimeout(TransportLink link) {
        link.timeout = loop.schedule(() -> onNegotiationTimeout(link), negotiationTimeoutMs);
    }

    private synchronized void onNegotiationTimeout(TransportLink link) {
        if (links.get(link.peer()) != link || link.phase != LinkPhase.NEGOTIATING) return;
        log.info("Negotiation of {} with {} timed out, relay only", link.linkId(), link.peer());
        closeLink(link);
    }

    synchronized void sweepIdle() {
        long now = loop.now();
        for (TransportLink link : new ArrayList<>(links.values())) {
            if (link.phase == LinkPhase.OPEN && now - link.lastActivity > idleTimeoutMs) {
                log.info("Link {} with {} idle for {} ms, closing", link.linkId(), link.peer(), now - link.lastActivity);
                closeLink(link);
            }
        }
    }

    // abandon silencieux : le lien remplaçant annonce la nouvelle phase
    private void discard(TransportLink link) {
        cancelTimeout(link);
        link.phase = LinkPhase.CLOSED;
        if (link.channel != null) link.channel.close();
    }

    private void closeLink(TransportLink link) {
        cancelTimeout(link);
        link.phase = LinkPhase.CLOSED;
        if (link.channel != null) link.channel.close();
        notifyPhase(link);
    }

    private void cancelTimeout(TransportLink link) {
        if (link.timeout != null) {
            link.timeout.cancel();
            link.timeout = null;
        }
    }

    private void notifyPhase(TransportLink link) {
        if (listener == null) return;
        try {
            listener.onLinkStateChanged(link.peer(), link.phase);
        } catch (RuntimeException e) {
            log.error("Link state listener failed for {}", link.peer(), e);
        }
    }

    private boolean isCurrent(TransportLink link) {
        return links.get(link.peer()) == link && link.phase != LinkPhase.CLOSED;
    }

    private final class LinkListener implements DirectChannel.Listener {
        private final TransportLink link;

        LinkListener(TransportLink link) {
            this.link = link;
        }

        @Override
        public void onOpen() {
            loop.execute(() -> {
                synchronized (TransportRouter.this) {
                    if (!isCurrent(link) || link.phase == LinkPhase.OPEN) return;
                    cancelTimeout(link);
                    link.phase = LinkPhase.OPEN;
                    link.lastActivity = loop.now();
                    log.info("Direct link {} with {} open", link.linkId(), link.peer());
                    notifyPhase(link);
                }
            });
        }

        @Override
        public void onData(byte[] bytes) {
            loop.execute(() -> {
                Listener l;
                synchronized (TransportRouter.this) {
                    if (links.get(link.peer()) != link) return;
                    link.lastActivity = loop.now();
                    l = listener;
                }
                if (l != null) l.onCiphertext(link.peer(), bytes);
            });
        }

        @Override
        public void onClosed(String reason) {
            loop.execute(() -> {
                synchronized (TransportRouter.this) {
                    if (!isCurrent(link)) return;
                    log.info("Direct link {} with {} closed: {}", link.linkId(), link.peer(), reason);
                    closeLink(link);
                }
            });
        }
    }
}
