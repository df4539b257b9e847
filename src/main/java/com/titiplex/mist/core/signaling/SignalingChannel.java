package com.titiplex.mist.core.signaling;

import com.titiplex.mist.core.loop.EventLoop;
import com.titiplex.mist.core.model.PeerKey;
import com.titiplex.mist.core.signaling.payload.SignalingPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

// best effort, au moins une fois, sans ordre entre émetteurs
@Service
public class SignalingChannel implements SignalingTransport.Listener {
    private static final Logger log = LoggerFactory.getLogger(SignalingChannel.class);

    private final SignalingTransport transport;
    private final EventLoop loop;
    private final EnvelopeCodec codec;
    private final int connectAttempts;
    private final long backoffInitialMs;
    private final long backoffMaxMs;

    private final Map<EnvelopeType, List<SignalingHandler>> handlers = new ConcurrentHashMap<>();
    private final List<SignalingHandler> wildcard = new CopyOnWriteArrayList<>();
    private final List<Consumer<ConnectionState>> stateListeners = new CopyOnWriteArrayList<>();
    private final Set<String> groups = ConcurrentHashMap.newKeySet();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile PeerKey self;
    private volatile boolean closing;
    private EventLoop.Handle reconnectTimer;

    public SignalingChannel(SignalingTransport transport, EventLoop loop, EnvelopeCodec codec,
                            @Value("${app.signaling.connect-attempts:5}") int connectAttempts,
                            @Value("${app.signaling.backoff-initial-ms:500}") long backoffInitialMs,
                            @Value("${app.signaling.backoff-max-ms:30000}") long backoffMaxMs) {
        this.transport = transport;
        this.loop = loop;
        this.codec = codec;
        this.connectAttempts = Math.max(1, connectAttempts);
        this.backoffInitialMs = Math.max(1, backoffInitialMs);
        this.backoffMaxMs = Math.max(this.backoffInitialMs, backoffMaxMs);
    }

    public synchronized void connect(PeerKey selfKey) {
        if (state == ConnectionState.CONNECTED && selfKey.equals(self) && transport.isOpen()) return;
        this.self = selfKey;
        this.closing = false;
        setState(ConnectionState.CONNECTING);

        long delay = backoffInitialMs;
        IOException last = null;
        for (int attempt = 1; attempt <= connectAttempts; attempt++) {
            try {
                openAndSubscribe();
                setState(ConnectionState.CONNECTED);
                log.info("Signaling connected as {} (attempt {})", selfKey, attempt);
                return;
            } catch (IOException e) {
                last = e;
                log.warn("Signaling connect attempt {}/{} failed: {}", attempt, connectAttempts, e.getMessage());
                if (attempt < connectAttempts) {
                    if (!pause(delay)) break;
                    delay = Math.min(delay * 2, backoffMaxMs);
                }
            }
        }
        setState(ConnectionState.ERROR);
        throw new SignalingUnavailableException("Signaling unavailable after " + connectAttempts + " attempts", last);
    }

    public boolean send(EnvelopeType type, PeerKey recipient, SignalingPayload payload) {
        String address = recipient == null ? SignalingAddresses.BROADCAST : SignalingAddresses.inbox(recipient);
        return publish(address, type, recipient, payload);
    }

    public boolean sendToGroup(String groupId, EnvelopeType type, SignalingPayload payload) {
        return publish(SignalingAddresses.group(groupId), type, null, payload);
    }

    public Subscription subscribe(EnvelopeType type, SignalingHandler handler) {
        List<SignalingHandler> list = handlers.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>());
        list.add(handler);
        return () -> list.remove(handler);
    }

    public Subscription subscribeAll(SignalingHandler handler) {
        wildcard.add(handler);
        return () -> wildcard.remove(handler);
    }

    public void joinGroup(String groupId) {
        String address = SignalingAddresses.group(groupId);
        if (groups.add(groupId) && transport.isOpen()) transport.subscribe(address);
    }

    public void leaveGroup(String groupId) {
        if (groups.remove(groupId) && transport.isOpen()) transport.unsubscribe(SignalingAddresses.group(groupId));
    }

    public void addStateListener(Consumer<ConnectionState> listener) {
        stateListeners.add(listener);
    }

    public ConnectionState state() {
        return state;
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    public synchronized void disconnect() {
        closing = true;
        if (reconnectTimer != null) {
            reconnectTimer.cancel();
            reconnectTimer = null;
        }
        transport.close();
        setState(ConnectionState.DISCONNECTED);
        log.info("Signaling disconnected");
    }

    // ---------- Transport.Listener (threads du transport) ----------

    @Override
    public void onFrame(String address, byte[] payload) {
        loop.execute(() -> dispatch(address, payload));
    }

    @Override
    public void onDropped(Throwable cause) {
        loop.execute(() -> {
            synchronized (this) {
                if (closing || state == ConnectionState.RECONNECTING) return;
                log.warn("Signaling transport dropped: {}", cause == null ? "unknown cause" : cause.getMessage());
                setState(ConnectionState.RECONNECTING);
                scheduleReconnect(backoffInitialMs);
            }
        });
    }

    // ---------- Interne ----------

    private boolean publish(String address, EnvelopeType type, PeerKey recipient, SignalingPayload payload) {
        PeerKey from = self;
        if (from == null || state != ConnectionState.CONNECTED) {
            log.debug("Signaling not connected, {} to {} dropped", type.wireName(), address);
            return false;
        }
        payload.validate();
        byte[] frame = codec.encode(new SignalingEnvelope(type, from, recipient, payload, loop.now()));
        return transport.publish(address, frame);
    }

    void dispatch(String address, byte[] bytes) {
        SignalingEnvelope env;
        try {
            env = codec.decode(bytes);
        } catch (InvalidEnvelopeException e) {
            log.warn("Invalid envelope on {} dropped: {}", address, e.getMessage());
            return;
        }
        if (env.from().equals(self)) return;
        if (env.to() != null && !env.to().equals(self)) {
            log.debug("Envelope for {} received on {}, ignored", env.to(), address);
            return;
        }
        invoke(handlers.getOrDefault(env.type(), List.of()), env);
        invoke(wildcard, env);
    }

    private void invoke(List<SignalingHandler> list, SignalingEnvelope env) {
        for (SignalingHandler h : list) {
            try {
                h.onEnvelope(env);
            } catch (RuntimeException e) {
                log.error("Handler for {} from {} failed", env.type().wireName(), env.from(), e);
            }
        }
    }

    private void openAndSubscribe() throws IOException {
        transport.close();
        transport.open(this);
        transport.subscribe(SignalingAddresses.inbox(self));
        transport.subscribe(SignalingAddresses.BROADCAST);
        for (String g : groups) transport.subscribe(SignalingAddresses.group(g));
    }

    private void scheduleReconnect(long delayMs) {
        reconnectTimer = loop.schedule(() -> reconnect(delayMs), delayMs);
    }

    private synchronized void reconnect(long lastDelay) {
        if (closing) return;
        try {
            openAndSubscribe();
            reconnectTimer = null;
            setState(ConnectionState.CONNECTED);
            log.info("Signaling reconnected");
        } catch (IOException e) {
            long next = Math.min(lastDelay * 2, backoffMaxMs);
            log.warn("Signaling reconnect failed, retrying in {} ms: {}", next, e.getMessage());
            scheduleReconnect(next);
        }
    }

    private boolean pause(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void setState(ConnectionState next) {
        if (state == next) return;
        state = next;
        for (Consumer<ConnectionState> l : stateListeners) {
            try {
                l.accept(next);
            } catch (RuntimeException e) {
                log.error("Connection state listener failed", e);
            }
        }
    }
}
