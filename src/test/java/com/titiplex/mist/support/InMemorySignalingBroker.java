package com.titiplex.mist.support;

import com.titiplex.mist.core.signaling.SignalingTransport;

import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Broker pub/sub en mémoire ; chaque nœud de test y branche son propre {@link Endpoint}.
 */
public class InMemorySignalingBroker {

    public record Published(String address, byte[] payload) {
    }

    private final List<Endpoint> endpoints = new CopyOnWriteArrayList<>();
    private final List<Published> published = new CopyOnWriteArrayList<>();
    private final AtomicInteger failingOpens = new AtomicInteger();

    public Endpoint newTransport() {
        Endpoint e = new Endpoint();
        endpoints.add(e);
        return e;
    }

    /**
     * Les {@code n} prochaines ouvertures échouent.
     */
    public void failNextOpens(int n) {
        failingOpens.set(n);
    }

    public List<Published> published() {
        return List.copyOf(published);
    }

    public List<Published> publishedTo(String address) {
        return published.stream().filter(p -> p.address().equals(address)).toList();
    }

    public void clearHistory() {
        published.clear();
    }

    public class Endpoint implements SignalingTransport {
        private final Set<String> subscriptions = ConcurrentHashMap.newKeySet();
        private volatile Listener listener;
        private volatile boolean open;
        private volatile boolean muted;
        private int opens;

        @Override
        public void open(Listener listener) throws IOException {
            opens++;
            if (failingOpens.getAndUpdate(n -> Math.max(0, n - 1)) > 0) throw new IOException("broker unreachable");
            this.listener = listener;
            this.open = true;
        }

        @Override
        public void subscribe(String address) {
            subscriptions.add(address);
        }

        @Override
        public void unsubscribe(String address) {
            subscriptions.remove(address);
        }

        @Override
        public boolean publish(String address, byte[] payload) {
            if (!open) return false;
            published.add(new Published(address, payload.clone()));
            for (Endpoint e : endpoints) {
                if (e.open && !e.muted && e.subscriptions.contains(address)) e.listener.onFrame(address, payload.clone());
            }
            return true;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            open = false;
            subscriptions.clear();
        }

        /**
         * Perte de connexion côté broker.
         */
        public void drop() {
            open = false;
            subscriptions.clear();
            listener.onDropped(new IOException("connection lost"));
        }

        /**
         * Tant que muet, l'endpoint ne reçoit plus rien (messages perdus).
         */
        public void setMuted(boolean muted) {
            this.muted = muted;
        }

        /**
         * Remet une trame à cet endpoint hors du broker (livraison retardée).
         */
        public void deliver(Published frame) {
            listener.onFrame(frame.address(), frame.payload().clone());
        }

        public Set<String> subscriptions() {
            return Set.copyOf(subscriptions);
        }

        public int opens() {
            return opens;
        }
    }
}
