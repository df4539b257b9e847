package com.titiplex.mist.core.transport;

import com.titiplex.mist.core.model.PeerKey;
import com.titiplex.mist.core.net.JGroupsStacks;
import jakarta.annotation.PreDestroy;
import org.jgroups.JChannel;
import org.jgroups.Message;
import org.jgroups.ReceiverAdapter;
import org.jgroups.View;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

// un cluster TCP par lien, initial_hosts = candidats distants
@Component
public class JGroupsDirectChannelFactory implements DirectChannelFactory {
    private static final Logger log = LoggerFactory.getLogger(JGroupsDirectChannelFactory.class);

    private final CandidateGatherer gatherer;
    private final ExecutorService connector = Executors.newCachedThreadPool(r -> {
        var t = new Thread(r, "direct-link");
        t.setDaemon(true);
        return t;
    });

    public JGroupsDirectChannelFactory(CandidateGatherer gatherer) {
        this.gatherer = gatherer;
    }

    @Override
    public List<String> localCandidates() {
        return gatherer.candidates();
    }

    @Override
    public DirectChannel open(String linkId, PeerKey peer, List<String> remoteCandidates,
                              DirectChannel.Listener listener) throws IOException {
        if (remoteCandidates == null || remoteCandidates.isEmpty())
            throw new IOException("no remote candidate for " + peer);
        JGroupsDirectChannel ch = new JGroupsDirectChannel(linkId, new ArrayList<>(remoteCandidates), listener);
        connector.execute(ch::join);
        return ch;
    }

    @Override
    public void onLateCandidate(Consumer<String> sink) {
        gatherer.addSink(sink);
        gatherer.gatherPublic();
    }

    @PreDestroy
    public void shutdown() {
        connector.shutdownNow();
    }

    private final class JGroupsDirectChannel extends ReceiverAdapter implements DirectChannel {
        private final String linkId;
        private final List<String> seeds;
        private final DirectChannel.Listener listener;
        private final AtomicReference<JChannel> chRef = new AtomicReference<>();
        private volatile boolean open;
        private volatile boolean closed;

        JGroupsDirectChannel(String linkId, List<String> seeds, DirectChannel.Listener listener) {
            this.linkId = linkId;
            this.seeds = seeds;
            this.listener = listener;
        }

        @Override
        public String linkId() {
            return linkId;
        }

        synchronized void join() {
            if (closed) return;
            int port = gatherer.port();
            String cfg = JGroupsStacks.tcpStack(JGroupsStacks.normalizeSeeds(seeds, port), port, null);
            try {
                JChannel old = chRef.getAndSet(null);
                if (old != null) old.close();
                JChannel ch = new JChannel(new ByteArrayInputStream(cfg.getBytes(StandardCharsets.UTF_8)));
                ch.setDiscardOwnMessages(true);
                ch.setReceiver(this);
                ch.connect("mist-link-" + linkId);
                chRef.set(ch);
                if (ch.getView() != null) viewAccepted(ch.getView());
            } catch (Exception e) {
                log.warn("Joining direct link {} failed: {}", linkId, e.getMessage());
                listener.onClosed("join failed: " + e.getMessage());
            }
        }

        @Override
        public boolean send(byte[] bytes) {
            JChannel ch = chRef.get();
            if (!open || ch == null || !ch.isConnected()) return false;
            try {
                ch.send(new Message(null, bytes));
                return true;
            } catch (Exception e) {
                log.debug("Direct send on {} failed: {}", linkId, e.getMessage());
                return false;
            }
        }

        @Override
        public void addCandidate(String candidate) {
            synchronized (this) {
                if (seeds.contains(candidate)) return;
                seeds.add(candidate);
            }
            if (!open && !closed) connector.execute(this::join);
        }

        @Override
        public synchronized void close() {
            closed = true;
            open = false;
            JChannel ch = chRef.getAndSet(null);
            if (ch != null) ch.close();
        }

        @Override
        public void receive(Message msg) {
            byte[] buf = msg.getBuffer();
            if (buf != null && !closed) listener.onData(buf);
        }

        @Override
        public void viewAccepted(View view) {
            if (closed) return;
            if (view.size() >= 2 && !open) {
                open = true;
                listener.onOpen();
            } else if (view.size() < 2 && open) {
                open = false;
                listener.onClosed("peer left");
            }
        }
    }
}
