package com.titiplex.mist.core.signaling;

import com.titiplex.mist.core.crypto.NodeState;
import com.titiplex.mist.core.net.JGroupsStacks;
import org.jgroups.ChannelListener;
import org.jgroups.JChannel;
import org.jgroups.Message;
import org.jgroups.ReceiverAdapter;
import org.jgroups.View;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class JGroupsSignalingTransport extends ReceiverAdapter implements SignalingTransport, ChannelListener {
    private static final Logger log = LoggerFactory.getLogger(JGroupsSignalingTransport.class);

    private final NodeState ns;
    private final String cluster;
    private final int defaultPort;
    private final List<String> configuredSeeds;

    private final AtomicReference<JChannel> chRef = new AtomicReference<>();
    private final Set<String> subscribed = ConcurrentHashMap.newKeySet();
    private volatile Listener listener;
    private volatile boolean closing;

    public JGroupsSignalingTransport(NodeState ns,
                                     @Value("${app.signaling.cluster:mist-signaling}") String cluster,
                                     @Value("${app.signaling.port:7800}") int defaultPort,
                                     @Value("${app.signaling.seeds:}") String seeds) {
        this.ns = ns;
        this.cluster = cluster;
        this.defaultPort = defaultPort;
        this.configuredSeeds = seeds == null || seeds.isBlank()
                ? List.of() : Arrays.stream(seeds.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }

    @Override
    public synchronized void open(Listener listener) throws IOException {
        if (isOpen()) return;
        this.listener = listener;
        this.closing = false;
        int port = ns.signalingPort > 0 ? ns.signalingPort : defaultPort;
        List<String> seeds = new ArrayList<>(configuredSeeds);
        if (ns.seeds != null) seeds.addAll(ns.seeds);
        String cfg = seeds.isEmpty()
                ? JGroupsStacks.udpStack(port)
                : JGroupsStacks.tcpStack(JGroupsStacks.normalizeSeeds(seeds, port), port, null);
        try {
            JChannel ch = new JChannel(new ByteArrayInputStream(cfg.getBytes(StandardCharsets.UTF_8)));
            ch.setDiscardOwnMessages(true);
            ch.setReceiver(this);
            ch.addChannelListener(this);
            ch.connect(cluster);
            chRef.set(ch);
            log.info("Joined signaling cluster {} on port {} ({} seed(s))", cluster, port, seeds.size());
        } catch (Exception e) {
            throw new IOException("Cannot join signaling cluster " + cluster + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void subscribe(String address) {
        subscribed.add(address);
    }

    @Override
    public void unsubscribe(String address) {
        subscribed.remove(address);
    }

    @Override
    public boolean publish(String address, byte[] payload) {
        JChannel ch = chRef.get();
        if (ch == null || !ch.isConnected()) return false;
        byte[] head = (address + "\n").getBytes(StandardCharsets.UTF_8);
        byte[] frame = new byte[head.length + payload.length];
        System.arraycopy(head, 0, frame, 0, head.length);
        System.arraycopy(payload, 0, frame, head.length, payload.length);
        try {
            ch.send(new Message(null, frame));
            return true;
        } catch (Exception e) {
            log.warn("Signaling publish to {} failed: {}", address, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isOpen() {
        JChannel ch = chRef.get();
        return ch != null && ch.isConnected();
    }

    @Override
    public synchronized void close() {
        closing = true;
        subscribed.clear();
        JChannel ch = chRef.getAndSet(null);
        if (ch != null) ch.close();
    }

    // ---------- Receiver ----------

    @Override
    public void receive(Message msg) {
        byte[] buf = msg.getBuffer();
        if (buf == null) return;
        int nl = -1;
        for (int i = 0; i < buf.length; i++) {
            if (buf[i] == '\n') {
                nl = i;
                break;
            }
        }
        if (nl <= 0) {
            log.debug("Frame without address from {} dropped", msg.getSrc());
            return;
        }
        String address = new String(buf, 0, nl, StandardCharsets.UTF_8);
        if (!subscribed.contains(address)) return;
        Listener l = listener;
        if (l != null) l.onFrame(address, Arrays.copyOfRange(buf, nl + 1, buf.length));
    }

    @Override
    public void viewAccepted(View view) {
        log.debug("Signaling view: {} member(s)", view.size());
    }

    // ---------- ChannelListener ----------

    @Override
    public void channelConnected(JChannel channel) {
        log.debug("Signaling channel connected");
    }

    @Override
    public void channelDisconnected(JChannel channel) {
        lost("disconnected");
    }

    @Override
    public void channelClosed(JChannel channel) {
        lost("closed");
    }

    private void lost(String how) {
        if (closing) return;
        Listener l = listener;
        chRef.set(null);
        if (l != null) l.onDropped(new IOException("signaling channel " + how));
    }
}
