package com.titiplex.mist.core.transport;

import com.titiplex.mist.core.crypto.NodeState;
import com.titiplex.mist.core.net.StunClient;
import com.titiplex.mist.core.net.UPnPService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

@Service
public class CandidateGatherer {
    private static final Logger log = LoggerFactory.getLogger(CandidateGatherer.class);

    private final NodeState ns;
    private final int defaultPort;
    private final UPnPService upnp = new UPnPService();
    private final StunClient stun;
    private final List<String> publicCandidates = new CopyOnWriteArrayList<>();
    private final List<Consumer<String>> sinks = new CopyOnWriteArrayList<>();
    private ExecutorService worker;

    public CandidateGatherer(NodeState ns,
                             @Value("${app.transport.port:7900}") int defaultPort,
                             @Value("${app.transport.stun:stun.l.google.com:19302}") String stunServers) {
        this.ns = ns;
        this.defaultPort = defaultPort;
        this.stun = new StunClient(Arrays.stream(stunServers.split(",")).map(String::trim)
                .filter(s -> !s.isEmpty()).toList());
    }

    public int port() {
        return ns.transportPort > 0 ? ns.transportPort : defaultPort;
    }

    public List<String> candidates() {
        List<String> out = new ArrayList<>(lanCandidates());
        for (String c : publicCandidates) if (!out.contains(c)) out.add(c);
        return out;
    }

    public void addSink(Consumer<String> sink) {
        sinks.add(sink);
    }

    public synchronized void gatherPublic() {
        if (worker != null) return;
        worker = Executors.newSingleThreadExecutor(r -> {
            var t = new Thread(r, "candidates");
            t.setDaemon(true);
            return t;
        });
        worker.execute(() -> {
            int port = port();
            if (upnp.tryMap(port, "TCP")) upnp.getExternalIPAddress().ifPresent(ip -> publish(ip + ":" + port));
            Optional<InetSocketAddress> ext = stun.queryPublicAddress(port, Duration.ofSeconds(2));
            ext.ifPresent(sock -> publish(sock.getAddress().getHostAddress() + ":" + port));
            if (publicCandidates.isEmpty()) log.info("No public address found, direct links limited to LAN");
        });
    }

    @PreDestroy
    public synchronized void stop() {
        if (worker != null) worker.shutdownNow();
    }

    private void publish(String candidate) {
        if (publicCandidates.contains(candidate)) return;
        publicCandidates.add(candidate);
        log.info("Public candidate found: {}", candidate);
        for (Consumer<String> s : sinks) s.accept(candidate);
    }

    private List<String> lanCandidates() {
        int port = port();
        List<String> out = new ArrayList<>();
        try {
            for (NetworkInterface nif : Collections.list(NetworkInterface.getNetworkInterfaces())) {
                if (!nif.isUp() || nif.isLoopback() || nif.isVirtual()) continue;
                for (InetAddress a : Collections.list(nif.getInetAddresses())) {
                    if (a instanceof Inet4Address && !a.isLinkLocalAddress()) out.add(a.getHostAddress() + ":" + port);
                }
            }
        } catch (SocketException e) {
            log.debug("Network interfaces unavailable: {}", e.getMessage());
        }
        if (out.isEmpty()) out.add("127.0.0.1:" + port);
        return out;
    }
}
