package com.titiplex.mist.core.net;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.DatagramChannel;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public class StunClient {
    private static final Logger log = LoggerFactory.getLogger(StunClient.class);

    private static final int STUN_BINDING_REQUEST = 0x0001;
    private static final int XOR_MAPPED_ADDRESS = 0x0020;
    private static final int MAGIC_COOKIE = 0x2112A442;
    private static final SecureRandom RNG = new SecureRandom();

    private final List<String> servers;

    public StunClient(List<String> servers) {
        this.servers = servers;
    }

    public Optional<InetSocketAddress> queryPublicAddress(int localPort, Duration timeout) {
        for (String h : servers) {
            String[] hp = h.trim().split(":");
            if (hp.length != 2) continue;
            try {
                InetSocketAddress stun = new InetSocketAddress(hp[0], Integer.parseInt(hp[1]));
                Optional<InetSocketAddress> r = ask(stun, localPort, timeout);
                if (r.isPresent()) return r;
            } catch (IOException | NumberFormatException e) {
                log.debug("STUN server {} unusable: {}", h, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private Optional<InetSocketAddress> ask(InetSocketAddress stun, int localPort, Duration timeout)
            throws IOException, InterruptedException {
        try (DatagramChannel ch = DatagramChannel.open()) {
            ch.bind(new InetSocketAddress(localPort));
            ch.configureBlocking(false);
            byte[] txid = new byte[12];
            RNG.nextBytes(txid);
            ByteBuffer req = ByteBuffer.allocate(20);
            req.putShort((short) STUN_BINDING_REQUEST);
            req.putShort((short) 0);
            req.putInt(MAGIC_COOKIE);
            req.put(txid);
            req.flip();
            ch.send(req, stun);

            long deadline = System.currentTimeMillis() + timeout.toMillis();
            ByteBuffer buf = ByteBuffer.allocate(1024);
            SocketAddress src;
            while (System.currentTimeMillis() < deadline) {
                buf.clear();
                src = ch.receive(buf);
                if (src == null) {
                    Thread.sleep(10);
                    continue;
                }
                buf.flip();
                Optional<InetSocketAddress> mapped = parseResponse(buf, txid);
                if (mapped.isPresent()) return mapped;
            }
            return Optional.empty();
        }
    }

    static Optional<InetSocketAddress> parseResponse(ByteBuffer buf, byte[] txid) throws IOException {
        if (buf.remaining() < 20) return Optional.empty();
        buf.getShort(); // type
        int len = buf.getShort() & 0xFFFF;
        int cookie = buf.getInt();
        byte[] rxid = new byte[12];
        buf.get(rxid);
        if (cookie != MAGIC_COOKIE || !Arrays.equals(rxid, txid)) return Optional.empty();

        int read = 0;
        while (read < len && buf.remaining() >= 4) {
            int at = buf.getShort() & 0xFFFF;
            int alen = buf.getShort() & 0xFFFF;
            int padded = (alen + 3) & ~3;
            if (buf.remaining() < alen) break;
            int pos0 = buf.position();
            if (at == XOR_MAPPED_ADDRESS && alen >= 8) {
                buf.get(); // réservé
                int family = buf.get() & 0xFF;
                int xport = (buf.getShort() & 0xFFFF) ^ (MAGIC_COOKIE >>> 16);
                if (family == 0x01) {
                    int xip = buf.getInt() ^ MAGIC_COOKIE;
                    byte[] ip = new byte[]{
                            (byte) ((xip >>> 24) & 0xFF),
                            (byte) ((xip >>> 16) & 0xFF),
                            (byte) ((xip >>> 8) & 0xFF),
                            (byte) (xip & 0xFF)
                    };
                    return Optional.of(new InetSocketAddress(InetAddress.getByAddress(ip), xport));
                }
            }
            buf.position(Math.min(buf.limit(), pos0 + padded));
            read += 4 + padded;
        }
        return Optional.empty();
    }
}
