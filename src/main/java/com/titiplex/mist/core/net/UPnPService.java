package com.titiplex.mist.core.net;

import org.bitlet.weupnp.GatewayDevice;
import org.bitlet.weupnp.GatewayDiscover;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xml.sax.SAXException;

import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.net.InetAddress;
import java.util.Optional;

public class UPnPService {
    private static final Logger log = LoggerFactory.getLogger(UPnPService.class);

    private GatewayDevice dev;

    public synchronized boolean tryMap(int internalPort, String proto) {
        try {
            if (dev == null) {
                GatewayDiscover discover = new GatewayDiscover();
                discover.discover();
                dev = discover.getValidGateway();
                if (dev == null) {
                    log.debug("No UPnP gateway found");
                    return false;
                }
            }
            String localHost = InetAddress.getLocalHost().getHostAddress();
            // on remplace une éventuelle règle existante sur le même port
            try {
                dev.deletePortMapping(internalPort, proto);
            } catch (IOException | SAXException e) {
                log.debug("No previous {} mapping on {}: {}", proto, internalPort, e.getMessage());
            }
            boolean ok = dev.addPortMapping(internalPort, internalPort, localHost, proto, "mist-" + proto);
            log.info("UPnP {} mapping on port {}: {}", proto, internalPort, ok ? "ok" : "refused");
            return ok;
        } catch (IOException | SAXException | ParserConfigurationException e) {
            log.debug("UPnP mapping failed: {}", e.getMessage());
            return false;
        }
    }

    public synchronized Optional<String> getExternalIPAddress() {
        if (dev == null) return Optional.empty();
        try {
            return Optional.ofNullable(dev.getExternalIPAddress());
        } catch (IOException | SAXException e) {
            log.debug("UPnP external address unavailable: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
