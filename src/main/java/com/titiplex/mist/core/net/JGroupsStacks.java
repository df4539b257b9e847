package com.titiplex.mist.core.net;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class JGroupsStacks {

    private JGroupsStacks() {
    }

    public static String udpStack(int bindPort) {
        return """
                <config>
                  <org.jgroups.protocols.UDP bind_port="%PORT%" mcast_port="45588" ip_ttl="2"/>
                  <org.jgroups.protocols.PING/>
                  <org.jgroups.protocols.MERGE3 min_interval="10000" max_interval="30000"/>
                  <org.jgroups.protocols.FD_SOCK/>
                  <org.jgroups.protocols.FD_ALL interval="3000" timeout="12000"/>
                  <org.jgroups.protocols.VERIFY_SUSPECT timeout="1500"/>
                  <org.jgroups.protocols.BARRIER/>
                  <org.jgroups.protocols.pbcast.NAKACK2 use_mcast_xmit="true"/>
                  <org.jgroups.protocols.UNICAST3/>
                  <org.jgroups.protocols.pbcast.STABLE/>
                  <org.jgroups.protocols.pbcast.GMS join_timeout="5000" print_local_addr="false"/>
                  <org.jgroups.protocols.UFC/>
                  <org.jgroups.protocols.MFC/>
                  <org.jgroups.protocols.FRAG2/>
                </config>
                """.replace("%PORT%", Integer.toString(bindPort));
    }

    public static String tcpStack(List<String> seeds, int bindPort, String externalAddr) {
        String initial = String.join(",", seeds);
        return """
                <config>
                  <org.jgroups.protocols.TCP bind_port="%PORT%" %EXTERNAL%/>
                  <org.jgroups.protocols.TCPPING timeout="2000" initial_hosts="%SEEDS%" port_range="2"/>
                  <org.jgroups.protocols.MERGE3 min_interval="10000" max_interval="30000"/>
                  <org.jgroups.protocols.FD_SOCK/>
                  <org.jgroups.protocols.FD_ALL interval="3000" timeout="12000"/>
                  <org.jgroups.protocols.VERIFY_SUSPECT timeout="1500"/>
                  <org.jgroups.protocols.BARRIER/>
                  <org.jgroups.protocols.pbcast.NAKACK2 use_mcast_xmit="false"/>
                  <org.jgroups.protocols.UNICAST3/>
                  <org.jgroups.protocols.pbcast.STABLE/>
                  <org.jgroups.protocols.pbcast.GMS join_timeout="5000" print_local_addr="false"/>
                  <org.jgroups.protocols.UFC/>
                  <org.jgroups.protocols.MFC/>
                  <org.jgroups.protocols.FRAG2/>
                </config>
                """
                .replace("%PORT%", Integer.toString(bindPort))
                .replace("%SEEDS%", initial)
                .replace("%EXTERNAL%", externalAddr == null ? "" : ("external_addr=\"" + externalAddr + "\""));
    }

    public static List<String> normalizeSeeds(List<String> seeds, int defaultPort) {
        if (seeds == null) return Collections.emptyList();
        List<String> out = new ArrayList<>();
        for (String s : seeds) {
            if (s == null) continue;
            String t = s.trim();
            if (t.isEmpty()) continue;
            if (t.contains("[")) {
                if (!out.contains(t)) out.add(t);
                continue;
            }
            String host = t;
            int p = defaultPort;
            int colon = t.lastIndexOf(':');
            if (colon > 0) {
                host = t.substring(0, colon);
                p = Integer.parseInt(t.substring(colon + 1));
            }
            String normalized = host + "[" + p + "]";
            if (!out.contains(normalized)) out.add(normalized);
        }
        return out;
    }
}
