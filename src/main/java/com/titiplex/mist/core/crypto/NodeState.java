package com.titiplex.mist.core.crypto;

import com.titiplex.mist.core.crypto.engine.IdentityKeyPair;
import com.titiplex.mist.core.model.PeerKey;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class NodeState {
    public String displayName;
    public IdentityKeyPair identity;
    public List<String> seeds = new ArrayList<>(); // host:port
    public int signalingPort;
    public int transportPort;

    public PeerKey self() {
        if (identity == null) throw new IllegalStateException("identity not loaded");
        return identity.peerKey();
    }
}
