package com.titiplex.mist.core.transport;

import com.titiplex.mist.core.loop.EventLoop;
import com.titiplex.mist.core.model.PeerKey;

// modifié uniquement sous le verrou du routeur
public final class TransportLink {
    private final PeerKey peer;
    private final String linkId;
    private final boolean initiatedLocally;

    LinkPhase phase;
    long lastActivity;
    DirectChannel channel;
    EventLoop.Handle timeout;
    // offre du pair abandonnée par lui lors d'une collision ; si elle arrive en retard, on l'ignore
    String abandonedRemoteLinkId;

    TransportLink(PeerKey peer, String linkId, boolean initiatedLocally, long now) {
        this.peer = peer;
        this.linkId = linkId;
        this.initiatedLocally = initiatedLocally;
        this.phase = LinkPhase.NEGOTIATING;
        this.lastActivity = now;
    }

    public PeerKey peer() {
        return peer;
    }

    public String linkId() {
        return linkId;
    }

    public boolean initiatedLocally() {
        return initiatedLocally;
    }

    public LinkPhase phase() {
        return phase;
    }

    public long lastActivity() {
        return lastActivity;
    }

    @Override
    public String toString() {
        return "link[" + peer + " " + linkId + " " + phase + "]";
    }
}
