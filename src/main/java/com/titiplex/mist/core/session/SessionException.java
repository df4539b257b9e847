package com.titiplex.mist.core.session;

import com.titiplex.mist.core.model.PeerKey;

public class SessionException extends RuntimeException {
    private final PeerKey peer;

    public SessionException(PeerKey peer, String message) {
        super(message);
        this.peer = peer;
    }

    public PeerKey peer() {
        return peer;
    }
}
