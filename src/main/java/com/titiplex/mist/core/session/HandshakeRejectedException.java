package com.titiplex.mist.core.session;

import com.titiplex.mist.core.model.PeerKey;

public class HandshakeRejectedException extends SessionException {
    public HandshakeRejectedException(PeerKey peer, String message) {
        super(peer, message);
    }
}
