package com.titiplex.mist.core.session;

import com.titiplex.mist.core.model.PeerKey;

public class AlreadyEstablishedException extends SessionException {
    public AlreadyEstablishedException(PeerKey peer, String message) {
        super(peer, message);
    }
}
