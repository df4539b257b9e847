package com.titiplex.mist.core.session;

import com.titiplex.mist.core.model.PeerKey;

public class NoSessionException extends SessionException {
    public NoSessionException(PeerKey peer, String message) {
        super(peer, message);
    }
}
