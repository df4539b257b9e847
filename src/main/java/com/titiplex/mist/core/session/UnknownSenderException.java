package com.titiplex.mist.core.session;

import com.titiplex.mist.core.model.PeerKey;

public class UnknownSenderException extends SessionException {
    public UnknownSenderException(PeerKey peer, String message) {
        super(peer, message);
    }
}
