package com.titiplex.mist.core.session;

import com.titiplex.mist.core.model.PeerKey;

public class RoleOrderingViolationException extends SessionException {
    public RoleOrderingViolationException(PeerKey peer, String message) {
        super(peer, message);
    }
}
