package com.titiplex.mist.core.signaling;

import com.titiplex.mist.core.model.PeerKey;

public final class SignalingAddresses {
    public static final String BROADCAST = "mist/broadcast";

    private SignalingAddresses() {
    }

    public static String inbox(PeerKey peer) {
        return "mist/user/" + peer.urlSafe() + "/inbox";
    }

    public static String group(String groupId) {
        if (groupId == null || groupId.isBlank() || groupId.contains("/"))
            throw new IllegalArgumentException("invalid group id: " + groupId);
        return "mist/group/" + groupId;
    }
}
