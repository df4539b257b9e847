package com.titiplex.mist.core.orchestrator;

import com.titiplex.mist.core.model.PeerKey;
import com.titiplex.mist.core.model.TrustOrigin;
import com.titiplex.mist.core.transport.LinkPhase;

public interface SessionEventListener {

    default void onFriendAdded(PeerKey peer, TrustOrigin origin) {
    }

    default void onMessageDecrypted(PeerKey peer, byte[] plaintext) {
    }

    default void onTransportStateChanged(PeerKey peer, LinkPhase phase) {
    }

    default void onMessageRejected(PeerKey peer, RejectionReason reason) {
    }

    default void onPresenceChanged(PeerKey peer, boolean online) {
    }

    default void onTyping(PeerKey peer, boolean typing) {
    }
}
