package com.titiplex.mist.core.transport;

import com.titiplex.mist.core.model.PeerKey;

import java.io.IOException;
import java.util.List;
import java.util.function.Consumer;

public interface DirectChannelFactory {

    List<String> localCandidates();

    DirectChannel open(String linkId, PeerKey peer, List<String> remoteCandidates, DirectChannel.Listener listener)
            throws IOException;

    default void onLateCandidate(Consumer<String> sink) {
    }
}
