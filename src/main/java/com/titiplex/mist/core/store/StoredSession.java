package com.titiplex.mist.core.store;

import com.titiplex.mist.core.model.PeerKey;

public record StoredSession(
        PeerKey peer,
        String role,
        byte[] state,      // déjà déchiffré
        long version,
        long updatedAt
) {
}
