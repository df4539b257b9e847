package com.titiplex.mist.core.model;

public enum TrustOrigin {
    DIRECT_VERIFICATION,
    SHARED_LINK
}
