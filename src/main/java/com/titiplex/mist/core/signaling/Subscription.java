package com.titiplex.mist.core.signaling;

@FunctionalInterface
public interface Subscription {
    void unsubscribe();
}
