package com.titiplex.mist.core.transport;

public interface DirectChannel {

    String linkId();

    boolean send(byte[] bytes);

    void addCandidate(String candidate);

    void close();

    interface Listener {
        void onOpen();

        void onData(byte[] bytes);

        void onClosed(String reason);
    }
}
