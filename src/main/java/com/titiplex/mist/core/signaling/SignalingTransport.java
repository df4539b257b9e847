package com.titiplex.mist.core.signaling;

import java.io.IOException;

public interface SignalingTransport {

    void open(Listener listener) throws IOException;

    void subscribe(String address);

    void unsubscribe(String address);

    boolean publish(String address, byte[] payload);

    boolean isOpen();

    void close();

    interface Listener {
        void onFrame(String address, byte[] payload);

        void onDropped(Throwable cause);
    }
}
