package com.titiplex.mist.core.signaling;

public class SignalingUnavailableException extends RuntimeException {
    public SignalingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
