package com.titiplex.mist.core.crypto.engine;

public class DecryptionFailedException extends CryptoException {
    public DecryptionFailedException(String message) {
        super(message);
    }

    public DecryptionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
