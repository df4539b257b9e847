package com.titiplex.mist.core.crypto.engine;

public class SignatureInvalidException extends CryptoException {
    public SignatureInvalidException(String message) {
        super(message);
    }
}
