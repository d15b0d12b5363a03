package com.driverag.error;

public class EmbeddingMalformedException extends DriveRagException {
    public EmbeddingMalformedException(String message) {
        super(message);
    }

    public EmbeddingMalformedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
