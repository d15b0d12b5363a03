package com.driverag.error;

public class RetrievalCancelledException extends DriveRagException {
    public RetrievalCancelledException(String message) {
        super(message);
    }

    public RetrievalCancelledException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
