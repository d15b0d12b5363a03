package com.driverag.error;

/**
 * Base type for failures raised by the retrieval engine. Callers use {@link #isRetryable()} to decide
 * whether an operation may be attempted again with backoff.
 */
public abstract class DriveRagException extends RuntimeException {
    protected DriveRagException(String message) {
        super(message);
    }

    protected DriveRagException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}
