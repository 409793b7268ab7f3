package com.example.honeypot.store;

/**
 * A call to the remote tier failed or timed out. Never leaves {@link TieredSessionStore}.
 */
public class RemoteStoreException extends RuntimeException {

    public RemoteStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
