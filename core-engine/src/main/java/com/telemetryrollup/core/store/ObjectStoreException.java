package com.telemetryrollup.core.store;

/**
 * Failure of an {@link ObjectStore} operation.
 *
 * @since 1.0.0
 */
public class ObjectStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String key;

    public ObjectStoreException(String message, String key) {
        super(message);
        this.key = key;
    }

    public ObjectStoreException(String message, String key, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /**
     * @return the key or prefix the failed operation addressed
     */
    public String getKey() {
        return key;
    }
}
