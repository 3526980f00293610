package com.telemetryrollup.core.store;

import java.util.List;

/**
 * Key-value blob store addressed by hierarchical {@code /}-separated keys.
 *
 * <p>
 * The engine only needs three capabilities: list keys under a prefix, read
 * an object and write an object. Every failure surfaces as an unchecked
 * {@link ObjectStoreException}; callers decide whether it is fatal.
 * </p>
 *
 * <p>
 * Implementations must be safe for concurrent use; the engine lists and
 * fetches from several worker threads.
 * </p>
 */
public interface ObjectStore {

    /**
     * List all keys starting with {@code prefix}.
     *
     * @param prefix key prefix, typically ending in {@code /}
     * @return matching keys in lexicographic order, empty if none
     * @throws ObjectStoreException if the listing cannot be performed
     */
    List<String> list(String prefix);

    /**
     * @param key object key
     * @return the object body
     * @throws ObjectStoreException if the object is missing or cannot be read
     */
    byte[] get(String key);

    /**
     * Create or overwrite an object.
     *
     * @param key         object key
     * @param body        object body
     * @param contentType MIME type recorded with the object where supported
     * @throws ObjectStoreException if the write fails
     */
    void put(String key, byte[] body, String contentType);
}
