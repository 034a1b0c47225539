package org.iplocation.server.session;

/**
 * Per-visitor key-value storage. Consistency across concurrent requests of the same visitor
 * is up to the implementation.
 */
public interface SessionStore {

    boolean has(String key);

    Object get(String key);

    void set(String key, Object value);

    void forget(String key);
}
