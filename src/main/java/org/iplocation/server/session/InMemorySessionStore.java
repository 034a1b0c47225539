package org.iplocation.server.session;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link SessionStore} living as long as the instance, for callers outside of an HTTP session.
 */
public class InMemorySessionStore implements SessionStore {

    private final Map<String, Object> values = new ConcurrentHashMap<>();

    @Override
    public boolean has(String key) {
        return values.containsKey(key);
    }

    @Override
    public Object get(String key) {
        return values.get(key);
    }

    @Override
    public void set(String key, Object value) {
        values.put(key, value);
    }

    @Override
    public void forget(String key) {
        values.remove(key);
    }
}
