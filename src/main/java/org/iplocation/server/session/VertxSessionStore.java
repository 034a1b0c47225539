package org.iplocation.server.session;

import io.vertx.ext.web.Session;

import java.util.Objects;

/**
 * {@link SessionStore} backed by the Vert.x Web session of the current request.
 */
public class VertxSessionStore implements SessionStore {

    private final Session session;

    public VertxSessionStore(Session session) {
        this.session = Objects.requireNonNull(session);
    }

    @Override
    public boolean has(String key) {
        return session.get(key) != null;
    }

    @Override
    public Object get(String key) {
        return session.get(key);
    }

    @Override
    public void set(String key, Object value) {
        session.put(key, value);
    }

    @Override
    public void forget(String key) {
        session.remove(key);
    }
}
