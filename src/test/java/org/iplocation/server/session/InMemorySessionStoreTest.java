package org.iplocation.server.session;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class InMemorySessionStoreTest {

    private final InMemorySessionStore sessionStore = new InMemorySessionStore();

    @Test
    public void shouldStoreAndForgetValues() {
        // when
        sessionStore.set("location", "value");

        // then
        assertThat(sessionStore.has("location")).isTrue();
        assertThat(sessionStore.get("location")).isEqualTo("value");

        // when
        sessionStore.forget("location");

        // then
        assertThat(sessionStore.has("location")).isFalse();
        assertThat(sessionStore.get("location")).isNull();
    }

    @Test
    public void forgetShouldIgnoreAbsentKey() {
        // when
        sessionStore.forget("absent");

        // then
        assertThat(sessionStore.has("absent")).isFalse();
    }
}
