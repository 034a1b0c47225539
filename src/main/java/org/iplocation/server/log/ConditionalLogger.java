package org.iplocation.server.log;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.apache.commons.lang3.ObjectUtils;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Suppresses repeated log messages: a message (or the logger-wide key, when set)
 * is written at most once per given period.
 */
public class ConditionalLogger {

    private static final int CACHE_MAXIMUM_SIZE = 10_000;
    private static final int EXPIRE_CACHE_DURATION = 1;

    private final String key;
    private final Logger logger;

    private final ConcurrentMap<String, Long> messageToWait;

    public ConditionalLogger(String key, Logger logger) {
        this.key = key; // can be null
        this.logger = Objects.requireNonNull(logger);

        messageToWait = Caffeine.newBuilder()
                .maximumSize(CACHE_MAXIMUM_SIZE)
                .expireAfterWrite(EXPIRE_CACHE_DURATION, TimeUnit.HOURS)
                .<String, Long>build()
                .asMap();
    }

    public ConditionalLogger(Logger logger) {
        this(null, logger);
    }

    public void info(String message, long duration, TimeUnit unit) {
        log(message, duration, unit, logger -> logger.info(message));
    }

    public void warn(String message, long duration, TimeUnit unit) {
        log(message, duration, unit, logger -> logger.warn(message));
    }

    public void error(String message, long duration, TimeUnit unit) {
        log(message, duration, unit, logger -> logger.error(message));
    }

    /**
     * Calls {@link Consumer} if the given time for specified key is not exceeded.
     */
    private void log(String key, long duration, TimeUnit unit, Consumer<Logger> consumer) {
        final long currentTime = Instant.now().toEpochMilli();
        final String resolvedKey = ObjectUtils.defaultIfNull(this.key, key);
        final Long endTime = messageToWait.get(resolvedKey);

        if (endTime == null || currentTime >= endTime) {
            messageToWait.put(resolvedKey, calculateEndTime(duration, unit));
            consumer.accept(logger);
        }
    }

    /**
     * Returns time in millis as current time incremented by specified duration.
     */
    private static long calculateEndTime(long duration, TimeUnit unit) {
        final long durationInMillis = unit.toMillis(duration);
        return Instant.now().plusMillis(durationInMillis).toEpochMilli();
    }
}
