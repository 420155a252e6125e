package io.chatsocket.impl;

import java.time.Duration;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration of the {@link InMemorySessionStore}: the bounds on sessions and messages, how long an inactive session
 * lives, and how often the cleaner looks for stale sessions. Immutable - create using {@link #builder()} or
 * {@link #fromEnvironment(Map)}.
 */
public final class SessionStoreConfig implements ChatSocketStatics {
    private static final Logger log = LoggerFactory.getLogger(SessionStoreConfig.class);

    public static final String ENV_MAX_SESSIONS = "SESSION_STORE_MAX_SESSIONS";
    public static final String ENV_MAX_MESSAGES_PER_SESSION = "SESSION_STORE_MAX_MESSAGES_PER_SESSION";
    public static final String ENV_TTL_HOURS = "SESSION_STORE_TTL_HOURS";
    public static final String ENV_CLEANUP_INTERVAL_MINUTES = "SESSION_STORE_CLEANUP_INTERVAL_MINUTES";

    private final int _maxSessions;
    private final int _maxMessagesPerSession;
    private final Duration _sessionTtl;
    private final Duration _cleanupInterval;

    private SessionStoreConfig(Builder builder) {
        _maxSessions = builder._maxSessions;
        _maxMessagesPerSession = builder._maxMessagesPerSession;
        _sessionTtl = builder._sessionTtl;
        _cleanupInterval = builder._cleanupInterval;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a config with all defaults: 1000 sessions, 1000 messages per session, 24 hours TTL and cleanup every
     *         hour.
     */
    public static SessionStoreConfig defaults() {
        return builder().build();
    }

    /**
     * Creates a config from environment-style variables, typically <code>System.getenv()</code>. Each variable
     * overrides its default only if it is a positive number - otherwise it is ignored, with a warning.
     * <ul>
     * <li>{@value #ENV_MAX_SESSIONS}: integer</li>
     * <li>{@value #ENV_MAX_MESSAGES_PER_SESSION}: integer</li>
     * <li>{@value #ENV_TTL_HOURS}: decimal number of hours</li>
     * <li>{@value #ENV_CLEANUP_INTERVAL_MINUTES}: decimal number of minutes</li>
     * </ul>
     */
    public static SessionStoreConfig fromEnvironment(Map<String, String> env) {
        Builder builder = builder();
        Double maxSessions = positiveNumber(env, ENV_MAX_SESSIONS);
        if (maxSessions != null) {
            builder.maxSessions(maxSessions.intValue());
        }
        Double maxMessages = positiveNumber(env, ENV_MAX_MESSAGES_PER_SESSION);
        if (maxMessages != null) {
            builder.maxMessagesPerSession(maxMessages.intValue());
        }
        Double ttlHours = positiveNumber(env, ENV_TTL_HOURS);
        if (ttlHours != null) {
            builder.sessionTtl(Duration.ofMillis(Math.max(1, Math.round(ttlHours * 60 * 60 * 1000))));
        }
        Double cleanupMinutes = positiveNumber(env, ENV_CLEANUP_INTERVAL_MINUTES);
        if (cleanupMinutes != null) {
            builder.cleanupInterval(Duration.ofMillis(Math.max(1, Math.round(cleanupMinutes * 60 * 1000))));
        }
        SessionStoreConfig config = builder.build();
        log.info("Session Store config from environment: " + config);
        return config;
    }

    private static Double positiveNumber(Map<String, String> env, String name) {
        String value = env.get(name);
        if (value == null) {
            return null;
        }
        double number;
        try {
            number = Double.parseDouble(value.trim());
        }
        catch (NumberFormatException e) {
            log.warn("Ignoring environment variable [" + name + "] with non-numeric value [" + value + "].");
            return null;
        }
        // ?: NaN, infinite or not positive? Also catch integer settings that truncate to zero.
        if (Double.isNaN(number) || Double.isInfinite(number) || (number <= 0)
                || ((name.equals(ENV_MAX_SESSIONS) || name.equals(ENV_MAX_MESSAGES_PER_SESSION)) && (number < 1))) {
            log.warn("Ignoring environment variable [" + name + "] with non-positive value [" + value + "].");
            return null;
        }
        return number;
    }

    public int getMaxSessions() {
        return _maxSessions;
    }

    public int getMaxMessagesPerSession() {
        return _maxMessagesPerSession;
    }

    public Duration getSessionTtl() {
        return _sessionTtl;
    }

    public Duration getCleanupInterval() {
        return _cleanupInterval;
    }

    @Override
    public String toString() {
        return "SessionStoreConfig{maxSessions=" + _maxSessions
                + ", maxMessagesPerSession=" + _maxMessagesPerSession
                + ", sessionTtl=" + _sessionTtl
                + ", cleanupInterval=" + _cleanupInterval + '}';
    }

    public static final class Builder {
        private int _maxSessions = DEFAULT_MAX_SESSIONS;
        private int _maxMessagesPerSession = DEFAULT_MAX_MESSAGES_PER_SESSION;
        private Duration _sessionTtl = DEFAULT_SESSION_TTL;
        private Duration _cleanupInterval = DEFAULT_CLEANUP_INTERVAL;

        private Builder() {
        }

        public Builder maxSessions(int maxSessions) {
            if (maxSessions < 1) {
                throw new IllegalArgumentException("maxSessions must be positive, was [" + maxSessions + "].");
            }
            _maxSessions = maxSessions;
            return this;
        }

        public Builder maxMessagesPerSession(int maxMessagesPerSession) {
            if (maxMessagesPerSession < 1) {
                throw new IllegalArgumentException("maxMessagesPerSession must be positive, was ["
                        + maxMessagesPerSession + "].");
            }
            _maxMessagesPerSession = maxMessagesPerSession;
            return this;
        }

        public Builder sessionTtl(Duration sessionTtl) {
            if (sessionTtl.isNegative() || sessionTtl.isZero()) {
                throw new IllegalArgumentException("sessionTtl must be positive, was [" + sessionTtl + "].");
            }
            _sessionTtl = sessionTtl;
            return this;
        }

        public Builder cleanupInterval(Duration cleanupInterval) {
            if (cleanupInterval.isNegative() || cleanupInterval.isZero()) {
                throw new IllegalArgumentException("cleanupInterval must be positive, was [" + cleanupInterval
                        + "].");
            }
            _cleanupInterval = cleanupInterval;
            return this;
        }

        public SessionStoreConfig build() {
            return new SessionStoreConfig(this);
        }
    }
}
