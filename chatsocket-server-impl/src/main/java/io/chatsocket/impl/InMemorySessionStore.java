package io.chatsocket.impl;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chatsocket.ChatMessages;
import io.chatsocket.SessionStore;

/**
 * In-memory {@link SessionStore}, bounded by {@link SessionStoreConfig}, with an optional background cleaner removing
 * sessions that have been inactive longer than the configured TTL - see {@link #startCleanup()}.
 * <p/>
 * Concurrency: Each session has its own monitor, guarding its messages, metadata and lastActivity. Creation (with
 * eviction) is serialized on a store-wide lock, so that the capacity can never be exceeded. A session that is removed
 * from the map is marked as removed under its monitor, so that a concurrent operation which already got hold of it
 * fails with {@link SessionNotFoundException} instead of mutating a session nobody can see anymore. Lock order is
 * always store-wide lock, then session monitor.
 */
public class InMemorySessionStore implements SessionStore, ChatSocketStatics {
    private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

    private final SessionStoreConfig _config;
    private final Clock _clock;
    private final String _storeId;

    private final ConcurrentHashMap<String, SessionEntry> _sessions = new ConcurrentHashMap<>();
    private final Object _createAndEvictLock = new Object();
    private final AtomicLong _insertionSequence = new AtomicLong();

    private final Object _cleanerLock = new Object();
    private StaleSessionCleaner _cleaner; // Guarded by _cleanerLock

    public InMemorySessionStore(SessionStoreConfig config) {
        this(config, Clock.systemUTC());
    }

    public InMemorySessionStore(SessionStoreConfig config, Clock clock) {
        _config = Objects.requireNonNull(config, "config");
        _clock = Objects.requireNonNull(clock, "clock");
        _storeId = "SessionStore@" + Integer.toHexString(System.identityHashCode(this));
        log.info("Created [" + _storeId + "] with " + _config);
    }

    public SessionStoreConfig getConfig() {
        return _config;
    }

    String storeId() {
        return _storeId;
    }

    // ===== Lifecycle of the background cleaner

    /**
     * Starts the background thread which every {@link SessionStoreConfig#getCleanupInterval() cleanupInterval} invokes
     * {@link #cleanupStaleSessions(Duration)} with the configured {@link SessionStoreConfig#getSessionTtl() TTL}. Does
     * nothing if already started.
     */
    public void startCleanup() {
        synchronized (_cleanerLock) {
            // ?: Already running?
            if (_cleaner != null) {
                // -> Yes, so nothing to do.
                log.info("Cleanup for [" + _storeId + "] is already running, ignoring start.");
                return;
            }
            _cleaner = new StaleSessionCleaner(this, _config.getSessionTtl(), _config.getCleanupInterval());
        }
    }

    /**
     * Stops the background cleaner, if running, waiting max 1 second for it to exit.
     */
    public void stopCleanup() {
        stopCleanup(1000);
    }

    public void stopCleanup(int gracefulShutdownMillis) {
        StaleSessionCleaner cleaner;
        synchronized (_cleanerLock) {
            cleaner = _cleaner;
            _cleaner = null;
        }
        if (cleaner != null) {
            cleaner.shutdown(gracefulShutdownMillis);
        }
    }

    public boolean isCleanupRunning() {
        synchronized (_cleanerLock) {
            return _cleaner != null;
        }
    }

    // ===== SessionStore implementation

    @Override
    public ChatSessionDto createSession() throws SessionLimitExceededException {
        return createSession(ChatMessages.generateSessionId());
    }

    @Override
    public ChatSessionDto createSession(String sessionId) throws SessionLimitExceededException {
        Objects.requireNonNull(sessionId, "sessionId");
        SessionEntry entry = new SessionEntry(sessionId, _clock.millis(), _insertionSequence.getAndIncrement());
        SessionEntry replaced;
        synchronized (_createAndEvictLock) {
            // ?: Is this a new session id (i.e. not replacing an existing)?
            if (!_sessions.containsKey(sessionId)) {
                // -> Yes, new, so it will take up capacity. Evict until there is room.
                while (_sessions.size() >= _config.getMaxSessions()) {
                    if (!evictLeastRecentlyActive()) {
                        log.error("Could not evict any session from [" + _storeId + "] holding [" + _sessions.size()
                                + "] sessions, max [" + _config.getMaxSessions() + "] - this should not happen.");
                        throw new SessionLimitExceededException(_config.getMaxSessions());
                    }
                }
            }
            replaced = _sessions.put(sessionId, entry);
        }
        if (replaced != null) {
            replaced.markRemoved();
            log.info("Replaced existing session [" + sessionId + "] with a new, empty session.");
        }
        if (log.isDebugEnabled()) {
            log.debug("Created session [" + sessionId + "], now [" + _sessions.size() + "] sessions.");
        }
        return entry.snapshot();
    }

    /**
     * Must be invoked within _createAndEvictLock.
     *
     * @return whether a session was evicted.
     */
    private boolean evictLeastRecentlyActive() {
        SessionEntry victim = null;
        long victimLastActivity = Long.MAX_VALUE;
        for (SessionEntry candidate : _sessions.values()) {
            long lastActivity;
            synchronized (candidate) {
                if (candidate._removed) {
                    continue;
                }
                lastActivity = candidate._lastActivity;
            }
            // Ties are broken by insertion order, oldest first.
            if ((victim == null) || (lastActivity < victimLastActivity)
                    || ((lastActivity == victimLastActivity) && (candidate._insertionSeq < victim._insertionSeq))) {
                victim = candidate;
                victimLastActivity = lastActivity;
            }
        }
        // ?: Did we find any?
        if (victim == null) {
            // -> No, the map is empty (or only has removed remnants).
            return false;
        }
        // ?: Did we remove it (a concurrent delete might have beaten us to it)?
        if (_sessions.remove(victim._id, victim)) {
            // -> Yes, we removed it.
            victim.markRemoved();
            log.info("Evicted least recently active session [" + victim._id + "] from [" + _storeId
                    + "], lastActivity [" + victimLastActivity + "], to make room for new session.");
        }
        return true;
    }

    @Override
    public Optional<ChatSessionDto> getSession(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        SessionEntry entry = _sessions.get(sessionId);
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            return entry._removed ? Optional.empty() : Optional.of(entry.snapshot());
        }
    }

    @Override
    public boolean deleteSession(String sessionId) {
        if (sessionId == null) {
            return false;
        }
        SessionEntry removed = _sessions.remove(sessionId);
        if (removed == null) {
            return false;
        }
        removed.markRemoved();
        log.debug("Deleted session [" + sessionId + "].");
        return true;
    }

    @Override
    public void addMessage(String sessionId, ChatMessage message)
            throws SessionNotFoundException, InvalidMessageException {
        SessionEntry entry = getEntryOrThrow(sessionId);
        validateMessage(message);
        synchronized (entry) {
            if (entry._removed) {
                throw new SessionNotFoundException(sessionId);
            }
            // ?: At message limit?
            if (entry._messages.size() >= _config.getMaxMessagesPerSession()) {
                // -> Yes, so prune the oldest - this is expected steady-state, not an error.
                entry._messages.removeFirst();
                log.warn("Session [" + sessionId + "] reached message limit [" + _config.getMaxMessagesPerSession()
                        + "], removed oldest message.");
            }
            entry._messages.addLast(message);
            entry.touch(_clock.millis());
        }
    }

    @Override
    public List<ChatMessage> getMessages(String sessionId) throws SessionNotFoundException {
        SessionEntry entry = getEntryOrThrow(sessionId);
        synchronized (entry) {
            if (entry._removed) {
                throw new SessionNotFoundException(sessionId);
            }
            return new ArrayList<>(entry._messages);
        }
    }

    @Override
    public void updateMetadata(String sessionId, Map<String, Object> patch) throws SessionNotFoundException {
        Objects.requireNonNull(patch, "patch");
        SessionEntry entry = getEntryOrThrow(sessionId);
        synchronized (entry) {
            if (entry._removed) {
                throw new SessionNotFoundException(sessionId);
            }
            entry._metadata.putAll(patch);
            entry.touch(_clock.millis());
        }
    }

    @Override
    public int cleanupStaleSessions(Duration ttl) {
        long cutoff = _clock.millis() - ttl.toMillis();
        int removed = 0;
        for (SessionEntry entry : _sessions.values()) {
            // Read lastActivity and remove under the session's monitor, so that we never remove a session that is
            // being touched right now.
            synchronized (entry) {
                if ((!entry._removed) && (entry._lastActivity < cutoff)) {
                    if (_sessions.remove(entry._id, entry)) {
                        entry._removed = true;
                        removed++;
                    }
                }
            }
        }
        if (removed > 0) {
            log.info("Cleaned up [" + removed + "] stale sessions from [" + _storeId + "], inactive since before ["
                    + cutoff + "], now [" + _sessions.size() + "] sessions.");
        }
        return removed;
    }

    @Override
    public int sessionCount() {
        return _sessions.size();
    }

    @Override
    public Set<String> allSessionIds() {
        return new HashSet<>(_sessions.keySet());
    }

    @Override
    public void clear() {
        int count = 0;
        for (String sessionId : new ArrayList<>(_sessions.keySet())) {
            SessionEntry removed = _sessions.remove(sessionId);
            if (removed != null) {
                removed.markRemoved();
                count++;
            }
        }
        log.info("Cleared [" + count + "] sessions from [" + _storeId + "].");
    }

    // ===== Internals

    private SessionEntry getEntryOrThrow(String sessionId) throws SessionNotFoundException {
        SessionEntry entry = sessionId == null ? null : _sessions.get(sessionId);
        if (entry == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return entry;
    }

    static void validateMessage(ChatMessage message) throws InvalidMessageException {
        if (message == null) {
            throw new InvalidMessageException("Message must not be null");
        }
        if ((message.getId() == null) || message.getId().isBlank()) {
            throw new InvalidMessageException("Message must have a string ID");
        }
        if (message.getRole() == null) {
            throw new InvalidMessageException("Message role must be \"user\" or \"assistant\"");
        }
        if ((message.getContent() == null) || message.getContent().isBlank()) {
            throw new InvalidMessageException("Message content must be a non-empty string");
        }
        if (message.getTimestamp() <= 0) {
            throw new InvalidMessageException("Message timestamp must be a positive number");
        }
    }

    private static final class SessionEntry {
        private final String _id;
        private final long _createdAt;
        private final long _insertionSeq;

        // :: Guarded by 'this'
        private final ArrayDeque<ChatMessage> _messages = new ArrayDeque<>();
        private final Map<String, Object> _metadata = new LinkedHashMap<>();
        private long _lastActivity;
        private boolean _removed;

        SessionEntry(String id, long now, long insertionSeq) {
            _id = id;
            _createdAt = now;
            _lastActivity = now;
            _insertionSeq = insertionSeq;
        }

        /**
         * Must be invoked within synchronized(this). Never moves lastActivity backwards, even if the clock does.
         */
        void touch(long now) {
            _lastActivity = Math.max(_lastActivity, now);
        }

        synchronized void markRemoved() {
            _removed = true;
        }

        synchronized ChatSessionDto snapshot() {
            return new ChatSessionDto(_id, new ArrayList<>(_messages), _createdAt, _lastActivity, _metadata);
        }
    }
}
