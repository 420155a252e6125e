package io.chatsocket;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The Session Store owns all conversation state of the ChatSocket server: a bounded, self-pruning mapping from session
 * id to {@link ChatSessionDto Session}, where each Session holds an ordered list of {@link ChatMessage ChatMessages}
 * and an open metadata map.
 * <p/>
 * Bounds: There will never be more than <i>maxSessions</i> Sessions in the store - creating a Session when at capacity
 * first evicts the Session with the oldest {@link ChatSessionDto#getLastActivity() lastActivity} (LRU by activity, not
 * by creation). A Session will never hold more than <i>maxMessagesPerSession</i> messages - appending a message when
 * at capacity first drops the oldest message. Both bounds thus defend against unbounded growth, while keeping the most
 * recently used Sessions, and the most recent conversational context inside each Session.
 * <p/>
 * All methods are thread safe. Nothing returned from the store is a reference into the internal state: Sessions are
 * returned as snapshots, and message lists and metadata maps are copies.
 * <p/>
 * The store is a plain in-process store: Sessions do not survive a restart, and are not shared between instances.
 */
public interface SessionStore {
    /**
     * Creates a new Session with a random id. If the store is at capacity, the least recently active Session is
     * evicted first.
     *
     * @return a snapshot of the new Session, whose {@link ChatSessionDto#getCreatedAt() createdAt} and
     *         {@link ChatSessionDto#getLastActivity() lastActivity} both are "now".
     * @throws SessionLimitExceededException
     *             if eviction could not free capacity, which should never happen with a positive maxSessions.
     */
    ChatSessionDto createSession() throws SessionLimitExceededException;

    /**
     * Creates a new Session with the specified id. If a Session with that id already exists, it is replaced by an
     * empty Session. Otherwise, if the store is at capacity, the least recently active Session is evicted first.
     *
     * @param sessionId
     *            the id to use for the new Session, typically the id the Connection Registry assigned to the
     *            connection.
     * @return a snapshot of the new Session.
     * @throws SessionLimitExceededException
     *             if eviction could not free capacity.
     */
    ChatSessionDto createSession(String sessionId) throws SessionLimitExceededException;

    /**
     * Non-throwing lookup.
     *
     * @param sessionId
     *            the id of the Session to get.
     * @return a snapshot of the Session, or {@link Optional#empty()} if no such Session exists.
     */
    Optional<ChatSessionDto> getSession(String sessionId);

    /**
     * Removes the Session if present. Idempotent, never fails.
     *
     * @param sessionId
     *            the id of the Session to delete.
     * @return whether a Session was removed.
     */
    boolean deleteSession(String sessionId);

    /**
     * Appends a message to a Session. If the Session already holds maxMessagesPerSession messages, the oldest message is
     * dropped first. Updates the Session's lastActivity.
     *
     * @param sessionId
     *            the id of the Session to append to.
     * @param message
     *            the message to append, which is validated: it must have an id, a role, non-blank content and a
     *            positive timestamp.
     * @throws SessionNotFoundException
     *             if no such Session exists.
     * @throws InvalidMessageException
     *             if the message fails validation.
     */
    void addMessage(String sessionId, ChatMessage message)
            throws SessionNotFoundException, InvalidMessageException;

    /**
     * @param sessionId
     *            the id of the Session to get messages for.
     * @return a <b>copy</b> of the Session's messages, in chronological order. Mutating the returned list does not
     *         affect the store.
     * @throws SessionNotFoundException
     *             if no such Session exists.
     */
    List<ChatMessage> getMessages(String sessionId) throws SessionNotFoundException;

    /**
     * Shallow-merges the patch into the Session's metadata, where keys in the patch win on conflict. Updates the
     * Session's lastActivity.
     *
     * @param sessionId
     *            the id of the Session whose metadata to update.
     * @param patch
     *            the entries to merge in.
     * @throws SessionNotFoundException
     *             if no such Session exists.
     */
    void updateMetadata(String sessionId, Map<String, Object> patch) throws SessionNotFoundException;

    /**
     * Removes every Session whose lastActivity is older than <code>now - ttl</code>. Safe to invoke repeatedly, and
     * concurrently with other operations.
     *
     * @param ttl
     *            how long a Session may be inactive before it is removed.
     * @return the number of Sessions removed.
     */
    int cleanupStaleSessions(Duration ttl);

    /**
     * @return the number of Sessions currently in the store.
     */
    int sessionCount();

    /**
     * @return a copy of the ids of all Sessions currently in the store.
     */
    Set<String> allSessionIds();

    /**
     * Removes all Sessions.
     */
    void clear();

    /**
     * The role of the author of a {@link ChatMessage}.
     */
    enum Role {
        USER("user"),

        ASSISTANT("assistant");

        private final String _wireName;

        Role(String wireName) {
            _wireName = wireName;
        }

        /**
         * @return the lower case name used for this role towards clients and upstream model services.
         */
        public String getWireName() {
            return _wireName;
        }
    }

    /**
     * One turn in a conversation. Immutable.
     */
    final class ChatMessage {
        private final String _id;
        private final Role _role;
        private final String _content;
        private final long _timestamp;
        private final MessageMetadata _metadata;

        public ChatMessage(String id, Role role, String content, long timestamp, MessageMetadata metadata) {
            _id = id;
            _role = role;
            _content = content;
            _timestamp = timestamp;
            _metadata = metadata;
        }

        public ChatMessage(String id, Role role, String content, long timestamp) {
            this(id, role, content, timestamp, null);
        }

        public String getId() {
            return _id;
        }

        public Role getRole() {
            return _role;
        }

        public String getContent() {
            return _content;
        }

        /**
         * @return millis since epoch.
         */
        public long getTimestamp() {
            return _timestamp;
        }

        public Optional<MessageMetadata> getMetadata() {
            return Optional.ofNullable(_metadata);
        }

        @Override
        public String toString() {
            return "ChatMessage{id=" + _id + ", role=" + _role + ", timestamp=" + _timestamp
                    + ", content.length=" + (_content == null ? "null" : _content.length()) + '}';
        }
    }

    /**
     * Optional information about how a message was produced. Immutable.
     */
    final class MessageMetadata {
        private final String _model;
        private final TokenUsage _tokens;

        public MessageMetadata(String model, TokenUsage tokens) {
            _model = model;
            _tokens = tokens;
        }

        public Optional<String> getModel() {
            return Optional.ofNullable(_model);
        }

        public Optional<TokenUsage> getTokens() {
            return Optional.ofNullable(_tokens);
        }
    }

    /**
     * Token counts reported by the upstream model service. Immutable.
     */
    final class TokenUsage {
        private final int _input;
        private final int _output;

        public TokenUsage(int input, int output) {
            _input = input;
            _output = output;
        }

        public int getInput() {
            return _input;
        }

        public int getOutput() {
            return _output;
        }
    }

    /**
     * A point-in-time snapshot of a Session: later changes in the store are not reflected, and changes to the
     * snapshot are not possible.
     */
    final class ChatSessionDto {
        private final String _id;
        private final List<ChatMessage> _messages;
        private final long _createdAt;
        private final long _lastActivity;
        private final Map<String, Object> _metadata;

        public ChatSessionDto(String id, List<ChatMessage> messages, long createdAt, long lastActivity,
                Map<String, Object> metadata) {
            _id = id;
            _messages = Collections.unmodifiableList(new ArrayList<>(messages));
            _createdAt = createdAt;
            _lastActivity = lastActivity;
            _metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        }

        public String getId() {
            return _id;
        }

        public List<ChatMessage> getMessages() {
            return _messages;
        }

        public long getCreatedAt() {
            return _createdAt;
        }

        public long getLastActivity() {
            return _lastActivity;
        }

        public Map<String, Object> getMetadata() {
            return _metadata;
        }

        @Override
        public String toString() {
            return "ChatSession{id=" + _id + ", messages=" + _messages.size() + ", createdAt=" + _createdAt
                    + ", lastActivity=" + _lastActivity + '}';
        }
    }

    /**
     * Thrown if an operation references a Session that does not exist, e.g. because it was evicted or timed out.
     */
    class SessionNotFoundException extends RuntimeException {
        private final String _sessionId;

        public SessionNotFoundException(String sessionId) {
            super("Session not found: " + sessionId);
            _sessionId = sessionId;
        }

        public String getSessionId() {
            return _sessionId;
        }
    }

    /**
     * Thrown if a message fails validation upon {@link #addMessage(String, ChatMessage) addMessage(..)}.
     */
    class InvalidMessageException extends RuntimeException {
        private final String _reason;

        public InvalidMessageException(String reason) {
            super("Invalid message: " + reason);
            _reason = reason;
        }

        public String getReason() {
            return _reason;
        }
    }

    /**
     * Thrown if creating a Session could not free capacity by eviction. This is an invariant check, and should not
     * occur with a positive maxSessions.
     */
    class SessionLimitExceededException extends RuntimeException {
        public SessionLimitExceededException(int maxSessions) {
            super("Session limit exceeded: " + maxSessions);
        }
    }
}
