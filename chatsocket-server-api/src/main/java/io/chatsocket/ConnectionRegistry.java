package io.chatsocket;

import java.io.IOException;
import java.util.Optional;
import java.util.Set;

import jakarta.websocket.CloseReason.CloseCode;

/**
 * Maps a session id to the one transport, a {@link PushChannel}, that currently is capable of receiving pushes for
 * that session. At most one channel is tracked per session id: a later registration for the same id replaces the
 * former, which then is considered stale and is excluded from sends.
 * <p/>
 * A failed send is treated as a de-facto disconnect: the mapping is removed, so that subsequent sends and broadcasts
 * skip it.
 */
public interface ConnectionRegistry {
    /**
     * Registers the channel under a freshly generated, unique session id.
     *
     * @param channel
     *            the channel to push frames to.
     * @return the new session id.
     */
    String register(PushChannel channel);

    /**
     * Registers the channel under the specified session id, replacing any existing registration for that id.
     *
     * @param sessionId
     *            the session id to register under.
     * @param channel
     *            the channel to push frames to.
     */
    void register(String sessionId, PushChannel channel);

    /**
     * Removes the mapping for the session id, if present. Idempotent.
     */
    void unregister(String sessionId);

    /**
     * Removes the mapping for the session id only if it still refers to the specified channel - so that a stale
     * channel closing will not remove a newer registration for the same session id.
     *
     * @return whether the mapping was removed.
     */
    boolean unregister(String sessionId, PushChannel channel);

    /**
     * Sends the payload to the channel registered for the session id. Fails if there is no mapping, if the channel is
     * not open, or if the write throws - in all failure cases the mapping is removed.
     *
     * @return <code>true</code> if the payload was written to the channel.
     */
    boolean sendTo(String sessionId, String payload);

    /**
     * Best-effort send to every currently open channel. Failures for individual channels are logged and not
     * propagated, and the failed channels are unregistered.
     *
     * @return the number of channels the payload was successfully written to.
     */
    int broadcast(String payload);

    /**
     * @return the number of registered channels.
     */
    int count();

    /**
     * @return a copy of the session ids of all registered channels.
     */
    Set<String> activeIds();

    /**
     * @return the registered connection for the session id, or {@link Optional#empty()} if none.
     */
    Optional<ConnectionDto> getConnection(String sessionId);

    /**
     * Removes all mappings whose channel is no longer open.
     *
     * @return the number of mappings removed.
     */
    int cleanupClosedConnections();

    /**
     * The server side handle to a live transport, e.g. a WebSocket Session.
     */
    interface PushChannel {
        boolean isOpen();

        /**
         * Writes one text frame. Implementations must be safe to invoke from multiple threads.
         */
        void sendText(String text) throws IOException;

        /**
         * Closes the transport. Does nothing if already closed.
         */
        void close(CloseCode closeCode, String reason);
    }

    /**
     * A registered connection: the session id, the channel, and when it was registered.
     */
    final class ConnectionDto {
        private final String _sessionId;
        private final PushChannel _channel;
        private final long _connectedAt;

        public ConnectionDto(String sessionId, PushChannel channel, long connectedAt) {
            _sessionId = sessionId;
            _channel = channel;
            _connectedAt = connectedAt;
        }

        public String getSessionId() {
            return _sessionId;
        }

        public PushChannel getChannel() {
            return _channel;
        }

        /**
         * @return millis since epoch of registration.
         */
        public long getConnectedAt() {
            return _connectedAt;
        }
    }
}
