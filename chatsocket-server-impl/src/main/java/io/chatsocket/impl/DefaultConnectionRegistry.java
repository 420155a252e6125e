package io.chatsocket.impl;

import java.io.IOException;
import java.util.HashSet;
import java.util.Map.Entry;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chatsocket.ConnectionRegistry;

/**
 * {@link ConnectionRegistry} backed by a {@link ConcurrentHashMap}. Removals that stem from a specific channel (send
 * failure, close of that channel) are conditional on the mapping still referring to that channel, so that a newer
 * registration for the same session id is never removed by the demise of an older one.
 */
public class DefaultConnectionRegistry implements ConnectionRegistry, ChatSocketStatics {
    private static final Logger log = LoggerFactory.getLogger(DefaultConnectionRegistry.class);

    private final ConcurrentHashMap<String, ConnectionDto> _connections = new ConcurrentHashMap<>();

    @Override
    public String register(PushChannel channel) {
        Objects.requireNonNull(channel, "channel");
        // UUIDs are random enough that a collision is not a practical concern, but we do not want to silently
        // replace a live connection if it should happen.
        while (true) {
            String sessionId = UUID.randomUUID().toString();
            ConnectionDto connection = new ConnectionDto(sessionId, channel, System.currentTimeMillis());
            if (_connections.putIfAbsent(sessionId, connection) == null) {
                log.debug("Registered connection [" + sessionId + "], now [" + _connections.size()
                        + "] connections.");
                return sessionId;
            }
        }
    }

    @Override
    public void register(String sessionId, PushChannel channel) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(channel, "channel");
        ConnectionDto previous = _connections.put(sessionId,
                new ConnectionDto(sessionId, channel, System.currentTimeMillis()));
        if ((previous != null) && (previous.getChannel() != channel)) {
            log.info("Registered connection [" + sessionId + "], replacing an existing registration, which is now"
                    + " stale.");
        }
        else {
            log.debug("Registered connection [" + sessionId + "].");
        }
    }

    @Override
    public void unregister(String sessionId) {
        if (sessionId == null) {
            return;
        }
        if (_connections.remove(sessionId) != null) {
            log.debug("Unregistered connection [" + sessionId + "], now [" + _connections.size()
                    + "] connections.");
        }
    }

    @Override
    public boolean unregister(String sessionId, PushChannel channel) {
        if (sessionId == null) {
            return false;
        }
        boolean[] removed = new boolean[1];
        // Only remove if it is the same channel.
        _connections.computeIfPresent(sessionId, (id, existing) -> {
            if (existing.getChannel() == channel) {
                removed[0] = true;
                return null;
            }
            return existing;
        });
        if (removed[0]) {
            log.debug("Unregistered connection [" + sessionId + "], now [" + _connections.size()
                    + "] connections.");
        }
        else {
            log.debug("Did not unregister connection [" + sessionId + "], as it was either not registered, or"
                    + " registered with another channel.");
        }
        return removed[0];
    }

    @Override
    public boolean sendTo(String sessionId, String payload) {
        ConnectionDto connection = sessionId == null ? null : _connections.get(sessionId);
        // ?: Do we have a connection for this session?
        if (connection == null) {
            // -> No, so cannot send.
            log.debug("Cannot send to [" + sessionId + "], no registered connection.");
            return false;
        }
        return sendTo(connection, payload);
    }

    private boolean sendTo(ConnectionDto connection, String payload) {
        PushChannel channel = connection.getChannel();
        // ?: Is the channel open?
        if (!channel.isOpen()) {
            // -> No, so it is de-facto disconnected.
            log.debug("Cannot send to [" + connection.getSessionId() + "], channel is not open - unregistering.");
            unregister(connection.getSessionId(), channel);
            return false;
        }
        try {
            channel.sendText(payload);
            return true;
        }
        catch (IOException | RuntimeException e) {
            // A send failure is treated as a disconnect.
            log.warn("Got problems sending to [" + connection.getSessionId() + "] - unregistering.", e);
            unregister(connection.getSessionId(), channel);
            return false;
        }
    }

    @Override
    public int broadcast(String payload) {
        int sent = 0;
        int failed = 0;
        for (ConnectionDto connection : _connections.values()) {
            // Per-peer failures are handled (logged and unregistered) inside sendTo.
            if (sendTo(connection, payload)) {
                sent++;
            }
            else {
                failed++;
            }
        }
        log.debug("Broadcast to [" + sent + "] connections, [" + failed + "] failed.");
        return sent;
    }

    @Override
    public int count() {
        return _connections.size();
    }

    @Override
    public Set<String> activeIds() {
        return new HashSet<>(_connections.keySet());
    }

    @Override
    public Optional<ConnectionDto> getConnection(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(_connections.get(sessionId));
    }

    @Override
    public int cleanupClosedConnections() {
        int removed = 0;
        for (Entry<String, ConnectionDto> entry : _connections.entrySet()) {
            PushChannel channel = entry.getValue().getChannel();
            if (!channel.isOpen() && unregister(entry.getKey(), channel)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Cleaned up [" + removed + "] closed connections, now [" + _connections.size()
                    + "] connections.");
        }
        return removed;
    }
}
