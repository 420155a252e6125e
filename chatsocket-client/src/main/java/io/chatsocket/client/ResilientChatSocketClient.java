package io.chatsocket.client;

import java.io.IOException;
import java.net.URI;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;

import jakarta.websocket.CloseReason.CloseCodes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chatsocket.ChatSocketServer.ChatSocketCloseCodes;
import io.chatsocket.ChatSocketServer.ClientFrameDto;
import io.chatsocket.ChatSocketServer.FrameType;
import io.chatsocket.ChatSocketServer.ServerFrameDto;
import io.chatsocket.client.ClientScheduler.ScheduledTask;
import io.chatsocket.client.Transport.TransportFactory;
import io.chatsocket.client.Transport.TransportListener;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * A ChatSocket client which keeps one logical connection to the server alive:
 * <ul>
 * <li>Reconnects with capped exponential backoff when the connection is lost: the delay before attempt <i>n</i> is
 * <code>min(reconnectInterval × reconnectDecay^(n-1), maxReconnectInterval)</code>. After
 * <code>maxReconnectAttempts</code> it gives up, and reports an error. The attempt counter starts from scratch when a
 * connection opens, and also when a connection that lasted longer than the stability window is lost.</li>
 * <li>Detects half-open connections by heartbeat: pings the server every <code>heartbeatInterval</code>, and if no pong
 * comes back within <code>heartbeatTimeout</code>, closes the transport with 4000 "Heartbeat timeout", which leads to
 * a reconnect.</li>
 * <li>Queues what is sent while not connected, in a bounded FIFO which drops the oldest when full, and flushes it in
 * order when the connection opens.</li>
 * <li>Suspends the heartbeat while not {@link #setVisible(boolean) visible}, and when becoming visible again either
 * pings right away, or reconnects right away if disconnected.</li>
 * </ul>
 * All state is handled on the {@link ClientScheduler}, thus the public methods return right away, and the
 * {@link ChatSocketClientListener listeners} are invoked on the scheduler.
 */
public class ResilientChatSocketClient implements ClientStatics {
    private static final Logger log = LoggerFactory.getLogger(ResilientChatSocketClient.class);

    private final URI _uri;
    private final ClientOptions _options;
    private final TransportFactory _transportFactory;
    private final ClientScheduler _scheduler;
    private final boolean _ownsScheduler;
    private final ObjectMapper _jackson;

    private final CopyOnWriteArrayList<ChatSocketClientListener> _listeners = new CopyOnWriteArrayList<>();
    private final ConcurrentLinkedDeque<ClientFrameDto> _queue = new ConcurrentLinkedDeque<>();

    private volatile ConnectionState _state = ConnectionState.DISCONNECTED;
    private volatile int _reconnectAttempts;
    private volatile String _sessionId;
    private volatile boolean _destroyed;

    // :: Only touched on the scheduler
    private Transport _transport;
    // Incremented for each transport, and when a transport is let go of, so that its late events are ignored.
    private int _generation;
    private CompletableFuture<Void> _pendingConnect;
    private boolean _shouldReconnect = true;
    private boolean _visible = true;
    private long _connectedAt;
    private ScheduledTask _connectTimeoutTask;
    private ScheduledTask _reconnectTask;
    private ScheduledTask _heartbeatTask;
    private ScheduledTask _heartbeatTimeoutTask;

    /**
     * Creates a client using {@link ClientOptions#defaults()}, the {@link JakartaWebSocketTransportFactory} and its own
     * scheduler thread.
     */
    public static ResilientChatSocketClient create(URI uri) {
        return create(uri, ClientOptions.defaults());
    }

    public static ResilientChatSocketClient create(URI uri, ClientOptions options) {
        return new ResilientChatSocketClient(uri, options, new JakartaWebSocketTransportFactory(),
                new ExecutorClientScheduler(uri.toString()), true);
    }

    public ResilientChatSocketClient(URI uri, ClientOptions options, TransportFactory transportFactory,
            ClientScheduler scheduler) {
        this(uri, options, transportFactory, scheduler, false);
    }

    private ResilientChatSocketClient(URI uri, ClientOptions options, TransportFactory transportFactory,
            ClientScheduler scheduler, boolean ownsScheduler) {
        _uri = Objects.requireNonNull(uri, "uri");
        _options = Objects.requireNonNull(options, "options");
        _transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
        _scheduler = Objects.requireNonNull(scheduler, "scheduler");
        _ownsScheduler = ownsScheduler;
        _jackson = createNewJacksonMapper();
    }

    /**
     * The reconnect delay before the given attempt.
     *
     * @param attempt
     *            1-based.
     */
    public static long computeReconnectDelay(ClientOptions options, int attempt) {
        double delay = options.getReconnectInterval() * Math.pow(options.getReconnectDecay(), attempt - 1);
        return (long) Math.min(delay, options.getMaxReconnectInterval());
    }

    public void addListener(ChatSocketClientListener listener) {
        _listeners.add(listener);
    }

    public void removeListener(ChatSocketClientListener listener) {
        _listeners.remove(listener);
    }

    /**
     * Connects to the server, enabling reconnects if {@link #disconnect()} had disabled them. If already connecting or
     * connected, nothing happens and the returned future is completed right away.
     *
     * @return a future that completes when the transport has opened, or fails with a {@link ConnectFailedException} if
     *         it could not be opened within the connection timeout, or was closed before opening. Reconnects are
     *         scheduled also when this connect fails.
     */
    public CompletableFuture<Void> connect() {
        CompletableFuture<Void> future = new CompletableFuture<>();
        if (_destroyed) {
            future.completeExceptionally(new IllegalStateException("Client is destroyed."));
            return future;
        }
        _scheduler.execute(() -> doConnect(future));
        return future;
    }

    /**
     * Closes the connection with 1000 "Client disconnecting", stops all timers, and disables reconnects until the
     * next {@link #connect()}.
     */
    public void disconnect() {
        _scheduler.execute(this::doDisconnect);
    }

    /**
     * Disconnects, and clears listeners and queue. The client cannot be used afterwards.
     */
    public void destroy() {
        if (_destroyed) {
            return;
        }
        _destroyed = true;
        _scheduler.execute(() -> {
            doDisconnect();
            _listeners.clear();
            _queue.clear();
            log.info("Destroyed client for [" + _uri + "].");
            if (_ownsScheduler) {
                _scheduler.shutdown();
            }
        });
    }

    /**
     * Sends the frame if connected, otherwise queues it until the connection opens. A <code>user_message</code>
     * without sessionId gets the current one when sent.
     */
    public void send(ClientFrameDto frame) {
        Objects.requireNonNull(frame, "frame");
        if (_destroyed) {
            log.warn("Client is destroyed, dropping [" + frame.type + "].");
            return;
        }
        _scheduler.execute(() -> {
            // ?: Are we connected, with nothing queued?
            if ((_state == ConnectionState.CONNECTED) && _queue.isEmpty()) {
                // -> Yes, so send right away.
                try {
                    transmit(frame);
                }
                catch (IOException | JacksonException e) {
                    fireError("Failed to send message", e);
                    enqueue(frame);
                }
                return;
            }
            enqueue(frame);
            if (_state == ConnectionState.CONNECTED) {
                flushQueue();
            }
        });
    }

    /**
     * Sends a <code>user_message</code> in the current session.
     */
    public void sendUserMessage(String content) {
        send(ClientFrameDto.userMessage(content, _sessionId));
    }

    /**
     * While not visible, the heartbeat is suspended. When becoming visible, a connected client pings right away, and a
     * disconnected one reconnects right away, without waiting for any pending backoff.
     */
    public void setVisible(boolean visible) {
        _scheduler.execute(() -> {
            _visible = visible;
            if (!visible) {
                stopHeartbeat();
                return;
            }
            if (_state == ConnectionState.CONNECTED) {
                startHeartbeat(true);
            }
            else if (_shouldReconnect && !_destroyed
                    && ((_state == ConnectionState.DISCONNECTED) || (_state == ConnectionState.RECONNECTING))) {
                log.info("Became visible while [" + _state + "], reconnecting right away.");
                cancel(_reconnectTask);
                _reconnectTask = null;
                doConnect(reconnectFuture());
            }
        });
    }

    public ConnectionState getState() {
        return _state;
    }

    public boolean isConnected() {
        return _state == ConnectionState.CONNECTED;
    }

    public int getReconnectAttempts() {
        return _reconnectAttempts;
    }

    public int getQueuedMessageCount() {
        return _queue.size();
    }

    /**
     * @return the session id from the last <code>connection_established</code>, or <code>null</code> if none yet.
     */
    public String getSessionId() {
        return _sessionId;
    }

    public URI getUri() {
        return _uri;
    }

    // ===== Internals, all run on the scheduler

    private void doConnect(CompletableFuture<Void> future) {
        if (_destroyed) {
            future.completeExceptionally(new IllegalStateException("Client is destroyed."));
            return;
        }
        // ?: Already connecting or connected?
        if ((_state == ConnectionState.CONNECTING) || (_state == ConnectionState.CONNECTED)) {
            // -> Yes, so nothing to do.
            log.warn("connect() invoked when already [" + _state + "], ignoring.");
            future.complete(null);
            return;
        }
        cancel(_reconnectTask);
        _reconnectTask = null;
        _shouldReconnect = true;
        _state = ConnectionState.CONNECTING;
        _pendingConnect = future;

        int generation = ++_generation;
        log.info("Connecting to [" + _uri + "], reconnect attempt [" + _reconnectAttempts + "].");
        _connectTimeoutTask = _scheduler.schedule(() -> connectTimedOut(generation),
                _options.getConnectionTimeout());
        try {
            _transport = _transportFactory.open(_uri, new TransportEvents(generation));
        }
        catch (RuntimeException e) {
            log.warn("TransportFactory raised [" + e.getClass().getSimpleName() + "] when opening [" + _uri + "].",
                    e);
            transportLost(generation, CloseCodes.CLOSED_ABNORMALLY.getCode(),
                    "Could not open transport: " + e.getMessage(), e);
        }
    }

    private void doDisconnect() {
        _shouldReconnect = false;
        cancel(_reconnectTask);
        _reconnectTask = null;
        cancel(_connectTimeoutTask);
        _connectTimeoutTask = null;
        stopHeartbeat();

        Transport transport = _transport;
        _transport = null;
        // Let go of the transport, so that its close event is ignored.
        _generation++;
        _state = ConnectionState.DISCONNECTED;
        _reconnectAttempts = 0;
        _connectedAt = 0;

        if (transport != null) {
            log.info("Disconnecting from [" + _uri + "].");
            transport.close(ChatSocketCloseCodes.NORMAL_CLOSURE.getCode(), CLIENT_DISCONNECTING);
            fireClose(ChatSocketCloseCodes.NORMAL_CLOSURE.getCode(), CLIENT_DISCONNECTING);
        }
        failPendingConnect(CLIENT_DISCONNECTING);
    }

    private void transportOpened(int generation) {
        if (generation != _generation) {
            log.debug("Got open from an abandoned transport, ignoring.");
            return;
        }
        cancel(_connectTimeoutTask);
        _connectTimeoutTask = null;

        _state = ConnectionState.CONNECTED;
        _connectedAt = _scheduler.currentTimeMillis();
        boolean wasReconnecting = _reconnectAttempts > 0;
        _reconnectAttempts = 0;
        log.info("Connected to [" + _uri + "]" + (wasReconnecting ? ", after reconnecting." : "."));

        fireEvent("onOpen", ChatSocketClientListener::onOpen);
        if (wasReconnecting) {
            fireEvent("onReconnected", ChatSocketClientListener::onReconnected);
        }
        flushQueue();
        startHeartbeat(false);

        CompletableFuture<Void> pending = _pendingConnect;
        _pendingConnect = null;
        if (pending != null) {
            pending.complete(null);
        }
    }

    private void textReceived(int generation, String text) {
        if (generation != _generation) {
            return;
        }
        ServerFrameDto frame;
        try {
            frame = _jackson.readValue(text, ServerFrameDto.class);
        }
        catch (JacksonException e) {
            fireError("Failed to parse message", e);
            return;
        }
        FrameType frameType = frame.frameType().orElse(null);
        if (frameType == FrameType.PONG) {
            cancel(_heartbeatTimeoutTask);
            _heartbeatTimeoutTask = null;
            return;
        }
        if (frameType == FrameType.PING) {
            try {
                transmit(ClientFrameDto.pong());
            }
            catch (IOException | JacksonException e) {
                log.warn("Could not answer server ping.", e);
            }
            return;
        }
        if (frameType == FrameType.CONNECTION_ESTABLISHED) {
            log.info("Server assigned sessionId [" + frame.sessionId + "].");
            _sessionId = frame.sessionId;
        }
        ServerFrameDto received = frame;
        fireEvent("onMessage", listener -> listener.onMessage(received));
    }

    private void transportLost(int generation, int code, String reason, Throwable cause) {
        if (generation != _generation) {
            log.debug("Got close or error from an abandoned transport, ignoring.");
            return;
        }
        if (cause != null) {
            fireError("Transport error", cause);
        }
        // Let go of the transport, so that any further events from it are ignored.
        _generation++;
        cancel(_connectTimeoutTask);
        _connectTimeoutTask = null;
        stopHeartbeat();

        boolean wasConnected = _state == ConnectionState.CONNECTED;
        long connectionDuration = wasConnected ? _scheduler.currentTimeMillis() - _connectedAt : 0;
        Transport transport = _transport;
        _transport = null;
        _state = ConnectionState.DISCONNECTED;
        _connectedAt = 0;
        // ?: Is the transport still open, e.g. after an error?
        if ((transport != null) && transport.isOpen()) {
            // -> Yes, so close it - we are done with it.
            transport.close(ChatSocketCloseCodes.UNEXPECTED_CONDITION.getCode(), reason);
        }

        log.info("Connection to [" + _uri + "] lost, code [" + ChatSocketCloseCodes.getCloseCode(code) + "], reason ["
                + reason + "]" + (wasConnected ? ", having been connected for [" + connectionDuration + " ms]." : "."));
        fireClose(code, reason);

        if (_shouldReconnect && _options.isReconnect() && !_destroyed) {
            // ?: Was this a stable connection?
            if (wasConnected && (connectionDuration > _options.getStabilityWindow())) {
                // -> Yes, so it gets a fresh budget of attempts.
                _reconnectAttempts = 0;
            }
            scheduleReconnect();
        }
        failPendingConnect("Connection failed: " + (reason == null || reason.isEmpty() ? "Unknown reason" : reason));
    }

    private void connectTimedOut(int generation) {
        if ((generation != _generation) || (_state != ConnectionState.CONNECTING)) {
            return;
        }
        log.warn("Connect to [" + _uri + "] did not complete within [" + _options.getConnectionTimeout()
                + " ms], closing transport.");
        _connectTimeoutTask = null;
        failPendingConnect(CONNECTION_TIMEOUT);
        Transport transport = _transport;
        if (transport != null) {
            transport.close(ChatSocketCloseCodes.CONNECT_TIMEOUT.getCode(), CONNECTION_TIMEOUT);
        }
        transportLost(generation, ChatSocketCloseCodes.CONNECT_TIMEOUT.getCode(), CONNECTION_TIMEOUT, null);
    }

    private void scheduleReconnect() {
        // ?: Have we used up all attempts?
        if (_reconnectAttempts >= _options.getMaxReconnectAttempts()) {
            // -> Yes, so give up.
            log.error("Giving up reconnecting to [" + _uri + "] after [" + _reconnectAttempts + "] attempts.");
            fireError("Max reconnection attempts (" + _options.getMaxReconnectAttempts() + ") reached", null);
            return;
        }
        int attempt = ++_reconnectAttempts;
        long delay = computeReconnectDelay(_options, attempt);
        _state = ConnectionState.RECONNECTING;
        log.info("Scheduling reconnect attempt [" + attempt + "] to [" + _uri + "] in [" + delay + " ms].");
        fireEvent("onReconnecting", listener -> listener.onReconnecting(attempt, delay));
        _reconnectTask = _scheduler.schedule(() -> {
            _reconnectTask = null;
            doConnect(reconnectFuture());
        }, delay);
    }

    private CompletableFuture<Void> reconnectFuture() {
        CompletableFuture<Void> future = new CompletableFuture<>();
        future.whenComplete((v, t) -> {
            if (t != null) {
                log.debug("Reconnect attempt to [" + _uri + "] failed: " + t.getMessage());
            }
        });
        return future;
    }

    private void failPendingConnect(String message) {
        CompletableFuture<Void> pending = _pendingConnect;
        _pendingConnect = null;
        if (pending != null) {
            pending.completeExceptionally(new ConnectFailedException(message));
        }
    }

    // :: Heartbeat

    private void startHeartbeat(boolean pingNow) {
        stopHeartbeat();
        if (!_visible) {
            return;
        }
        if (pingNow) {
            heartbeat();
        }
        else {
            _heartbeatTask = _scheduler.schedule(this::heartbeat, _options.getHeartbeatInterval());
        }
    }

    private void heartbeat() {
        _heartbeatTask = _scheduler.schedule(this::heartbeat, _options.getHeartbeatInterval());
        if (_state != ConnectionState.CONNECTED) {
            return;
        }
        try {
            transmit(ClientFrameDto.ping());
        }
        catch (IOException | JacksonException e) {
            log.warn("Could not send heartbeat ping.", e);
        }
        // ?: Already waiting for a pong?
        if (_heartbeatTimeoutTask == null) {
            // -> No, so start waiting.
            int generation = _generation;
            _heartbeatTimeoutTask = _scheduler.schedule(() -> heartbeatTimedOut(generation),
                    _options.getHeartbeatTimeout());
        }
    }

    private void heartbeatTimedOut(int generation) {
        _heartbeatTimeoutTask = null;
        if ((generation != _generation) || (_state != ConnectionState.CONNECTED)) {
            return;
        }
        log.error("No pong received from [" + _uri + "] within [" + _options.getHeartbeatTimeout()
                + " ms], closing transport to reconnect.");
        Transport transport = _transport;
        if (transport != null) {
            transport.close(ChatSocketCloseCodes.HEARTBEAT_TIMEOUT.getCode(), HEARTBEAT_TIMEOUT);
        }
        transportLost(generation, ChatSocketCloseCodes.HEARTBEAT_TIMEOUT.getCode(), HEARTBEAT_TIMEOUT, null);
    }

    private void stopHeartbeat() {
        cancel(_heartbeatTask);
        _heartbeatTask = null;
        cancel(_heartbeatTimeoutTask);
        _heartbeatTimeoutTask = null;
    }

    // :: Outbound

    private void enqueue(ClientFrameDto frame) {
        // ?: Is the queue full?
        if (_queue.size() >= _options.getMaxQueueSize()) {
            // -> Yes, so drop the oldest.
            ClientFrameDto dropped = _queue.pollFirst();
            log.warn("Outbound queue full at [" + _options.getMaxQueueSize() + "], dropped oldest ["
                    + (dropped == null ? null : dropped.type) + "].");
        }
        _queue.addLast(frame);
    }

    private void flushQueue() {
        while (!_queue.isEmpty() && (_state == ConnectionState.CONNECTED)) {
            ClientFrameDto frame = _queue.pollFirst();
            if (frame == null) {
                return;
            }
            try {
                transmit(frame);
            }
            catch (IOException | JacksonException e) {
                // Put it back where it was, and try again on next connect.
                _queue.addFirst(frame);
                fireError("Failed to flush message queue", e);
                return;
            }
        }
    }

    private void transmit(ClientFrameDto frame) throws IOException {
        Transport transport = _transport;
        if (transport == null) {
            throw new IOException("No transport.");
        }
        if (FrameType.USER_MESSAGE.getWireName().equals(frame.type) && (frame.sessionId == null)) {
            frame.sessionId = _sessionId != null ? _sessionId : "";
        }
        transport.sendText(_jackson.writeValueAsString(frame));
    }

    // :: Listeners

    private void fireClose(int code, String reason) {
        fireEvent("onClose", listener -> listener.onClose(code, reason));
    }

    private void fireError(String message, Throwable cause) {
        fireEvent("onError", listener -> listener.onError(message, cause));
    }

    private void fireEvent(String eventName, ListenerInvocation invocation) {
        for (ChatSocketClientListener listener : _listeners) {
            try {
                invocation.invoke(listener);
            }
            catch (Throwable t) {
                log.error("ChatSocketClientListener [" + listener + "] raised [" + t.getClass().getSimpleName()
                        + "] from " + eventName + "(..) - ignoring.", t);
            }
        }
    }

    private static void cancel(ScheduledTask task) {
        if (task != null) {
            task.cancel();
        }
    }

    @FunctionalInterface
    private interface ListenerInvocation {
        void invoke(ChatSocketClientListener listener);
    }

    /**
     * Receives one transport's events, and hands them over to the scheduler, tagged with the transport's generation.
     */
    private class TransportEvents implements TransportListener {
        private final int _transportGeneration;

        TransportEvents(int transportGeneration) {
            _transportGeneration = transportGeneration;
        }

        @Override
        public void transportOpened() {
            _scheduler.execute(() -> ResilientChatSocketClient.this.transportOpened(_transportGeneration));
        }

        @Override
        public void textReceived(String text) {
            _scheduler.execute(() -> ResilientChatSocketClient.this.textReceived(_transportGeneration, text));
        }

        @Override
        public void transportClosed(int code, String reason) {
            _scheduler.execute(() -> transportLost(_transportGeneration, code, reason, null));
        }

        @Override
        public void transportError(Throwable throwable) {
            _scheduler.execute(() -> transportLost(_transportGeneration, CloseCodes.CLOSED_ABNORMALLY.getCode(),
                    String.valueOf(throwable.getMessage()), throwable));
        }
    }

    /**
     * The transport could not be opened, or was closed before it opened.
     */
    public static class ConnectFailedException extends Exception {
        public ConnectFailedException(String message) {
            super(message);
        }
    }
}
