package io.chatsocket.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;

import jakarta.websocket.CloseReason;
import jakarta.websocket.DeploymentException;
import jakarta.websocket.Endpoint;
import jakarta.websocket.EndpointConfig;
import jakarta.websocket.Session;
import jakarta.websocket.server.ServerContainer;
import jakarta.websocket.server.ServerEndpointConfig.Builder;
import jakarta.websocket.server.ServerEndpointConfig.Configurator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import io.chatsocket.ChatSocketServer;
import io.chatsocket.ConnectionRegistry;
import io.chatsocket.ConnectionRegistry.ConnectionDto;
import io.chatsocket.ModelClient;
import io.chatsocket.SessionStore;
import io.chatsocket.SessionStore.SessionLimitExceededException;

/**
 * The default implementation of {@link ChatSocketServer}: registers a WebSocket endpoint on a JSR 356
 * {@link ServerContainer}, and wires each connection through the {@link ConnectionRegistry}, the
 * {@link SessionStore}, the {@link MessageRouter} and the {@link StreamBroadcaster}.
 * <p/>
 * Each connection gets a fresh session id, assigned by the registry, and an empty session in the store. The store's
 * session is not deleted when the connection closes - it lives until stale-session cleanup or eviction removes it.
 */
public class DefaultChatSocketServer implements ChatSocketServer, ChatSocketStatics {
    private static final Logger log = LoggerFactory.getLogger(DefaultChatSocketServer.class);

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    /**
     * Creates a ChatSocketServer, registering its WebSocket endpoint on the given path. The server is "running" when
     * this method returns, and a {@link ConversationHandler} using the given {@link ModelClient} handles user messages
     * unless {@link #setUserMessageHandler(UserMessageHandler)} replaces it.
     *
     * @param serverContainer
     *            the JSR 356 ServerContainer to register the endpoint on.
     * @param websocketPath
     *            the path to register the endpoint on, e.g. "/chat".
     * @param sessionStore
     *            the store holding the conversations.
     * @param modelClient
     *            the upstream model.
     * @return the created server.
     */
    public static DefaultChatSocketServer createChatSocketServer(ServerContainer serverContainer,
            String websocketPath, SessionStore sessionStore, ModelClient modelClient) {
        DefaultChatSocketServer chatSocketServer = new DefaultChatSocketServer(sessionStore, modelClient);

        log.info("Registering ChatSocket WebSocket endpoint [" + websocketPath + "] for [" + chatSocketServer
                .serverId() + "].");
        Configurator configurator = new Configurator() {
            @Override
            @SuppressWarnings("unchecked") // The cast to (T) is not dodgy.
            public <T> T getEndpointInstance(Class<T> endpointClass) {
                if (endpointClass != ChatWebSocketInstance.class) {
                    throw new AssertionError("Cannot create Endpoints of type [" + endpointClass.getName() + "]");
                }
                return (T) new ChatWebSocketInstance(chatSocketServer);
            }
        };
        try {
            serverContainer.addEndpoint(Builder.create(ChatWebSocketInstance.class, websocketPath)
                    .configurator(configurator)
                    .build());
        }
        catch (DeploymentException e) {
            throw new AssertionError("Could not register ChatSocket endpoint", e);
        }
        return chatSocketServer;
    }

    private final String _serverId;
    private final SessionStore _sessionStore;
    private final ConnectionRegistry _connectionRegistry;
    private final StreamBroadcaster _streamBroadcaster;
    private final MessageRouter _messageRouter;
    private final ConversationHandler _conversationHandler;
    private final SaneThreadPoolExecutor _lanePool;

    private final CopyOnWriteArrayList<ConnectionEventListener> _connectionEventListeners = new CopyOnWriteArrayList<>();

    private volatile boolean _stopped;

    DefaultChatSocketServer(SessionStore sessionStore, ModelClient modelClient) {
        _serverId = "ChatSocketServer_" + rnd(8);
        _sessionStore = sessionStore;
        _connectionRegistry = new DefaultConnectionRegistry();
        _streamBroadcaster = new StreamBroadcaster(_connectionRegistry);
        _conversationHandler = new ConversationHandler(sessionStore, modelClient, _streamBroadcaster);
        _messageRouter = new MessageRouter(_conversationHandler);
        _lanePool = new SaneThreadPoolExecutor(MIN_WORKER_POOL_SIZE, MAX_WORKER_POOL_SIZE, "Lane", _serverId);
        log.info("Instantiated [" + _serverId + "], SessionStore [" + id(sessionStore) + "], ModelClient ["
                + modelClient.getModelName() + "].");
    }

    String serverId() {
        return _serverId;
    }

    @Override
    public SessionStore getSessionStore() {
        return _sessionStore;
    }

    @Override
    public ConnectionRegistry getConnectionRegistry() {
        return _connectionRegistry;
    }

    @Override
    public void setUserMessageHandler(UserMessageHandler handler) {
        log.info("Setting UserMessageHandler [" + (handler == null ? "null" : id(handler)) + "] on [" + _serverId
                + "].");
        _messageRouter.setUserMessageHandler(handler);
    }

    @Override
    public void addConnectionEventListener(ConnectionEventListener listener) {
        _connectionEventListeners.add(listener);
    }

    public ConversationHandler getConversationHandler() {
        return _conversationHandler;
    }

    MessageRouter getMessageRouter() {
        return _messageRouter;
    }

    StreamBroadcaster getStreamBroadcaster() {
        return _streamBroadcaster;
    }

    SaneThreadPoolExecutor getLanePool() {
        return _lanePool;
    }

    @Override
    public void stop(int gracefulShutdownMillis) {
        log.info("Asked to shut down ChatSocketServer [" + _serverId + "], having [" + _connectionRegistry.count()
                + "] active connections.");

        // Hinder further WebSockets connecting to us.
        _stopped = true;

        // :: Let currently streaming responses finish up first.
        _lanePool.shutdownNice(gracefulShutdownMillis);

        // :: Close all WebSockets, with SERVICE_RESTART, which asks the clients to reconnect.
        List<String> sessionIds = new ArrayList<>(_connectionRegistry.activeIds());
        for (String sessionId : sessionIds) {
            Optional<ConnectionDto> connection = _connectionRegistry.getConnection(sessionId);
            if (connection.isPresent()) {
                connection.get().getChannel().close(ChatSocketCloseCodes.SERVICE_RESTART,
                        "From Server: Server instance is going down, please reconnect.");
                _connectionRegistry.unregister(sessionId, connection.get().getChannel());
            }
        }
    }

    void invokeConnectionEventListeners(ConnectionEventImpl event) {
        for (ConnectionEventListener listener : _connectionEventListeners) {
            try {
                listener.connectionEvent(event);
            }
            catch (Throwable t) {
                log.error("ConnectionEventListener [" + id(listener) + "] raised a [" + t.getClass().getSimpleName()
                        + "] when invoked with [" + event + "] - ignoring.", t);
            }
        }
    }

    /**
     * Shall be one instance per socket (i.e. from the docs: "..there will be precisely one endpoint instance per active
     * client connection"), thus 1:1 with the WebSocket Session, and with the ChatSocket session id.
     */
    public static class ChatWebSocketInstance extends Endpoint {
        private final DefaultChatSocketServer _chatSocketServer;

        // Will be set when onOpen is invoked
        private WebSocketPushChannel _pushChannel;
        private ChatSocketConnectionHandler _connectionHandler;

        private boolean _isTimeoutException;

        ChatWebSocketInstance(DefaultChatSocketServer chatSocketServer) {
            log.info("Created ChatWebSocketInstance: " + id(this));
            _chatSocketServer = chatSocketServer;
        }

        @Override
        public void onOpen(Session session, EndpointConfig config) {
            try { // finally: MDC.clear()
                MDC.put(MDC_CONNECTION_ID, session.getId());
                log.info("WebSocket @OnOpen, WebSocket SessionId:" + session.getId() + ", this:" + id(this));

                // ?: If we are going down, then immediately close it.
                if (_chatSocketServer._stopped) {
                    WebSocketPushChannel.closeWebSocket(session, ChatSocketCloseCodes.SERVICE_RESTART,
                            "This server is going down, perform a (re)connect to another instance.");
                    return;
                }

                // We do not handle binary messages, so limit that pretty hard.
                session.setMaxBinaryMessageBufferSize(1024);
                session.setMaxTextMessageBufferSize(MAX_TEXT_MESSAGE_SIZE);
                session.setMaxIdleTimeout(MAX_IDLE_TIMEOUT_MILLIS);

                // :: Register the connection, which assigns the session id.
                _pushChannel = new WebSocketPushChannel(session);
                String sessionId = _chatSocketServer._connectionRegistry.register(_pushChannel);
                MDC.put(MDC_SESSION_ID, sessionId);

                // :: Create the (empty) session in the store.
                try {
                    _chatSocketServer._sessionStore.createSession(sessionId);
                }
                catch (SessionLimitExceededException e) {
                    log.error("Could not create session for new connection [" + sessionId + "], closing WebSocket.",
                            e);
                    _chatSocketServer._connectionRegistry.unregister(sessionId, _pushChannel);
                    _pushChannel.close(ChatSocketCloseCodes.UNEXPECTED_CONDITION, "Could not create session.");
                    _pushChannel = null;
                    return;
                }

                // :: Register the MessageHandler
                _connectionHandler = new ChatSocketConnectionHandler(_chatSocketServer, session, sessionId);
                session.addMessageHandler(_connectionHandler);

                // :: Tell the client its session id.
                _chatSocketServer._streamBroadcaster.sendFrame(sessionId,
                        ServerFrameDto.connectionEstablished(sessionId, CONNECTED_CONTENT));

                _chatSocketServer.invokeConnectionEventListeners(new ConnectionEventImpl(
                        ConnectionEvent.ConnectionEventType.ESTABLISHED, sessionId, null, null));
            }
            finally {
                MDC.clear();
            }
        }

        @Override
        public void onError(Session session, Throwable thr) {
            try { // finally: MDC.clear()
                String sessionId = sessionIdOrNull();
                if (_connectionHandler != null) {
                    _connectionHandler.setMDC();
                }

                // Deduce if this is a Server side timeout
                // Note: This is modelled after Jetty. If different with other JSR 356 implementations, please expand.
                _isTimeoutException = (thr.getCause() instanceof TimeoutException
                        || ((thr.getMessage() != null) && thr.getMessage().toLowerCase().contains("timeout expired")));

                // ?: Is it a timeout situation?
                if (_isTimeoutException) {
                    // -> Yes, timeout. The client has probably lost its connection, and will reconnect. Log info.
                    log.info("WebSocket @OnError: WebSocket server timed out the connection. ChatSocket SessionId: ["
                            + sessionId + "], WebSocket SessionId:" + session.getId() + ", this:" + id(this));
                }
                else {
                    log.warn("WebSocket @OnError, ChatSocket SessionId: [" + sessionId + "], WebSocket SessionId:"
                            + session.getId() + ", this:" + id(this),
                            new Exception("ChatSocketServer's webSocket.onError(..) handler", thr));
                }

                // ?: Did we get so far as registering the connection?
                if (sessionId != null) {
                    // -> Yes, so this connection is no longer usable.
                    _chatSocketServer._connectionRegistry.unregister(sessionId, _pushChannel);
                    _chatSocketServer.invokeConnectionEventListeners(new ConnectionEventImpl(
                            ConnectionEvent.ConnectionEventType.ERROR, sessionId, null,
                            thr.getClass().getSimpleName() + ": " + thr.getMessage()));
                }
            }
            finally {
                MDC.clear();
            }
        }

        @Override
        public void onClose(Session session, CloseReason closeReason) {
            try { // finally: MDC.clear()
                String sessionId = sessionIdOrNull();
                if (_connectionHandler != null) {
                    _connectionHandler.setMDC();
                }
                int closeCode = closeReason.getCloseCode().getCode();
                log.info("WebSocket @OnClose, code:[" + ChatSocketCloseCodes.getCloseCode(closeCode)
                        + "] (timeout:[" + _isTimeoutException + "]), reason:[" + closeReason.getReasonPhrase()
                        + "], ChatSocket SessionId: [" + sessionId + "], WebSocket SessionId:" + session.getId()
                        + ", this:" + id(this));

                // ?: Have we registered the connection? (onOpen might have closed it right away)
                if (sessionId != null) {
                    // -> Yes, so deregister - but only if it is still ours. The session stays in the store.
                    _chatSocketServer._connectionRegistry.unregister(sessionId, _pushChannel);
                    _chatSocketServer.invokeConnectionEventListeners(new ConnectionEventImpl(
                            ConnectionEvent.ConnectionEventType.CLOSED, sessionId, closeCode,
                            closeReason.getReasonPhrase()));
                }
            }
            finally {
                MDC.clear();
            }
        }

        private String sessionIdOrNull() {
            return _connectionHandler == null ? null : _connectionHandler.getSessionId();
        }
    }

    static class ConnectionEventImpl implements ConnectionEvent {
        private final ConnectionEventType _type;
        private final String _sessionId;
        private final Integer _closeCode;
        private final String _reason;

        ConnectionEventImpl(ConnectionEventType type, String sessionId, Integer closeCode, String reason) {
            _type = type;
            _sessionId = sessionId;
            _closeCode = closeCode;
            _reason = reason;
        }

        @Override
        public ConnectionEventType getType() {
            return _type;
        }

        @Override
        public String getSessionId() {
            return _sessionId;
        }

        @Override
        public Optional<Integer> getCloseCode() {
            return Optional.ofNullable(_closeCode);
        }

        @Override
        public String getReason() {
            return _reason;
        }

        @Override
        public String toString() {
            return "ConnectionEvent{type=" + _type + ", sessionId=" + _sessionId
                    + (_closeCode != null ? ", closeCode=" + _closeCode : "")
                    + (_reason != null ? ", reason=" + _reason : "") + '}';
        }
    }

    /**
     * @param length
     *            the desired length of the returned random string.
     * @return a random string of the specified length, from the alphabet [A-Za-z0-9].
     */
    static String rnd(int length) {
        StringBuilder buf = new StringBuilder(length);
        ThreadLocalRandom tlr = ThreadLocalRandom.current();
        for (int i = 0; i < length; i++)
            buf.append(ALPHABET.charAt(tlr.nextInt(ALPHABET.length())));
        return buf.toString();
    }

    static String id(Object x) {
        return x.getClass().getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(x));
    }
}
