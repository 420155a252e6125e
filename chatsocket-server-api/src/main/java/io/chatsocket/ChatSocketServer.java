package io.chatsocket;

import java.util.EnumSet;
import java.util.Optional;

import jakarta.websocket.CloseReason.CloseCode;
import jakarta.websocket.CloseReason.CloseCodes;

/**
 * The ChatSocket Server: a WebSocket endpoint over which clients hold a live conversation with an upstream language
 * model, getting the model's response streamed back as push frames.
 * <p/>
 * When a client connects, the server assigns it a session id, registers its WebSocket in the
 * {@link ConnectionRegistry}, creates the conversation Session in the {@link SessionStore}, and replies with a
 * {@link FrameType#CONNECTION_ESTABLISHED connection_established} frame carrying the session id. Each
 * {@link FrameType#USER_MESSAGE user_message} frame from the client is validated and dispatched to the
 * {@link UserMessageHandler}, which by default appends it to the Session, asks the {@link ModelClient} for a response,
 * and streams that back as {@link FrameType#STREAM_START stream_start}, {@link FrameType#STREAM_CHUNK stream_chunk}
 * (one per text delta) and {@link FrameType#STREAM_END stream_end} frames - or a single {@link FrameType#ERROR error}
 * frame if something went wrong. The connection is never closed due to application level errors.
 * <p/>
 * Frames from one connection are processed strictly in order, while {@link FrameType#PING ping} frames are answered
 * immediately, also while a response is being streamed.
 */
public interface ChatSocketServer {
    /**
     * @return the Session Store holding the conversation state.
     */
    SessionStore getSessionStore();

    /**
     * @return the Connection Registry holding the live WebSockets.
     */
    ConnectionRegistry getConnectionRegistry();

    /**
     * Replaces the handler for {@link FrameType#USER_MESSAGE user_message} frames. The server installs a default
     * handler which converses with the {@link ModelClient}; set <code>null</code> to have the server answer all user
     * messages with "Server not ready to handle messages".
     */
    void setUserMessageHandler(UserMessageHandler handler);

    /**
     * Adds a listener which gets invoked when connections are established and closed. The listener is invoked
     * synchronously on the WebSocket container thread, so it should be quick. Exceptions are logged and ignored.
     */
    void addConnectionEventListener(ConnectionEventListener listener);

    /**
     * Closes all WebSockets with {@link ChatSocketCloseCodes#SERVICE_RESTART SERVICE_RESTART}, and shuts down the
     * worker threads, giving in-flight work the specified time to finish.
     */
    void stop(int gracefulShutdownMillis);

    /**
     * Handles a validated {@link FrameType#USER_MESSAGE user_message} frame. Invoked sequentially for the frames of one
     * connection. If it throws, the exception's message is sent to the client as an {@link FrameType#ERROR error}
     * frame.
     */
    @FunctionalInterface
    interface UserMessageHandler {
        /**
         * @param message
         *            the incoming frame, where <code>content</code> and <code>sessionId</code> are non-null.
         * @param sessionId
         *            the session id of the connection the frame came in on - which is the id to use, as the
         *            <code>sessionId</code> inside the frame is only what the client claims.
         */
        void handleUserMessage(ClientFrameDto message, String sessionId);
    }

    @FunctionalInterface
    interface ConnectionEventListener {
        void connectionEvent(ConnectionEvent event);
    }

    interface ConnectionEvent {
        ConnectionEventType getType();

        String getSessionId();

        /**
         * @return the WebSocket close code, only present for {@link ConnectionEventType#CLOSED CLOSED}.
         */
        Optional<Integer> getCloseCode();

        /**
         * @return the WebSocket close reason for {@link ConnectionEventType#CLOSED CLOSED}, or the error description
         *         for {@link ConnectionEventType#ERROR ERROR}.
         */
        String getReason();

        enum ConnectionEventType {
            ESTABLISHED,

            ERROR,

            CLOSED
        }
    }

    /**
     * The "type" discriminator of all frames on the wire, both directions.
     */
    enum FrameType {
        /**
         * Client to Server: a new message from the user, with <code>content</code> and <code>sessionId</code>.
         */
        USER_MESSAGE("user_message"),

        /**
         * Server to Client: the handshake ack, with <code>sessionId</code> and <code>content</code>.
         */
        CONNECTION_ESTABLISHED("connection_established"),

        /**
         * Server to Client: response generation beginning.
         */
        STREAM_START("stream_start"),

        /**
         * Server to Client: one text delta of the response, in <code>content</code>.
         */
        STREAM_CHUNK("stream_chunk"),

        /**
         * Server to Client: response generation complete.
         */
        STREAM_END("stream_end"),

        /**
         * Server to Client: failure description, in <code>error</code>.
         */
        ERROR("error"),

        /**
         * Both directions: liveness probe, to be answered with {@link #PONG}.
         */
        PING("ping"),

        PONG("pong");

        private final String _wireName;

        FrameType(String wireName) {
            _wireName = wireName;
        }

        public String getWireName() {
            return _wireName;
        }

        /**
         * @return the FrameType with the specified wire name, or {@link Optional#empty()} if unknown.
         */
        public static Optional<FrameType> fromWireName(String wireName) {
            for (FrameType frameType : values()) {
                if (frameType._wireName.equals(wireName)) {
                    return Optional.of(frameType);
                }
            }
            return Optional.empty();
        }
    }

    /**
     * Frame sent from Client to Server. Field-based serialization, null fields are not serialized.
     */
    class ClientFrameDto {
        public String type;
        public String content;
        public String sessionId;

        public static ClientFrameDto userMessage(String content, String sessionId) {
            ClientFrameDto frame = new ClientFrameDto();
            frame.type = FrameType.USER_MESSAGE.getWireName();
            frame.content = content;
            frame.sessionId = sessionId;
            return frame;
        }

        public static ClientFrameDto ping() {
            ClientFrameDto frame = new ClientFrameDto();
            frame.type = FrameType.PING.getWireName();
            return frame;
        }

        public static ClientFrameDto pong() {
            ClientFrameDto frame = new ClientFrameDto();
            frame.type = FrameType.PONG.getWireName();
            return frame;
        }

        @Override
        public String toString() {
            return "ClientFrame{type=" + type + ", sessionId=" + sessionId + '}';
        }
    }

    /**
     * Frame sent from Server to Client. Field-based serialization, null fields are not serialized.
     */
    class ServerFrameDto {
        public String type;
        public String sessionId;
        public String content;
        public String error;

        private static ServerFrameDto of(FrameType frameType, String sessionId) {
            ServerFrameDto frame = new ServerFrameDto();
            frame.type = frameType.getWireName();
            frame.sessionId = sessionId;
            return frame;
        }

        public static ServerFrameDto connectionEstablished(String sessionId, String content) {
            ServerFrameDto frame = of(FrameType.CONNECTION_ESTABLISHED, sessionId);
            frame.content = content;
            return frame;
        }

        public static ServerFrameDto streamStart(String sessionId) {
            return of(FrameType.STREAM_START, sessionId);
        }

        public static ServerFrameDto streamChunk(String sessionId, String text) {
            ServerFrameDto frame = of(FrameType.STREAM_CHUNK, sessionId);
            frame.content = text;
            return frame;
        }

        public static ServerFrameDto streamEnd(String sessionId) {
            return of(FrameType.STREAM_END, sessionId);
        }

        public static ServerFrameDto error(String sessionId, String error) {
            ServerFrameDto frame = of(FrameType.ERROR, sessionId);
            frame.error = error;
            return frame;
        }

        public static ServerFrameDto ping() {
            return of(FrameType.PING, null);
        }

        public static ServerFrameDto pong() {
            return of(FrameType.PONG, null);
        }

        /**
         * @return the {@link FrameType} of this frame, or {@link Optional#empty()} if the type is unknown.
         */
        public Optional<FrameType> frameType() {
            return type == null ? Optional.empty() : FrameType.fromWireName(type);
        }

        @Override
        public String toString() {
            return "ServerFrame{type=" + type + ", sessionId=" + sessionId
                    + (content != null ? ", content.length=" + content.length() : "")
                    + (error != null ? ", error=" + error : "") + '}';
        }
    }

    /**
     * WebSocket CloseCodes used by ChatSocket, both standard codes, and ChatSocket-specific codes.
     * <p/>
     * Note: Plural "Codes" since that is what the JSR 356 Java WebSocket API {@link CloseCodes does..!}
     */
    enum ChatSocketCloseCodes implements CloseCode {
        /**
         * Standard code 1000 - From Client side: the client explicitly disconnects, and will not reconnect.
         */
        NORMAL_CLOSURE(CloseCodes.NORMAL_CLOSURE.getCode()),

        /**
         * Standard code 1001 - The endpoint is going away. Jetty also uses this when closing a WebSocket due to idle
         * timeout, so the client should reconnect.
         */
        GOING_AWAY(CloseCodes.GOING_AWAY.getCode()),

        /**
         * Standard code 1011 - From Server side: the server met a situation it could not handle.
         */
        UNEXPECTED_CONDITION(CloseCodes.UNEXPECTED_CONDITION.getCode()),

        /**
         * Standard code 1012 - From Server side: used when {@link ChatSocketServer#stop(int)} is invoked. Please
         * reconnect.
         */
        SERVICE_RESTART(CloseCodes.SERVICE_RESTART.getCode()),

        /**
         * 4000: From Client side: no pong was received within the heartbeat timeout, so the connection is deemed
         * half-open and is closed to get a fresh one.
         */
        HEARTBEAT_TIMEOUT(4000),

        /**
         * 4001: From Client side: the WebSocket did not open within the connection timeout.
         */
        CONNECT_TIMEOUT(4001);

        private final int _closeCode;

        ChatSocketCloseCodes(int closeCode) {
            _closeCode = closeCode;
        }

        @Override
        public int getCode() {
            return _closeCode;
        }

        /**
         * @param code
         *            the code to get a CloseCode instance of.
         * @return either a {@link ChatSocketCloseCodes}, or a standard {@link CloseCodes}, or a newly created object
         *         containing the unknown close code with a toString() returning "UNKNOWN(code)".
         */
        public static CloseCode getCloseCode(int code) {
            for (ChatSocketCloseCodes cscc : EnumSet.allOf(ChatSocketCloseCodes.class)) {
                if (cscc.getCode() == code) {
                    return cscc;
                }
            }
            for (CloseCodes stdcc : EnumSet.allOf(CloseCodes.class)) {
                if (stdcc.getCode() == code) {
                    return stdcc;
                }
            }
            return new CloseCode() {
                @Override
                public int getCode() {
                    return code;
                }

                @Override
                public String toString() {
                    return "UNKNOWN(" + code + ")";
                }
            };
        }
    }
}
