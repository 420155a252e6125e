package io.chatsocket.impl;

import java.util.ArrayDeque;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import jakarta.websocket.MessageHandler.Whole;
import jakarta.websocket.Session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import io.chatsocket.ChatSocketServer.ClientFrameDto;
import io.chatsocket.ChatSocketServer.FrameType;
import io.chatsocket.ChatSocketServer.ServerFrameDto;
import io.chatsocket.impl.MessageRouter.ProtocolParseException;

/**
 * The WebSocket {@link Whole MessageHandler} of one connection.
 * <p/>
 * Pings are answered right away on the receiving thread. Everything else - user messages, and error replies to
 * malformed frames - is processed in order on the connection's {@link SerialLane lane}, so that a slow streamed
 * response does not block the container's receiving thread, and so that the frames of one response are never
 * interleaved with those of the next.
 */
class ChatSocketConnectionHandler implements Whole<String>, ChatSocketStatics {
    private static final Logger log = LoggerFactory.getLogger(ChatSocketConnectionHandler.class);

    private final MessageRouter _messageRouter;
    private final StreamBroadcaster _streamBroadcaster;
    private final String _connectionId;
    private final String _sessionId;
    private final SerialLane _lane;

    ChatSocketConnectionHandler(DefaultChatSocketServer chatSocketServer, Session webSocketSession,
            String sessionId) {
        _messageRouter = chatSocketServer.getMessageRouter();
        _streamBroadcaster = chatSocketServer.getStreamBroadcaster();
        _connectionId = webSocketSession.getId();
        _sessionId = sessionId;
        _lane = new SerialLane(chatSocketServer.getLanePool(), sessionId);
    }

    String getSessionId() {
        return _sessionId;
    }

    void setMDC() {
        MDC.put(MDC_SESSION_ID, _sessionId);
        MDC.put(MDC_CONNECTION_ID, _connectionId);
    }

    @Override
    public void onMessage(String message) {
        try { // finally: MDC.clear()
            setMDC();
            long nanosStart = System.nanoTime();

            ClientFrameDto frame;
            try {
                frame = _messageRouter.parse(message);
            }
            catch (ProtocolParseException e) {
                log.info("Got malformed frame of [" + message.length() + "] chars, replying with error: "
                        + e.getMessage());
                String error = e.getMessage();
                _lane.execute(() -> _streamBroadcaster.sendFrame(_sessionId, ServerFrameDto.error(_sessionId,
                        error)));
                return;
            }
            MDC.put(MDC_FRAME_TYPE, frame.type);

            // ?: Is this a ping?
            if (FrameType.PING.getWireName().equals(frame.type)) {
                // -> Yes, answer right away, also when a response is streaming.
                _streamBroadcaster.sendFrame(_sessionId, ServerFrameDto.pong());
                return;
            }
            // ?: Is this a pong?
            if (FrameType.PONG.getWireName().equals(frame.type)) {
                // -> Yes, the client is alive. Nothing more to do.
                log.debug("Got pong from client.");
                return;
            }

            _lane.execute(() -> {
                try { // finally: MDC.clear()
                    setMDC();
                    MDC.put(MDC_FRAME_TYPE, frame.type);
                    if (log.isDebugEnabled()) log.debug("Dispatching [" + frame.type + "], queued for ["
                            + msSince(nanosStart) + " ms].");
                    Optional<ServerFrameDto> reply = _messageRouter.dispatch(frame, _sessionId);
                    reply.ifPresent(r -> _streamBroadcaster.sendFrame(_sessionId, r));
                }
                finally {
                    MDC.clear();
                }
            });
        }
        finally {
            MDC.clear();
        }
    }

    /**
     * Runs tasks one at a time, in submission order, on a shared pool: at most one pool thread works on a lane at any
     * time, and it drains the lane's queue before letting go.
     */
    static class SerialLane implements Executor {
        private final Executor _pool;
        private final String _sessionId;

        private final ArrayDeque<Runnable> _tasks = new ArrayDeque<>();
        // Guarded by this
        private boolean _draining;

        SerialLane(Executor pool, String sessionId) {
            _pool = pool;
            _sessionId = sessionId;
        }

        @Override
        public void execute(Runnable task) {
            synchronized (this) {
                _tasks.add(task);
                // ?: Is a pool thread already draining this lane?
                if (_draining) {
                    // -> Yes, it will pick up the task.
                    return;
                }
                _draining = true;
            }
            try {
                _pool.execute(this::drain);
            }
            catch (RejectedExecutionException e) {
                // The pool is shut down, thus the server is stopping: drop what is queued.
                synchronized (this) {
                    _draining = false;
                    _tasks.clear();
                }
                log.warn("Lane for [" + _sessionId + "] could not get a thread, server is stopping - dropping task.",
                        e);
            }
        }

        private void drain() {
            while (true) {
                Runnable task;
                synchronized (this) {
                    task = _tasks.poll();
                    if (task == null) {
                        _draining = false;
                        return;
                    }
                }
                try {
                    task.run();
                }
                catch (RuntimeException e) {
                    log.error("Task on lane for [" + _sessionId + "] raised [" + e.getClass().getSimpleName()
                            + "] - continuing with next task.", e);
                }
            }
        }
    }
}
