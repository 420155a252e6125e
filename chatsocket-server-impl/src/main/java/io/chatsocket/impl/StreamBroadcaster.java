package io.chatsocket.impl;

import java.util.List;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chatsocket.ChatSocketServer.ServerFrameDto;
import io.chatsocket.ConnectionRegistry;
import io.chatsocket.ModelClient;
import io.chatsocket.ModelClient.StreamListener;
import io.chatsocket.ModelClient.UpstreamErrorCategory;
import io.chatsocket.ModelClient.UpstreamException;
import io.chatsocket.SessionStore.ChatMessage;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectWriter;

/**
 * Turns an upstream token stream into ordered push frames to one session, via the {@link ConnectionRegistry}.
 * <p/>
 * Each response runs through the states <code>IDLE → STARTED → STREAMING → COMPLETED</code>, or to
 * <code>FAILED</code> from any non-terminal state:
 * <ul>
 * <li>Upstream start: sends <code>stream_start</code>.</li>
 * <li>Each upstream text delta: sends one <code>stream_chunk</code> with the delta's text verbatim, right away. A
 * delta arriving before the start signal implies the start.</li>
 * <li>Upstream stop, or the upstream call returning without a stop signal: sends <code>stream_end</code>, then
 * invokes the completion callback with the full concatenated text.</li>
 * <li>Upstream failure: sends a single <code>error</code> frame with the sanitized message, and rethrows. The
 * completion callback is not invoked.</li>
 * </ul>
 * If the connection is gone, the frames are silently dropped, and the upstream stream still runs to completion.
 */
public class StreamBroadcaster implements ChatSocketStatics {
    private static final Logger log = LoggerFactory.getLogger(StreamBroadcaster.class);

    private final ConnectionRegistry _connectionRegistry;
    private final ObjectWriter _frameWriter;

    public StreamBroadcaster(ConnectionRegistry connectionRegistry) {
        _connectionRegistry = connectionRegistry;
        _frameWriter = createNewJacksonMapper().writerFor(ServerFrameDto.class);
    }

    /**
     * States of one streamed response.
     */
    public enum StreamState {
        IDLE,

        STARTED,

        STREAMING,

        COMPLETED,

        FAILED
    }

    /**
     * Streams the model's response to the conversation out to the session, as described in the class JavaDoc. Blocks
     * until the upstream stream has ended.
     *
     * @param sessionId
     *            the session to push frames to.
     * @param modelClient
     *            the upstream model.
     * @param messages
     *            the conversation to respond to.
     * @param onComplete
     *            invoked with the full response text after <code>stream_end</code> has been sent, never on failure.
     * @return the state the response ended in, which is always {@link StreamState#COMPLETED} when returning normally.
     * @throws UpstreamException
     *             if the upstream failed - an <code>error</code> frame has then already been sent. Unexpected runtime
     *             failures from the model client are wrapped in an {@link UpstreamErrorCategory#UNKNOWN UNKNOWN}
     *             UpstreamException.
     */
    public StreamState streamResponse(String sessionId, ModelClient modelClient, List<ChatMessage> messages,
            Consumer<String> onComplete) throws UpstreamException {
        long nanosStart = System.nanoTime();
        ResponseStream stream = new ResponseStream(sessionId);
        try {
            modelClient.streamMessage(messages, stream);
        }
        catch (UpstreamException e) {
            if (stream.fail(e)) {
                throw e;
            }
        }
        catch (RuntimeException e) {
            UpstreamException wrapped = new UpstreamException(UpstreamErrorCategory.UNKNOWN,
                    "Unexpected [" + e.getClass().getSimpleName() + "] from ModelClient: " + e.getMessage(), e);
            if (stream.fail(wrapped)) {
                throw wrapped;
            }
        }
        // ?: Did the upstream return without signalling stop?
        if (stream._state != StreamState.COMPLETED) {
            // -> Yes, so the return is the stop.
            stream.streamStopped();
        }
        if (log.isDebugEnabled()) {
            log.debug("Completed streamed response to [" + sessionId + "]: [" + stream._chunks + "] chunks, ["
                    + stream._fullText.length() + "] chars, took [" + msSince(nanosStart) + " ms].");
        }
        onComplete.accept(stream._fullText.toString());
        return StreamState.COMPLETED;
    }

    /**
     * Sends an <code>error</code> frame to the session.
     *
     * @return whether it was written to the connection.
     */
    public boolean sendError(String sessionId, String errorMessage) {
        return sendFrame(sessionId, ServerFrameDto.error(sessionId, errorMessage));
    }

    /**
     * Serializes and sends the frame to the session, logging debug on success and warn on failure.
     *
     * @return whether it was written to the connection.
     */
    public boolean sendFrame(String sessionId, ServerFrameDto frame) {
        boolean sent = _connectionRegistry.sendTo(sessionId, serialize(frame));
        if (sent) {
            if (log.isDebugEnabled()) {
                log.debug("Sent [" + frame.type + "] to [" + sessionId + "].");
            }
        }
        else {
            log.warn("Failed to send [" + frame.type + "] to [" + sessionId + "], connection gone.");
        }
        return sent;
    }

    String serialize(ServerFrameDto frame) {
        try {
            return _frameWriter.writeValueAsString(frame);
        }
        catch (JacksonException e) {
            throw new AssertionError("Huh, couldn't serialize frame?!", e);
        }
    }

    /**
     * The state machine of one response. All callbacks come on the thread invoking the ModelClient, so no
     * synchronization is needed.
     */
    private class ResponseStream implements StreamListener {
        private final String _sessionId;
        private final StringBuilder _fullText = new StringBuilder();
        private StreamState _state = StreamState.IDLE;
        private int _chunks;
        private boolean _connectionGone;

        ResponseStream(String sessionId) {
            _sessionId = sessionId;
        }

        @Override
        public void streamStarted() {
            // ?: Are we IDLE?
            if (_state != StreamState.IDLE) {
                // -> No, so this is a repeated or late start, ignore.
                log.warn("Got stream start from upstream when in state [" + _state + "] for [" + _sessionId
                        + "], ignoring.");
                return;
            }
            _state = StreamState.STARTED;
            push(ServerFrameDto.streamStart(_sessionId));
        }

        @Override
        public void textDelta(String text) {
            if (_state == StreamState.IDLE) {
                streamStarted();
            }
            // ?: Are we in a state accepting deltas?
            if ((_state != StreamState.STARTED) && (_state != StreamState.STREAMING)) {
                // -> No, terminal state.
                log.warn("Got text delta from upstream when in state [" + _state + "] for [" + _sessionId
                        + "], ignoring.");
                return;
            }
            _state = StreamState.STREAMING;
            if ((text == null) || text.isEmpty()) {
                return;
            }
            _fullText.append(text);
            _chunks++;
            push(ServerFrameDto.streamChunk(_sessionId, text));
        }

        @Override
        public void streamStopped() {
            if (_state == StreamState.IDLE) {
                streamStarted();
            }
            if ((_state != StreamState.STARTED) && (_state != StreamState.STREAMING)) {
                log.warn("Got stream stop from upstream when in state [" + _state + "] for [" + _sessionId
                        + "], ignoring.");
                return;
            }
            _state = StreamState.COMPLETED;
            push(ServerFrameDto.streamEnd(_sessionId));
        }

        /**
         * @return whether the failure should be rethrown, i.e. whether the stream was not already completed.
         */
        boolean fail(UpstreamException e) {
            // ?: Already COMPLETED?
            if (_state == StreamState.COMPLETED) {
                // -> Yes, so the client already has its stream_end, and the response will be persisted.
                log.warn("Upstream failed after having signalled stop for [" + _sessionId + "], ignoring: "
                        + e.getDetail(), e);
                return false;
            }
            log.warn("Upstream failed in state [" + _state + "] for [" + _sessionId + "], category ["
                    + e.getCategory() + "], detail [" + e.getDetail() + "] - sending error to client.");
            _state = StreamState.FAILED;
            push(ServerFrameDto.error(_sessionId, e.getMessage()));
            return true;
        }

        private void push(ServerFrameDto frame) {
            boolean sent = _connectionRegistry.sendTo(_sessionId, serialize(frame));
            if (sent) {
                if (log.isDebugEnabled()) {
                    log.debug("Sent [" + frame.type + "] to [" + _sessionId + "].");
                }
            }
            // ?: First failure for this stream?
            else if (!_connectionGone) {
                // -> Yes, so warn once - the rest of this response will be dropped silently.
                _connectionGone = true;
                log.warn("Failed to send [" + frame.type + "] to [" + _sessionId + "], connection gone - dropping"
                        + " the rest of the response, while letting the upstream run to completion.");
            }
        }
    }
}
