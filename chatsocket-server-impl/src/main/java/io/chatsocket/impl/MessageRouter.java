package io.chatsocket.impl;

import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chatsocket.ChatSocketServer.ClientFrameDto;
import io.chatsocket.ChatSocketServer.FrameType;
import io.chatsocket.ChatSocketServer.ServerFrameDto;
import io.chatsocket.ChatSocketServer.UserMessageHandler;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Validates inbound client frames, and dispatches <code>user_message</code> frames to the registered
 * {@link UserMessageHandler}. Fails closed: anything not matching the inbound schema is answered with an
 * <code>error</code> frame, and nothing thrown by the handler escapes.
 * <p/>
 * {@link #route(String, String)} does it all in one go. The WebSocket endpoint instead uses {@link #parse(String)} on
 * the receiving thread, so that it can answer pings right away, and then {@link #dispatch(ClientFrameDto, String)} on
 * the connection's lane.
 */
public class MessageRouter implements ChatSocketStatics {
    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    private final ObjectMapper _jackson;
    private volatile UserMessageHandler _userMessageHandler;

    public MessageRouter() {
        _jackson = createNewJacksonMapper();
    }

    public MessageRouter(UserMessageHandler userMessageHandler) {
        this();
        _userMessageHandler = userMessageHandler;
    }

    /**
     * Sets the handler for <code>user_message</code> frames - <code>null</code> makes the router answer them with
     * "Server not ready to handle messages".
     */
    public void setUserMessageHandler(UserMessageHandler userMessageHandler) {
        _userMessageHandler = userMessageHandler;
    }

    /**
     * Parses, validates and dispatches one raw inbound frame. Never throws.
     *
     * @param raw
     *            the text received from the client.
     * @param sessionId
     *            the session id of the connection the frame came in on.
     * @return the frame to reply with, if any: a <code>pong</code> for <code>ping</code>, an <code>error</code> for
     *         anything that failed.
     */
    public Optional<ServerFrameDto> route(String raw, String sessionId) {
        ClientFrameDto frame;
        try {
            frame = parse(raw);
        }
        catch (ProtocolParseException e) {
            return Optional.of(ServerFrameDto.error(sessionId, e.getMessage()));
        }
        return dispatch(frame, sessionId);
    }

    /**
     * Parses and validates one raw inbound frame.
     *
     * @return the validated frame, whose type is one of <code>user_message</code> (with non-null content and
     *         sessionId), <code>ping</code> or <code>pong</code>.
     * @throws ProtocolParseException
     *             with the message to send to the client as <code>error</code>.
     */
    public ClientFrameDto parse(String raw) throws ProtocolParseException {
        Object parsed;
        try {
            parsed = _jackson.readValue(raw, Object.class);
        }
        catch (JacksonException e) {
            log.debug("Could not parse inbound frame as JSON: " + e.getMessage());
            throw new ProtocolParseException(INVALID_JSON, e);
        }
        // ?: Is it a JSON object?
        if (!(parsed instanceof Map)) {
            // -> No, so not following the schema.
            throw new ProtocolParseException(INVALID_FORMAT);
        }
        Map<?, ?> object = (Map<?, ?>) parsed;
        Object type = object.get("type");
        if (!(type instanceof String)) {
            throw new ProtocolParseException(INVALID_FORMAT);
        }
        Optional<FrameType> frameType = FrameType.fromWireName((String) type);
        // ?: Is this a type the client may send?
        if (frameType.isEmpty() || !(frameType.get() == FrameType.USER_MESSAGE
                || frameType.get() == FrameType.PING
                || frameType.get() == FrameType.PONG)) {
            // -> No, so unknown to us.
            throw new ProtocolParseException(UNKNOWN_TYPE_PREFIX + type);
        }

        ClientFrameDto frame = new ClientFrameDto();
        frame.type = (String) type;
        if (frameType.get() == FrameType.USER_MESSAGE) {
            Object content = object.get("content");
            Object sessionId = object.get("sessionId");
            if (!(content instanceof String) || !(sessionId instanceof String)) {
                throw new ProtocolParseException(INVALID_FORMAT);
            }
            frame.content = (String) content;
            frame.sessionId = (String) sessionId;
        }
        return frame;
    }

    /**
     * Dispatches a validated frame. Never throws.
     *
     * @param frame
     *            a frame returned from {@link #parse(String)}.
     * @param sessionId
     *            the session id of the connection the frame came in on.
     * @return the frame to reply with, if any.
     */
    public Optional<ServerFrameDto> dispatch(ClientFrameDto frame, String sessionId) {
        FrameType frameType = FrameType.fromWireName(frame.type).orElse(null);
        if (frameType == FrameType.PING) {
            return Optional.of(ServerFrameDto.pong());
        }
        if (frameType == FrameType.PONG) {
            return Optional.empty();
        }
        if (frameType != FrameType.USER_MESSAGE) {
            return Optional.of(ServerFrameDto.error(sessionId, UNKNOWN_TYPE_PREFIX + frame.type));
        }

        UserMessageHandler handler = _userMessageHandler;
        // ?: Do we have a handler?
        if (handler == null) {
            // -> No, this is a wiring bug on the server side, not a client bug.
            log.error("Got user_message for [" + sessionId + "], but no UserMessageHandler is registered.");
            return Optional.of(ServerFrameDto.error(sessionId, SERVER_NOT_READY));
        }
        try {
            handler.handleUserMessage(frame, sessionId);
            return Optional.empty();
        }
        catch (RuntimeException e) {
            log.warn("UserMessageHandler raised [" + e.getClass().getSimpleName() + "] for [" + sessionId
                    + "] - replying with error frame.", e);
            String message = e.getMessage();
            return Optional.of(ServerFrameDto.error(sessionId,
                    (message == null) || message.isBlank() ? FAILED_TO_PROCESS : message));
        }
    }

    /**
     * An inbound frame did not follow the protocol. The message is what is sent to the client.
     */
    public static class ProtocolParseException extends Exception {
        public ProtocolParseException(String message) {
            super(message);
        }

        public ProtocolParseException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
