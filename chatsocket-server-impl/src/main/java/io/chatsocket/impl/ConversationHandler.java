package io.chatsocket.impl;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chatsocket.ChatMessages;
import io.chatsocket.ChatSocketServer.ClientFrameDto;
import io.chatsocket.ChatSocketServer.UserMessageHandler;
import io.chatsocket.ModelClient;
import io.chatsocket.ModelClient.UpstreamException;
import io.chatsocket.SessionStore;
import io.chatsocket.SessionStore.ChatMessage;
import io.chatsocket.SessionStore.InvalidMessageException;
import io.chatsocket.SessionStore.MessageMetadata;
import io.chatsocket.SessionStore.Role;
import io.chatsocket.SessionStore.SessionNotFoundException;

/**
 * The default {@link UserMessageHandler}: converses with the {@link ModelClient}, keeping the conversation in the
 * {@link SessionStore}.
 * <ol>
 * <li>Appends the (trimmed) user message to the session - so that it is part of the context sent upstream.</li>
 * <li>Streams the model's response to the client using the {@link StreamBroadcaster}, with the conversation as context,
 * or only its last {@link #setMaxContextMessages(int) maxContextMessages} messages if set.</li>
 * <li>When the stream has completed, appends the full response as an assistant message - unless the user message is no
 * longer in the session, i.e. the session was replaced while streaming.</li>
 * </ol>
 * Store errors, like {@link SessionNotFoundException}, propagate to the router, which replies with an error frame.
 * Upstream failures do not propagate, since the broadcaster has already sent the error frame - they are logged and
 * counted.
 */
public class ConversationHandler implements UserMessageHandler, ChatSocketStatics {
    private static final Logger log = LoggerFactory.getLogger(ConversationHandler.class);

    private final SessionStore _sessionStore;
    private final ModelClient _modelClient;
    private final StreamBroadcaster _streamBroadcaster;

    private final AtomicLong _completedResponses = new AtomicLong();
    private final AtomicLong _failedResponses = new AtomicLong();

    private volatile int _maxContextMessages;

    public ConversationHandler(SessionStore sessionStore, ModelClient modelClient,
            StreamBroadcaster streamBroadcaster) {
        _sessionStore = sessionStore;
        _modelClient = modelClient;
        _streamBroadcaster = streamBroadcaster;
    }

    /**
     * @param maxContextMessages
     *            how many of the most recent messages to send upstream as context, 0 meaning the whole conversation.
     *            Default 0.
     */
    public void setMaxContextMessages(int maxContextMessages) {
        if (maxContextMessages < 0) {
            throw new IllegalArgumentException("maxContextMessages must be >= 0, was [" + maxContextMessages + "].");
        }
        _maxContextMessages = maxContextMessages;
    }

    @Override
    public void handleUserMessage(ClientFrameDto message, String sessionId) {
        String content = message.content == null ? "" : message.content.trim();
        if (content.isEmpty()) {
            throw new InvalidMessageException("Message content cannot be empty");
        }
        // ?: Does the client think it is talking in another session than its connection's?
        if ((message.sessionId != null) && !message.sessionId.equals(sessionId)) {
            // -> Yes, which we ignore: the connection's session is the one used.
            log.debug("Frame claimed sessionId [" + message.sessionId + "], but connection has [" + sessionId
                    + "] - using the connection's.");
        }

        ChatMessage userMessage = ChatMessages.createMessage(Role.USER, content);
        _sessionStore.addMessage(sessionId, userMessage);
        List<ChatMessage> history = _sessionStore.getMessages(sessionId);
        int maxContextMessages = _maxContextMessages;
        List<ChatMessage> context = maxContextMessages > 0
                ? ChatMessages.recentMessages(history, maxContextMessages)
                : history;

        long nanosStart = System.nanoTime();
        try {
            _streamBroadcaster.streamResponse(sessionId, _modelClient, context,
                    fullText -> persistAssistantMessage(sessionId, userMessage, fullText));
            _completedResponses.incrementAndGet();
            logCompletedTurn(sessionId, userMessage, nanosStart);
        }
        catch (UpstreamException e) {
            // The client already got its error frame.
            _failedResponses.incrementAndGet();
            log.warn("Upstream failed for [" + sessionId + "] after [" + msSince(nanosStart) + " ms], category ["
                    + e.getCategory() + "], status [" + e.getStatusCode() + "]: " + e.getDetail());
        }
    }

    private void persistAssistantMessage(String sessionId, ChatMessage userMessage, String fullText) {
        // ?: Did the model respond with anything?
        if (fullText.isBlank()) {
            // -> No, and a blank message is not valid in the store.
            log.warn("Upstream response for [" + sessionId + "] was empty, not storing assistant message.");
            return;
        }
        try {
            // ?: Is the message we answered still in the session?
            if (!ChatMessages.messageExists(_sessionStore.getMessages(sessionId), userMessage.getId())) {
                // -> No, so the session was replaced while streaming, and the response would answer nothing.
                log.warn("User message [" + userMessage.getId() + "] is no longer in session [" + sessionId
                        + "], not storing assistant message.");
                return;
            }
            _sessionStore.addMessage(sessionId, ChatMessages.createMessage(Role.ASSISTANT, fullText,
                    new MessageMetadata(_modelClient.getModelName(), null)));
        }
        catch (SessionNotFoundException e) {
            // The stream_end is already out, so there is no point in sending an error - the session is just gone.
            log.warn("Session [" + sessionId + "] was removed while streaming the response, cannot store the"
                    + " assistant message.");
        }
    }

    private void logCompletedTurn(String sessionId, ChatMessage userMessage, long nanosStart) {
        if (!log.isInfoEnabled()) {
            return;
        }
        try {
            List<ChatMessage> messages = _sessionStore.getMessages(sessionId);
            int turnMessages = ChatMessages.filterByTimeRange(messages, userMessage.getTimestamp(),
                    System.currentTimeMillis()).size();
            log.info("Completed response to [" + sessionId + "], took [" + msSince(nanosStart) + " ms]. Turn added ["
                    + turnMessages + "] messages, conversation now [" + messages.size() + "] messages, ["
                    + ChatMessages.totalTokens(messages) + "] tokens.");
        }
        catch (SessionNotFoundException e) {
            log.info("Completed response to [" + sessionId + "], took [" + msSince(nanosStart) + " ms], but the"
                    + " session is gone.");
        }
    }

    public long getCompletedResponses() {
        return _completedResponses.get();
    }

    public long getFailedResponses() {
        return _failedResponses.get();
    }
}
