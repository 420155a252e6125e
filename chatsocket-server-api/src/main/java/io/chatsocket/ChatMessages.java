package io.chatsocket;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import io.chatsocket.SessionStore.ChatMessage;
import io.chatsocket.SessionStore.MessageMetadata;
import io.chatsocket.SessionStore.Role;

/**
 * Static helpers for creating and querying {@link ChatMessage ChatMessages}.
 */
public final class ChatMessages {
    private ChatMessages() {
        // Utility class
    }

    public static String generateMessageId() {
        return UUID.randomUUID().toString();
    }

    public static String generateSessionId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Creates a message with a fresh id, timestamped "now".
     */
    public static ChatMessage createMessage(Role role, String content) {
        return createMessage(role, content, null);
    }

    /**
     * Creates a message with a fresh id, timestamped "now", with the given (nullable) metadata.
     */
    public static ChatMessage createMessage(Role role, String content, MessageMetadata metadata) {
        return new ChatMessage(generateMessageId(), role, content, System.currentTimeMillis(), metadata);
    }

    public static List<ChatMessage> filterByRole(List<ChatMessage> messages, Role role) {
        return messages.stream()
                .filter(m -> m.getRole() == role)
                .collect(Collectors.toList());
    }

    /**
     * @return the messages whose timestamp is within <code>[fromMillis, toMillis]</code>, both inclusive.
     */
    public static List<ChatMessage> filterByTimeRange(List<ChatMessage> messages, long fromMillis, long toMillis) {
        return messages.stream()
                .filter(m -> (m.getTimestamp() >= fromMillis) && (m.getTimestamp() <= toMillis))
                .collect(Collectors.toList());
    }

    /**
     * @return the last <code>count</code> messages, in their original order - empty if count is zero or negative.
     */
    public static List<ChatMessage> recentMessages(List<ChatMessage> messages, int count) {
        if (count <= 0) {
            return Collections.emptyList();
        }
        int from = Math.max(0, messages.size() - count);
        return new ArrayList<>(messages.subList(from, messages.size()));
    }

    public static boolean messageExists(List<ChatMessage> messages, String messageId) {
        return messages.stream().anyMatch(m -> messageId.equals(m.getId()));
    }

    /**
     * @return the sum of input and output tokens over all messages carrying token usage.
     */
    public static int totalTokens(List<ChatMessage> messages) {
        int total = 0;
        for (ChatMessage message : messages) {
            MessageMetadata metadata = message.getMetadata().orElse(null);
            if ((metadata != null) && metadata.getTokens().isPresent()) {
                total += metadata.getTokens().get().getInput() + metadata.getTokens().get().getOutput();
            }
        }
        return total;
    }
}
