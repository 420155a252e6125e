package io.chatsocket.impl;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chatsocket.ModelClient;
import io.chatsocket.SessionStore.ChatMessage;
import io.chatsocket.SessionStore.Role;

/**
 * A {@link ModelClient} which does not talk to any model, but answers <code>Mock response to: "&lt;last user
 * message&gt;"</code>, streamed in chunks of 10 characters with a delay between each. For local development and tests.
 */
public class SimulatedModelClient implements ModelClient {
    private static final Logger log = LoggerFactory.getLogger(SimulatedModelClient.class);

    public static final String MODEL_NAME = "simulated";

    private final int _chunkSize;
    private final long _millisBetweenChunks;

    public SimulatedModelClient() {
        this(10, 50);
    }

    public SimulatedModelClient(int chunkSize, long millisBetweenChunks) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be positive, was [" + chunkSize + "].");
        }
        _chunkSize = chunkSize;
        _millisBetweenChunks = millisBetweenChunks;
    }

    @Override
    public void streamMessage(List<ChatMessage> messages, StreamListener listener) throws UpstreamException {
        String lastUserMessage = "";
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).getRole() == Role.USER) {
                lastUserMessage = messages.get(i).getContent();
                break;
            }
        }
        String response = "Mock response to: \"" + lastUserMessage + "\"";
        log.debug("Simulating response of [" + response.length() + "] chars in chunks of [" + _chunkSize + "].");

        listener.streamStarted();
        for (int i = 0; i < response.length(); i += _chunkSize) {
            if ((i > 0) && (_millisBetweenChunks > 0)) {
                try {
                    Thread.sleep(_millisBetweenChunks);
                }
                catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new UpstreamException(UpstreamErrorCategory.NETWORK,
                            "Interrupted while simulating stream.", e);
                }
            }
            listener.textDelta(response.substring(i, Math.min(response.length(), i + _chunkSize)));
        }
        listener.streamStopped();
    }

    @Override
    public String getModelName() {
        return MODEL_NAME;
    }
}
