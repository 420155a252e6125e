package io.chatsocket.impl;

import java.time.Duration;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;

import tools.jackson.core.StreamReadConstraints;
import tools.jackson.core.json.JsonFactory;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.MapperFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

/**
 * Constants and small helpers shared by the ChatSocket server implementation classes.
 */
public interface ChatSocketStatics {

    String MDC_SESSION_ID = "chatsocket.sessionId";
    String MDC_CONNECTION_ID = "chatsocket.connectionId";
    String MDC_FRAME_TYPE = "chatsocket.frameType";

    // :: Session Store defaults
    int DEFAULT_MAX_SESSIONS = 1000;
    int DEFAULT_MAX_MESSAGES_PER_SESSION = 1000;
    Duration DEFAULT_SESSION_TTL = Duration.ofHours(24);
    Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofHours(1);

    // :: WebSocket limits
    int MAX_TEXT_MESSAGE_SIZE = 1024 * 1024;
    // Clients ping every 30 seconds, so a connection silent for this long is dead.
    long MAX_IDLE_TIMEOUT_MILLIS = 2 * 60 * 1000;
    // Max bytes of a WebSocket close reason.
    int MAX_CLOSE_REASON_BYTES = 123;

    // :: Worker pool for the per-connection lanes
    int MIN_WORKER_POOL_SIZE = 5;
    int MAX_WORKER_POOL_SIZE = 100;

    String THREAD_PREFIX = "ChatSocket:";

    // :: Texts sent to clients
    String CONNECTED_CONTENT = "Connected to server";
    String INVALID_JSON = "Invalid JSON format";
    String INVALID_FORMAT = "Invalid message format. Expected: "
            + "{ type: \"user_message\", content: string, sessionId: string }";
    String SERVER_NOT_READY = "Server not ready to handle messages";
    String FAILED_TO_PROCESS = "Failed to process message";
    String UNKNOWN_TYPE_PREFIX = "Unknown message type: ";

    default double ms(long nanos) {
        return Math.round(nanos / 10_000d) / 1_00d;
    }

    default double msSince(long nanosStart) {
        return ms(System.nanoTime() - nanosStart);
    }

    default ObjectMapper createNewJacksonMapper() {
        // Larger constraints than default, but incoming frames are anyway bounded by MAX_TEXT_MESSAGE_SIZE.
        StreamReadConstraints streamReadConstraints = StreamReadConstraints
                .builder()
                .maxNestingDepth(100)
                .maxStringLength(MAX_TEXT_MESSAGE_SIZE)
                .build();
        JsonFactory factory = JsonFactory.builder()
                .streamReadConstraints(streamReadConstraints)
                .build();

        JsonMapper.Builder builder = JsonMapper.builder(factory);

        // Drop null values from JSON
        builder.changeDefaultPropertyInclusion(incl -> incl.withValueInclusion(JsonInclude.Include.NON_NULL));
        // Read and write any access modifier fields (e.g. private)
        builder.changeDefaultVisibility(vc -> vc.with(JsonAutoDetect.Visibility.NONE)
                .withFieldVisibility(JsonAutoDetect.Visibility.ANY));
        // Allow final fields to be written to.
        builder.enable(MapperFeature.ALLOW_FINAL_FIELDS_AS_MUTATORS);

        // If props are in JSON that aren't in Java DTO, do not fail.
        builder.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        return builder.build();
    }
}
