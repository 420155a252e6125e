package io.chatsocket.client;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;

import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.MapperFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

/**
 * Constants and helpers for the client classes.
 */
interface ClientStatics {
    String THREAD_PREFIX = "ChatSocketClient:";

    String CLIENT_DISCONNECTING = "Client disconnecting";
    String HEARTBEAT_TIMEOUT = "Heartbeat timeout";
    String CONNECTION_TIMEOUT = "Connection timeout";

    // Max bytes of a WebSocket close reason.
    int MAX_CLOSE_REASON_BYTES = 123;

    default ObjectMapper createNewJacksonMapper() {
        JsonMapper.Builder builder = JsonMapper.builder();

        // Drop null values from JSON
        builder.changeDefaultPropertyInclusion(incl -> incl.withValueInclusion(JsonInclude.Include.NON_NULL));
        // Read and write any access modifier fields (e.g. private)
        builder.changeDefaultVisibility(vc -> vc.with(JsonAutoDetect.Visibility.NONE)
                .withFieldVisibility(JsonAutoDetect.Visibility.ANY));
        builder.enable(MapperFeature.ALLOW_FINAL_FIELDS_AS_MUTATORS);
        // The server may add fields.
        builder.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        return builder.build();
    }
}
