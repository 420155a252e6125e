package io.chatsocket;

import java.util.List;

import io.chatsocket.SessionStore.ChatMessage;

/**
 * The upstream language-model capability: given the ordered conversation so far, produce the assistant's response as a
 * sequence of text deltas, pushed to a {@link StreamListener} as they are produced.
 * <p/>
 * Implementations talk to some hosted model service, and must translate any failure into an {@link UpstreamException}
 * with a {@link UpstreamErrorCategory category} and a sanitized message, so that raw upstream error details never
 * reach clients.
 */
public interface ModelClient {
    /**
     * Streams the response to the given conversation. The invocation blocks until the upstream stream has ended, and
     * all callbacks to the listener are made on the invoking thread, in upstream emission order.
     *
     * @param messages
     *            the conversation so far, in chronological order, the last being the newest user message.
     * @param listener
     *            receives the stream start, each text delta, and the stream stop.
     * @throws UpstreamException
     *             if the upstream service failed, either before or during the stream.
     */
    void streamMessage(List<ChatMessage> messages, StreamListener listener) throws UpstreamException;

    /**
     * @return the name of the model answering, for message metadata.
     */
    String getModelName();

    /**
     * Receives the upstream stream.
     */
    interface StreamListener {
        void streamStarted();

        void textDelta(String text);

        void streamStopped();
    }

    /**
     * Categories of upstream failure, each with the HTTP-ish status code and the message that may be shown to users.
     */
    enum UpstreamErrorCategory {
        AUTHENTICATION(401, "Invalid API key"),

        RATE_LIMIT(429, "Rate limit exceeded. Please try again later."),

        SERVICE(502, "Upstream model service error. Please try again later."),

        NETWORK(503, "Could not reach the upstream model service."),

        UNKNOWN(500, "An unexpected error occurred while generating the response");

        private final int _statusCode;
        private final String _userMessage;

        UpstreamErrorCategory(int statusCode, String userMessage) {
            _statusCode = statusCode;
            _userMessage = userMessage;
        }

        public int getStatusCode() {
            return _statusCode;
        }

        public String getUserMessage() {
            return _userMessage;
        }

        /**
         * Maps an HTTP status from the upstream service to a category: 401 and 403 are authentication, 429 is rate
         * limit, any 5xx is service, anything else is unknown.
         */
        public static UpstreamErrorCategory fromHttpStatus(int httpStatus) {
            if ((httpStatus == 401) || (httpStatus == 403)) {
                return AUTHENTICATION;
            }
            if (httpStatus == 429) {
                return RATE_LIMIT;
            }
            if (httpStatus >= 500) {
                return SERVICE;
            }
            return UNKNOWN;
        }
    }

    /**
     * Failure of the upstream service. The {@link #getMessage() message} is always the sanitized
     * {@link UpstreamErrorCategory#getUserMessage() user message} of the category - the raw upstream detail is only
     * available through {@link #getDetail()}, for logging.
     */
    class UpstreamException extends Exception {
        private final UpstreamErrorCategory _category;
        private final String _detail;

        public UpstreamException(UpstreamErrorCategory category, String detail) {
            super(category.getUserMessage());
            _category = category;
            _detail = detail;
        }

        public UpstreamException(UpstreamErrorCategory category, String detail, Throwable cause) {
            super(category.getUserMessage(), cause);
            _category = category;
            _detail = detail;
        }

        /**
         * Creates an exception from an HTTP status of the upstream service, using
         * {@link UpstreamErrorCategory#fromHttpStatus(int)}.
         */
        public static UpstreamException fromHttpStatus(int httpStatus, String detail) {
            return new UpstreamException(UpstreamErrorCategory.fromHttpStatus(httpStatus),
                    "HTTP " + httpStatus + ": " + detail);
        }

        public UpstreamErrorCategory getCategory() {
            return _category;
        }

        public int getStatusCode() {
            return _category.getStatusCode();
        }

        public String getDetail() {
            return _detail;
        }
    }
}
