package io.chatsocket.client;

import java.io.IOException;
import java.net.URI;

/**
 * The raw bidirectional text transport the {@link ResilientChatSocketClient} runs on: one instance per connection
 * attempt, never reused. The default is {@link JakartaWebSocketTransportFactory}.
 */
public interface Transport {
    boolean isOpen();

    /**
     * @throws IOException
     *             if the transport is not open, or the write failed.
     */
    void sendText(String text) throws IOException;

    /**
     * Closes the transport, also if it has not opened yet - in which case it shall be closed as soon as it opens.
     * Idempotent.
     */
    void close(int code, String reason);

    /**
     * Opens {@link Transport}s.
     */
    @FunctionalInterface
    interface TransportFactory {
        /**
         * Starts opening a transport to the URI, returning right away. The outcome is reported to the listener: either
         * {@link TransportListener#transportOpened()}, or {@link TransportListener#transportError(Throwable)}.
         */
        Transport open(URI uri, TransportListener listener);
    }

    /**
     * Receives the events of one {@link Transport}. May be invoked on any thread.
     */
    interface TransportListener {
        void transportOpened();

        void textReceived(String text);

        void transportClosed(int code, String reason);

        void transportError(Throwable throwable);
    }
}
