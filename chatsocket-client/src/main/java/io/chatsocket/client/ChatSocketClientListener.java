package io.chatsocket.client;

import io.chatsocket.ChatSocketServer.ServerFrameDto;

/**
 * Listener for the events of a {@link ResilientChatSocketClient}. All methods have no-op defaults, so implement the
 * ones of interest. Invoked on the client's scheduler thread; do not block.
 */
public interface ChatSocketClientListener {
    /**
     * The transport opened.
     */
    default void onOpen() {
    }

    /**
     * The transport opened after one or more reconnect attempts - invoked right after {@link #onOpen()}.
     */
    default void onReconnected() {
    }

    /**
     * The transport closed, from either side, or failed to open.
     */
    default void onClose(int code, String reason) {
    }

    /**
     * Something failed: a transport error, a frame that could not be parsed or sent, or reconnection being given up.
     *
     * @param cause
     *            may be <code>null</code>.
     */
    default void onError(String message, Throwable cause) {
    }

    /**
     * A reconnect attempt is scheduled.
     */
    default void onReconnecting(int attempt, long delayMillis) {
    }

    /**
     * A frame came in from the server. Pings and pongs are handled by the client, and not delivered here.
     */
    default void onMessage(ServerFrameDto frame) {
    }
}
