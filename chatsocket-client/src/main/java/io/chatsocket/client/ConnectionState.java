package io.chatsocket.client;

/**
 * The states of the {@link ResilientChatSocketClient}.
 */
public enum ConnectionState {
    /**
     * No connection, and none pending - either initially, after {@link ResilientChatSocketClient#disconnect()}, or
     * after reconnection was given up.
     */
    DISCONNECTED,

    /**
     * The transport is opening.
     */
    CONNECTING,

    CONNECTED,

    /**
     * The connection was lost, and a reconnect attempt is scheduled.
     */
    RECONNECTING
}
