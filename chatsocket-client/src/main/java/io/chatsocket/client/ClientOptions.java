package io.chatsocket.client;

/**
 * Options for the {@link ResilientChatSocketClient}. All durations are in milliseconds. Create using
 * {@link #builder()}, or use {@link #defaults()}.
 */
public final class ClientOptions {
    private final boolean _reconnect;
    private final long _reconnectInterval;
    private final double _reconnectDecay;
    private final long _maxReconnectInterval;
    private final int _maxReconnectAttempts;
    private final long _connectionTimeout;
    private final long _heartbeatInterval;
    private final long _heartbeatTimeout;
    private final long _stabilityWindow;
    private final int _maxQueueSize;

    private ClientOptions(Builder builder) {
        _reconnect = builder._reconnect;
        _reconnectInterval = builder._reconnectInterval;
        _reconnectDecay = builder._reconnectDecay;
        _maxReconnectInterval = builder._maxReconnectInterval;
        _maxReconnectAttempts = builder._maxReconnectAttempts;
        _connectionTimeout = builder._connectionTimeout;
        _heartbeatInterval = builder._heartbeatInterval;
        _heartbeatTimeout = builder._heartbeatTimeout;
        _stabilityWindow = builder._stabilityWindow;
        _maxQueueSize = builder._maxQueueSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ClientOptions defaults() {
        return builder().build();
    }

    /**
     * @return whether the client should reconnect when the connection is lost, default <code>true</code>.
     */
    public boolean isReconnect() {
        return _reconnect;
    }

    /**
     * @return the base delay before the first reconnect attempt, default 1000.
     */
    public long getReconnectInterval() {
        return _reconnectInterval;
    }

    /**
     * @return the factor the reconnect delay is multiplied with per attempt, default 2.
     */
    public double getReconnectDecay() {
        return _reconnectDecay;
    }

    /**
     * @return the cap of the reconnect delay, default 30000.
     */
    public long getMaxReconnectInterval() {
        return _maxReconnectInterval;
    }

    /**
     * @return the number of reconnect attempts before giving up, default 10.
     */
    public int getMaxReconnectAttempts() {
        return _maxReconnectAttempts;
    }

    /**
     * @return how long a connect may take before it is aborted, default 5000.
     */
    public long getConnectionTimeout() {
        return _connectionTimeout;
    }

    public long getHeartbeatInterval() {
        return _heartbeatInterval;
    }

    public long getHeartbeatTimeout() {
        return _heartbeatTimeout;
    }

    /**
     * @return how long a connection must have lasted for the reconnect attempt counter to start from scratch when it
     *         is lost, default 30000.
     */
    public long getStabilityWindow() {
        return _stabilityWindow;
    }

    /**
     * @return the capacity of the outbound queue used while not connected, default 50.
     */
    public int getMaxQueueSize() {
        return _maxQueueSize;
    }

    @Override
    public String toString() {
        return "ClientOptions{reconnect=" + _reconnect
                + ", reconnectInterval=" + _reconnectInterval
                + ", reconnectDecay=" + _reconnectDecay
                + ", maxReconnectInterval=" + _maxReconnectInterval
                + ", maxReconnectAttempts=" + _maxReconnectAttempts
                + ", connectionTimeout=" + _connectionTimeout
                + ", heartbeatInterval=" + _heartbeatInterval
                + ", heartbeatTimeout=" + _heartbeatTimeout
                + ", stabilityWindow=" + _stabilityWindow
                + ", maxQueueSize=" + _maxQueueSize + '}';
    }

    public static final class Builder {
        private boolean _reconnect = true;
        private long _reconnectInterval = 1000;
        private double _reconnectDecay = 2;
        private long _maxReconnectInterval = 30_000;
        private int _maxReconnectAttempts = 10;
        private long _connectionTimeout = 5000;
        private long _heartbeatInterval = 30_000;
        private long _heartbeatTimeout = 5000;
        private long _stabilityWindow = 30_000;
        private int _maxQueueSize = 50;

        private Builder() {
        }

        public Builder reconnect(boolean reconnect) {
            _reconnect = reconnect;
            return this;
        }

        public Builder reconnectInterval(long reconnectIntervalMillis) {
            _reconnectInterval = requirePositive("reconnectInterval", reconnectIntervalMillis);
            return this;
        }

        public Builder reconnectDecay(double reconnectDecay) {
            if (reconnectDecay < 1) {
                throw new IllegalArgumentException("reconnectDecay must be >= 1, was [" + reconnectDecay + "].");
            }
            _reconnectDecay = reconnectDecay;
            return this;
        }

        public Builder maxReconnectInterval(long maxReconnectIntervalMillis) {
            _maxReconnectInterval = requirePositive("maxReconnectInterval", maxReconnectIntervalMillis);
            return this;
        }

        public Builder maxReconnectAttempts(int maxReconnectAttempts) {
            _maxReconnectAttempts = (int) requirePositive("maxReconnectAttempts", maxReconnectAttempts);
            return this;
        }

        public Builder connectionTimeout(long connectionTimeoutMillis) {
            _connectionTimeout = requirePositive("connectionTimeout", connectionTimeoutMillis);
            return this;
        }

        public Builder heartbeatInterval(long heartbeatIntervalMillis) {
            _heartbeatInterval = requirePositive("heartbeatInterval", heartbeatIntervalMillis);
            return this;
        }

        public Builder heartbeatTimeout(long heartbeatTimeoutMillis) {
            _heartbeatTimeout = requirePositive("heartbeatTimeout", heartbeatTimeoutMillis);
            return this;
        }

        public Builder stabilityWindow(long stabilityWindowMillis) {
            _stabilityWindow = requirePositive("stabilityWindow", stabilityWindowMillis);
            return this;
        }

        public Builder maxQueueSize(int maxQueueSize) {
            _maxQueueSize = (int) requirePositive("maxQueueSize", maxQueueSize);
            return this;
        }

        public ClientOptions build() {
            return new ClientOptions(this);
        }

        private static long requirePositive(String what, long value) {
            if (value < 1) {
                throw new IllegalArgumentException(what + " must be positive, was [" + value + "].");
            }
            return value;
        }
    }
}
