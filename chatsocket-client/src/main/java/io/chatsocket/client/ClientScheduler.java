package io.chatsocket.client;

/**
 * Time and timers for the {@link ResilientChatSocketClient}. All the client's state is handled on the scheduler: an
 * implementation must run tasks one at a time, in submission order for {@link #execute(Runnable)}. Tests use a manual
 * implementation to drive time deterministically.
 */
public interface ClientScheduler {
    long currentTimeMillis();

    void execute(Runnable task);

    ScheduledTask schedule(Runnable task, long delayMillis);

    /**
     * Invoked by {@link ResilientChatSocketClient#destroy()} if the client created the scheduler itself.
     */
    void shutdown();

    @FunctionalInterface
    interface ScheduledTask {
        void cancel();
    }
}
