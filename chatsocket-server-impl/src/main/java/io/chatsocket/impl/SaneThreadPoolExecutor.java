package io.chatsocket.impl;

import java.util.concurrent.Executor;
import java.util.concurrent.LinkedTransferQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread pool for the connection lanes, where a lane holds a thread for the entire duration of a streamed response:
 * Keeps "corePoolSize" threads, and when more lanes are busy than there are threads, adds threads up to "maxPoolSize".
 * Only when all of those are busy do tasks wait, on an unbounded queue. The stock ThreadPoolExecutor only adds threads
 * beyond core size when its queue is full, which for an unbounded queue is never.
 */
class SaneThreadPoolExecutor implements Executor, ChatSocketStatics {
    private static final Logger log = LoggerFactory.getLogger(SaneThreadPoolExecutor.class);

    private final String _threadTypeName;
    private final String _serverId;
    private final String _poolName;
    private final ThreadPoolExecutor _threadPool;
    private final AtomicInteger _threadNumber = new AtomicInteger();

    SaneThreadPoolExecutor(int corePoolSize, int maxPoolSize, String threadTypeName, String serverId) {
        _threadTypeName = threadTypeName;
        _serverId = serverId;
        _poolName = threadTypeName + " {" + serverId + '}';
        HandOffQueue handOffQueue = new HandOffQueue();
        _threadPool = new ThreadPoolExecutor(corePoolSize, maxPoolSize, 5L, TimeUnit.MINUTES, handOffQueue,
                this::createThread,
                (task, executor) -> {
                    if (executor.isShutdown()) {
                        throw new RejectedExecutionException("Pool [" + _poolName + "] is shut down.");
                    }
                    // All maxPoolSize threads are busy: the task waits for the first one to free up.
                    handOffQueue.enqueue(task);
                });
    }

    private Thread createThread(Runnable runnable) {
        Thread thread = new Thread(runnable, THREAD_PREFIX + _threadTypeName + "#" + _threadNumber.getAndIncrement()
                + " {" + _serverId + '}');
        thread.setDaemon(true);
        return thread;
    }

    @Override
    public void execute(Runnable command) {
        _threadPool.execute(command);
    }

    int getPoolSize() {
        return _threadPool.getPoolSize();
    }

    int getQueueSize() {
        return _threadPool.getQueue().size();
    }

    void shutdownNice(int gracefulShutdownMillis) {
        log.info("Shutting down pool [" + _poolName + "], waiting max [" + gracefulShutdownMillis
                + " ms] for running tasks.");
        _threadPool.shutdown();
        try {
            _threadPool.awaitTermination(gracefulShutdownMillis, TimeUnit.MILLISECONDS);
        }
        catch (InterruptedException e) {
            // Just re-set interrupted flag, and go on exiting.
            Thread.currentThread().interrupt();
        }
        int dropped = _threadPool.shutdownNow().size();
        if (dropped > 0) {
            log.warn("Pool [" + _poolName + "] dropped [" + dropped + "] queued tasks upon shutdown.");
        }
    }

    /**
     * Accepts an offered task only if an idle pool thread takes it right away. A refused offer makes the
     * ThreadPoolExecutor start a new thread, or, at max size, invoke the rejection handler which then
     * {@link #enqueue(Runnable) enqueues} the task for real.
     */
    private static class HandOffQueue extends LinkedTransferQueue<Runnable> {
        @Override
        public boolean offer(Runnable task) {
            return tryTransfer(task);
        }

        void enqueue(Runnable task) {
            super.put(task);
        }
    }
}
