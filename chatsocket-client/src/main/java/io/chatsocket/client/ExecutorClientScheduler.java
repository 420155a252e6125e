package io.chatsocket.client;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ClientScheduler} on a single daemon thread.
 */
public class ExecutorClientScheduler implements ClientScheduler, ClientStatics {
    private static final Logger log = LoggerFactory.getLogger(ExecutorClientScheduler.class);

    private final ScheduledThreadPoolExecutor _executor;

    public ExecutorClientScheduler(String name) {
        _executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread thread = new Thread(r, THREAD_PREFIX + "Scheduler {" + name + '}');
            thread.setDaemon(true);
            return thread;
        });
        _executor.setRemoveOnCancelPolicy(true);
    }

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }

    @Override
    public void execute(Runnable task) {
        try {
            _executor.execute(task);
        }
        catch (RejectedExecutionException e) {
            log.debug("Scheduler is shut down, dropping task.");
        }
    }

    @Override
    public ScheduledTask schedule(Runnable task, long delayMillis) {
        try {
            ScheduledFuture<?> future = _executor.schedule(task, delayMillis, TimeUnit.MILLISECONDS);
            return () -> future.cancel(false);
        }
        catch (RejectedExecutionException e) {
            log.debug("Scheduler is shut down, dropping timer.");
            return () -> {
            };
        }
    }

    @Override
    public void shutdown() {
        _executor.shutdown();
    }
}
