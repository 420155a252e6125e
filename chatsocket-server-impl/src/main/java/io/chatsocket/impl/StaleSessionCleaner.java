package io.chatsocket.impl;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background thread of the {@link InMemorySessionStore}: every <i>cleanupInterval</i> removes the sessions that have
 * been inactive for longer than <i>sessionTtl</i>. Sleeps on a monitor, so that {@link #shutdown(int)} can wake it up
 * and let it exit nicely, instead of interrupting it in the middle of a cleanup run.
 */
class StaleSessionCleaner implements ChatSocketStatics {
    private static final Logger log = LoggerFactory.getLogger(StaleSessionCleaner.class);

    // :: From Constructor params
    private final InMemorySessionStore _sessionStore;
    private final Duration _sessionTtl;
    private final long _millisBetweenCleanupRuns;

    // :: Constructor inited
    private final Thread _cleanerThread;

    private volatile boolean _runFlag = true;
    private final Object _cleanerThreadSynchAndSleepObject = new Object();

    StaleSessionCleaner(InMemorySessionStore sessionStore, Duration sessionTtl, Duration cleanupInterval) {
        _sessionStore = sessionStore;
        _sessionTtl = sessionTtl;
        _millisBetweenCleanupRuns = cleanupInterval.toMillis();

        _cleanerThread = new Thread(this::cleanerRunnable,
                THREAD_PREFIX + "StaleSessionCleaner {" + _sessionStore.storeId() + '}');
        _cleanerThread.setDaemon(true);
        _cleanerThread.start();

        log.info("Created [" + this.getClass().getSimpleName() + "] and Thread for [" + _sessionStore.storeId()
                + "], TTL [" + _sessionTtl + "], interval [" + cleanupInterval + "].");
    }

    void shutdown(int gracefulShutdownMillis) {
        _runFlag = false;
        log.info("Shutting down [" + this.getClass().getSimpleName() + "] for [" + _sessionStore.storeId()
                + "], thread [" + _cleanerThread + "]");
        // Notify it, in the 99.99% case that it is sleeping between runs.
        synchronized (_cleanerThreadSynchAndSleepObject) {
            _cleanerThreadSynchAndSleepObject.notifyAll();
        }
        // .. now check that it got the message.
        try {
            _cleanerThread.join(gracefulShutdownMillis);
            // ?: Did it exit nicely?
            if (_cleanerThread.isAlive()) {
                // -> No, so interrupt it.
                log.info("The StaleSessionCleaner Thread didn't exit nicely, so we now interrupt it.");
                _cleanerThread.interrupt();
            }
        }
        catch (InterruptedException e) {
            log.info("Got interrupted while waiting for StaleSessionCleaner Thread to exit nicely."
                    + " Interrupting it instead.");
            _cleanerThread.interrupt();
            Thread.currentThread().interrupt();
        }
    }

    private void cleanerRunnable() {
        log.info("Started: StaleSessionCleaner for [" + _sessionStore.storeId() + "], Thread ["
                + Thread.currentThread() + "]");
        while (_runFlag) {
            synchronized (_cleanerThreadSynchAndSleepObject) {
                try {
                    // ?: Re-check runFlag inside sync, so that we do not miss a notify happening before the wait.
                    if (_runFlag) {
                        _cleanerThreadSynchAndSleepObject.wait(_millisBetweenCleanupRuns);
                    }
                }
                catch (InterruptedException e) {
                    log.debug("Got interrupted while sleeping between cleanup runs,"
                            + " assuming shutdown, looping to check runFlag.");
                    continue;
                }
            }
            // ?: Re-check runFlag, if we got woken up to exit
            if (!_runFlag) {
                // -> Shouldn't run anymore, exit loop.
                break;
            }

            try {
                long nanosStart = System.nanoTime();
                int removed = _sessionStore.cleanupStaleSessions(_sessionTtl);
                log.debug("Cleanup run removed [" + removed + "] stale sessions, took [" + msSince(nanosStart)
                        + " ms].");
            }
            catch (Throwable t) {
                log.warn("Got problems performing a cleanup run for [" + _sessionStore.storeId() + "].", t);
            }
        }
        log.info("Exiting: StaleSessionCleaner Thread for [" + _sessionStore.storeId() + "].");
    }
}
