package forklift.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Watchdog keeps finding out the worker that is
 * running its body for more than `workerTimeoutNanos`.
 */
final class Watchdog extends AbstractWorker {

    private static final Logger LOGGER = LoggerFactory.getLogger(Watchdog.class);

    private final WorkerPool pool;
    private final long workerTimeoutNanos;
    private final long watchdogIntervalMillis;
    private final int watchdogIntervalRemainingNanos;

    Watchdog(WorkerPool pool, long workerTimeoutNanos, long watchdogIntervalNanos) {
        super("forklift-watchdog");
        thread.setDaemon(true);
        this.pool = pool;
        this.workerTimeoutNanos = workerTimeoutNanos;

        final long nanosPerMilli = TimeUnit.MILLISECONDS.toNanos(1); // 1,000,000
        this.watchdogIntervalMillis = watchdogIntervalNanos / nanosPerMilli;
        this.watchdogIntervalRemainingNanos = (int) (watchdogIntervalNanos % nanosPerMilli);
    }

    @Override
    void go() {
        LOGGER.debug("Started a watchdog {}", workerName());
        try {
            while (!pool.isShutdown()) {
                try {
                    Thread.sleep(watchdogIntervalMillis, watchdogIntervalRemainingNanos);
                } catch (InterruptedException ignore) {
                    continue;
                }

                pool.forEachWorker(w -> {
                    final long startTimeNanos = w.startTimeNanos();
                    if (startTimeNanos == WorkerPool.NOT_STARTED_MARKER || w.terminationReason() != null) {
                        return;
                    }

                    if (System.nanoTime() - startTimeNanos > workerTimeoutNanos) {
                        LOGGER.warn("{} ran longer than {} ms; interrupting",
                                w.workerName(), TimeUnit.NANOSECONDS.toMillis(workerTimeoutNanos));
                        w.interrupt(TerminationReason.WATCHDOG);
                    }
                });
            }
        } catch (Throwable cause) {
            LOGGER.warn("Unexpected exception from a watchdog: {}", terminationReason(), cause);
        } finally {
            LOGGER.debug("{} has been terminated", workerName());
        }
    }
}
