package forklift.pool;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public class WorkerPoolBuilder {

    private static final long DEFAULT_WAIT_SLEEP_SECONDS = 1;
    private static final long DEFAULT_WATCHDOG_INTERVAL_SECONDS = 1;

    private final int maxWorkers;
    private long waitSleepNanos = TimeUnit.SECONDS.toNanos(DEFAULT_WAIT_SLEEP_SECONDS);
    private long workerTimeoutNanos;
    private long watchdogIntervalNanos = TimeUnit.SECONDS.toNanos(DEFAULT_WATCHDOG_INTERVAL_SECONDS);
    private FinishCallback finishCallback = FinishCallback.NOOP;

    WorkerPoolBuilder(int maxWorkers) {
        checkArgument(maxWorkers >= 0, "maxWorkers: %s (expected: >= 0)", maxWorkers);
        this.maxWorkers = maxWorkers;
    }

    /**
     * Sets how long a blocking wait sleeps between checks for finished workers.
     * {@code 0} blocks until the next worker finishes.
     */
    public WorkerPoolBuilder waitSleep(long waitSleep, TimeUnit unit) {
        checkArgument(waitSleep >= 0, "waitSleep: %s (expected: >= 0)", waitSleep);
        this.waitSleepNanos = requireNonNull(unit, "unit").toNanos(waitSleep);
        return this;
    }

    public WorkerPoolBuilder waitSleep(Duration waitSleep) {
        requireNonNull(waitSleep, "waitSleep");
        checkArgument(!waitSleep.isNegative(), "waitSleep: %s (expected: >= 0)", waitSleep);
        return waitSleep(waitSleep.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Sets how long a worker may run before the watchdog interrupts it. {@code 0} disables the watchdog.
     */
    public WorkerPoolBuilder workerTimeout(long workerTimeout, TimeUnit unit) {
        checkArgument(workerTimeout >= 0, "workerTimeout: %s (expected: >= 0)", workerTimeout);
        this.workerTimeoutNanos = requireNonNull(unit, "unit").toNanos(workerTimeout);
        return this;
    }

    public WorkerPoolBuilder workerTimeout(Duration workerTimeout) {
        requireNonNull(workerTimeout, "workerTimeout");
        checkArgument(!workerTimeout.isNegative(), "workerTimeout: %s (expected: >= 0)", workerTimeout);
        return workerTimeout(workerTimeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public WorkerPoolBuilder watchdogInterval(long watchdogInterval, TimeUnit unit) {
        checkArgument(watchdogInterval > 0, "watchdogInterval: %s (expected: > 0)", watchdogInterval);
        watchdogIntervalNanos = requireNonNull(unit, "unit").toNanos(watchdogInterval);
        return this;
    }

    public WorkerPoolBuilder watchdogInterval(Duration watchdogInterval) {
        requireNonNull(watchdogInterval, "watchdogInterval");
        checkArgument(!watchdogInterval.isZero() &&
                        !watchdogInterval.isNegative(),
                "watchdogInterval: %s (expected: > 0)", watchdogInterval);
        return watchdogInterval(watchdogInterval.toNanos(), TimeUnit.NANOSECONDS);
    }

    public WorkerPoolBuilder onFinish(FinishCallback finishCallback) {
        this.finishCallback = requireNonNull(finishCallback, "finishCallback");
        return this;
    }

    public WorkerPool build() {
        return new WorkerPool(maxWorkers, waitSleepNanos, workerTimeoutNanos, watchdogIntervalNanos,
                finishCallback);
    }
}
