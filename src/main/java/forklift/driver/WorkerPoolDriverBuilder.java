package forklift.driver;

import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public class WorkerPoolDriverBuilder {

    static final int DEFAULT_MAX_WORKERS = 10;
    static final Duration DEFAULT_WAIT_SLEEP = Duration.ofSeconds(1);

    int maxWorkers = DEFAULT_MAX_WORKERS;
    Duration waitSleep = DEFAULT_WAIT_SLEEP;
    Duration workerTimeout = Duration.ZERO;

    WorkerPoolDriverBuilder() {
    }

    /**
     * Sets the maximum number of concurrent workers. {@code 0} runs every batch on the calling thread.
     */
    public WorkerPoolDriverBuilder maxWorkers(int maxWorkers) {
        checkArgument(maxWorkers >= 0, "maxWorkers: %s (expected: >= 0)", maxWorkers);
        this.maxWorkers = maxWorkers;
        return this;
    }

    /**
     * Sets how long blocking waits sleep between checks for finished workers.
     */
    public WorkerPoolDriverBuilder waitSleep(Duration waitSleep) {
        requireNonNull(waitSleep, "waitSleep");
        checkArgument(!waitSleep.isNegative(), "waitSleep: %s (expected: >= 0)", waitSleep);
        this.waitSleep = waitSleep;
        return this;
    }

    /**
     * Sets how long a worker may run before it is interrupted. {@link Duration#ZERO} means no limit.
     */
    public WorkerPoolDriverBuilder workerTimeout(Duration workerTimeout) {
        requireNonNull(workerTimeout, "workerTimeout");
        checkArgument(!workerTimeout.isNegative(), "workerTimeout: %s (expected: >= 0)", workerTimeout);
        this.workerTimeout = workerTimeout;
        return this;
    }

    public WorkerPoolDriver build() {
        return new WorkerPoolDriver(this);
    }
}
