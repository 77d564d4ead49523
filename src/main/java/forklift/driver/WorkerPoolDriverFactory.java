package forklift.driver;

import forklift.Driver;
import forklift.DriverConfig;
import forklift.DriverFactory;
import forklift.ForkliftException;

import java.time.Duration;

/**
 * Reads {@code max-workers}, {@code wait-sleep} and {@code worker-timeout} (seconds) into a
 * {@link WorkerPoolDriver}.
 */
public final class WorkerPoolDriverFactory implements DriverFactory {

    public static final String NAME = "worker-pool";

    static final String MAX_WORKERS = "max-workers";
    static final String WAIT_SLEEP = "wait-sleep";
    static final String WORKER_TIMEOUT = "worker-timeout";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Driver create(DriverConfig config) {
        final int maxWorkers = config.getInt(MAX_WORKERS, WorkerPoolDriverBuilder.DEFAULT_MAX_WORKERS);
        if (maxWorkers < 0) {
            throw new ForkliftException(MAX_WORKERS + ": " + maxWorkers + " (expected: >= 0)");
        }
        return WorkerPoolDriver.builder()
                .maxWorkers(maxWorkers)
                .waitSleep(config.getSeconds(WAIT_SLEEP, WorkerPoolDriverBuilder.DEFAULT_WAIT_SLEEP))
                .workerTimeout(config.getSeconds(WORKER_TIMEOUT, Duration.ZERO))
                .build();
    }
}
