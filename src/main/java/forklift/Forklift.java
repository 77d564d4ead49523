package forklift;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * A job queue. Jobs are created with {@link #newJob(JobTask, Consumer)}, grouped into batches of at most
 * {@link #batchSize()} jobs and handed to the configured {@link Driver}, which delivers each job's
 * {@link Result} to its callback.
 *
 * <pre>{@code
 * try (Forklift lift = Forklift.builder()
 *         .driver(WorkerPoolDriver.builder().maxWorkers(5).build())
 *         .build()) {
 *     lift.runJob(() -> fetch(url), result -> store(result));
 *     lift.waitAll();
 * }
 * }</pre>
 */
public final class Forklift implements AutoCloseable {

    public static final String BATCH_SIZE_KEY = "forklift.batch-size";
    public static final String DRIVER_PREFIX = "forklift.driver.";

    private static final Logger LOGGER = LoggerFactory.getLogger(Forklift.class);

    private final AtomicLong lastJobId = new AtomicLong();
    private final Driver driver;
    private final int batchSize;

    Forklift(Driver driver, int batchSize) {
        this.driver = driver;
        this.batchSize = batchSize;
    }

    public static ForkliftBuilder builder() {
        return new ForkliftBuilder();
    }

    /**
     * Creates a Forklift from {@value #BATCH_SIZE_KEY} and the {@value #DRIVER_PREFIX}{@code *} properties,
     * e.g. {@code forklift.driver.class=worker-pool} and {@code forklift.driver.max-workers=5}.
     */
    public static Forklift fromProperties(Properties properties) {
        requireNonNull(properties, "properties");
        final ForkliftBuilder builder = builder()
                .driver(Drivers.create(DriverConfig.fromProperties(properties, DRIVER_PREFIX)));
        final String batchSize = properties.getProperty(BATCH_SIZE_KEY);
        if (batchSize != null) {
            try {
                builder.batchSize(Integer.parseInt(batchSize.trim()));
            } catch (NumberFormatException e) {
                throw new ForkliftException(BATCH_SIZE_KEY + ": " + batchSize + " (expected: an integer)", e);
            }
        }
        return builder.build();
    }

    /**
     * Like {@link #fromProperties(Properties)}, reading the properties from a class path resource.
     */
    public static Forklift fromResource(String resource) {
        requireNonNull(resource, "resource");
        final Properties properties = new Properties();
        try (InputStream in = Forklift.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ForkliftException("configuration not found on the class path: " + resource);
            }
            properties.load(in);
        } catch (IOException e) {
            throw new ForkliftException("cannot read configuration " + resource, e);
        }
        return fromProperties(properties);
    }

    public Driver driver() {
        return driver;
    }

    /**
     * Returns the maximum number of jobs handed to the driver together.
     */
    public int batchSize() {
        return batchSize;
    }

    /**
     * Creates a job with the next job id. The job does not run until it is passed to {@link #runJobs(List)}.
     */
    public Job newJob(JobTask task, Consumer<Result> callback) {
        return new Job(lastJobId.incrementAndGet(), task, callback);
    }

    /**
     * Creates a job and runs it.
     */
    public Job runJob(JobTask task, Consumer<Result> callback) throws InterruptedException {
        final Job job = newJob(task, callback);
        runJobs(ImmutableList.of(job));
        return job;
    }

    /**
     * Hands {@code jobs} to the driver in batches of at most {@link #batchSize()}, in order.
     */
    public void runJobs(List<Job> jobs) throws InterruptedException {
        requireNonNull(jobs, "jobs");
        for (List<Job> batch : Lists.partition(ImmutableList.copyOf(jobs), batchSize)) {
            LOGGER.debug("Submitting a batch of {} jobs", batch.size());
            driver.runJobs(batch);
        }
    }

    public boolean isBusy() {
        return driver.isBusy();
    }

    public boolean isSaturated() {
        return driver.isSaturated();
    }

    public boolean inJob() {
        return driver.inJob();
    }

    public void yield() {
        driver.yield();
    }

    public void waitOne() throws InterruptedException {
        driver.waitOne();
    }

    public void waitAll() throws InterruptedException {
        driver.waitAll();
    }

    public void waitSaturated() throws InterruptedException {
        driver.waitSaturated();
    }

    @Override
    public void close() {
        driver.close();
    }
}
