package forklift.driver;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import forklift.Driver;
import forklift.Job;
import forklift.Result;
import forklift.pool.WorkerExit;
import forklift.pool.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Runs each batch of jobs on its own {@link WorkerPool} worker.
 *
 * <p>A batch is stashed under a fresh worker id, then its jobs run one after another inside the worker and
 * their results travel back as raw records. When the pool reaps the worker, the records are turned back
 * into {@link Result}s carrying the job ids and handed to the job callbacks on the reaping thread. A job
 * that never produced a record, because its worker failed, timed out or was shut down, gets a failed result.
 *
 * <p>Submitting blocks while {@link #maxWorkers()} workers are active. With {@code maxWorkers == 0} batches
 * run on the calling thread and their callbacks fire before {@link #runJobs(List)} returns.
 */
public final class WorkerPoolDriver implements Driver {

    static final long MAX_WORKER_ID = 4_000_000_000L;

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerPoolDriver.class);
    private static final AtomicLong LAST_WORKER_ID = new AtomicLong();

    private final Map<String, List<Job>> workerJobs = new ConcurrentHashMap<>();
    private final WorkerPool pool;

    WorkerPoolDriver(WorkerPoolDriverBuilder builder) {
        this.pool = WorkerPool.builder(builder.maxWorkers)
                .waitSleep(builder.waitSleep)
                .workerTimeout(builder.workerTimeout)
                .onFinish(this::onFinish)
                .build();
    }

    public static WorkerPoolDriverBuilder builder() {
        return new WorkerPoolDriverBuilder();
    }

    static String nextWorkerId() {
        return nextWorkerId(LAST_WORKER_ID);
    }

    @VisibleForTesting
    static String nextWorkerId(AtomicLong lastId) {
        return "worker-" + lastId.updateAndGet(last -> last >= MAX_WORKER_ID ? 1 : last + 1);
    }

    @VisibleForTesting
    int stashedBatches() {
        return workerJobs.size();
    }

    public int maxWorkers() {
        return pool.maxWorkers();
    }

    @Override
    public boolean isBusy() {
        return pool.runningWorkers() > 0;
    }

    @Override
    public boolean isSaturated() {
        return pool.maxWorkers() > 0 && pool.runningWorkers() >= pool.maxWorkers();
    }

    @Override
    public boolean inJob() {
        return pool.isWorker();
    }

    @Override
    public void runJobs(List<Job> jobs) throws InterruptedException {
        requireNonNull(jobs, "jobs");
        checkArgument(!jobs.isEmpty(), "jobs is empty");

        final List<Job> batch = ImmutableList.copyOf(jobs);
        final String workerId = nextWorkerId();
        workerJobs.put(workerId, batch);
        LOGGER.debug("Starting {} with {} jobs", workerId, batch.size());

        try {
            pool.start(workerId, results -> {
                for (Job job : batch) {
                    if (Thread.currentThread().isInterrupted()) {
                        break;
                    }
                    results.accept(job.run().toRaw());
                }
            });
        } catch (RuntimeException | InterruptedException e) {
            workerJobs.remove(workerId);
            throw e;
        }
    }

    @Override
    public void yield() {
        pool.reapFinishedWorkers();
    }

    @Override
    public void waitOne() throws InterruptedException {
        final int running = pool.runningWorkers();
        if (running == 0) {
            return;
        }
        final int available = pool.maxWorkers() - running;
        pool.waitForAvailableWorkers(available + 1);
    }

    @Override
    public void waitAll() throws InterruptedException {
        if (!isBusy()) {
            return;
        }
        pool.waitAllWorkers();
    }

    @Override
    public void waitSaturated() throws InterruptedException {
        if (!isSaturated()) {
            return;
        }
        pool.waitForAvailableWorkers(1);
    }

    /**
     * Waits for the active workers unless called from inside a job, then shuts the pool down.
     */
    @Override
    public void close() {
        if (inJob()) {
            return;
        }
        try {
            waitAll();
        } catch (InterruptedException e) {
            LOGGER.warn("Interrupted while waiting for {} workers; shutting down", pool.runningWorkers());
            pool.interruptedShutdown();
            Thread.currentThread().interrupt();
            return;
        }
        pool.shutdown();
    }

    private void onFinish(WorkerExit exit) {
        final List<Job> jobs = workerJobs.remove(exit.workerId());
        if (jobs == null) {
            LOGGER.warn("No jobs stashed for {}", exit.workerId());
            return;
        }

        final Iterator<Map<String, Object>> rawResults = exit.results().iterator();
        for (Job job : jobs) {
            final Result result = rawResults.hasNext() ?
                    Result.fromRaw(rawResults.next(), job.id()) :
                    Result.failure(job.id(), describeMissingResult(exit));
            job.runCallback(result);
        }
    }

    private static String describeMissingResult(WorkerExit exit) {
        final StringBuilder message = new StringBuilder()
                .append(exit.workerId())
                .append(" exited with code ").append(exit.exitCode())
                .append(" (").append(exit.reason()).append(')')
                .append(" before the job produced a result");
        if (exit.cause() != null) {
            message.append(": ").append(exit.cause());
        }
        return message.toString();
    }
}
