package forklift;

import java.util.List;

/**
 * A pluggable backend that decides where and when {@link Forklift} jobs run.
 *
 * <p>Every job handed to {@link #runJobs(List)} receives exactly one result through its callback.
 * Callbacks run on the thread that submits and waits, never inside a running job.
 */
public interface Driver extends AutoCloseable {

    /**
     * Returns {@code true} if any worker is active.
     */
    boolean isBusy();

    /**
     * Returns {@code true} if no worker slot is free, so {@link #runJobs(List)} would block.
     */
    boolean isSaturated();

    /**
     * Returns {@code true} if called from inside a running job.
     */
    boolean inJob();

    /**
     * Runs {@code jobs} together as one batch, blocking while the driver is saturated.
     */
    void runJobs(List<Job> jobs) throws InterruptedException;

    /**
     * Dispatches the results of whatever has finished, without blocking.
     */
    void yield();

    /**
     * Waits until there is one less active worker than when the wait started.
     */
    void waitOne() throws InterruptedException;

    /**
     * Waits until every active worker has finished.
     */
    void waitAll() throws InterruptedException;

    /**
     * Waits until at least one worker slot is free.
     */
    void waitSaturated() throws InterruptedException;

    /**
     * Releases the driver. Unless called from inside a job, waits for all active workers first.
     */
    @Override
    void close();
}
