package forklift.driver;

import forklift.Driver;
import forklift.Job;
import forklift.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Runs every batch right away on the calling thread. Each job's callback is invoked as soon as the job
 * has run, before {@link #runJobs(List)} returns.
 */
public final class SyncDriver implements Driver {

    private static final Logger LOGGER = LoggerFactory.getLogger(SyncDriver.class);

    private final ThreadLocal<Boolean> inJob = ThreadLocal.withInitial(() -> Boolean.FALSE);

    @Override
    public boolean isBusy() {
        return false;
    }

    @Override
    public boolean isSaturated() {
        return false;
    }

    @Override
    public boolean inJob() {
        return inJob.get();
    }

    /**
     * Runs {@code jobs} in order. A job that throws an {@link Error} ends the batch the way it ends a
     * worker: that job and every job after it get a failed result.
     */
    @Override
    public void runJobs(List<Job> jobs) {
        requireNonNull(jobs, "jobs");
        Error failure = null;
        for (Job job : jobs) {
            if (failure != null) {
                job.runCallback(Result.failure(job.id(), "batch stopped before the job ran: " + failure));
                continue;
            }
            Result result;
            inJob.set(Boolean.TRUE);
            try {
                result = job.run();
            } catch (Error e) {
                LOGGER.warn("Job {} threw; failing the rest of the batch", job.id(), e);
                failure = e;
                result = Result.failure(job.id(), e.toString());
            } finally {
                inJob.remove();
            }
            job.runCallback(result);
        }
    }

    @Override
    public void yield() {
    }

    @Override
    public void waitOne() {
    }

    @Override
    public void waitAll() {
    }

    @Override
    public void waitSaturated() {
    }

    @Override
    public void close() {
    }
}
