package forklift;

import com.google.common.base.MoreObjects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * A unit of work plus the callback that receives its {@link Result}.
 */
public final class Job {

    private static final Logger LOGGER = LoggerFactory.getLogger(Job.class);

    private final long id;
    private final JobTask task;
    private final Consumer<Result> callback;

    public Job(long id, JobTask task, Consumer<Result> callback) {
        this.id = id;
        this.task = requireNonNull(task, "task");
        this.callback = requireNonNull(callback, "callback");
    }

    public long id() {
        return id;
    }

    /**
     * Runs the task. A task that throws produces a failed result; an interrupted task also leaves the
     * thread's interrupt flag set.
     */
    public Result run() {
        try {
            return Result.success(id, task.run());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.failure(id, "job " + id + " was interrupted");
        } catch (Exception e) {
            LOGGER.debug("Job {} failed", id, e);
            return Result.failure(id, e.toString());
        }
    }

    /**
     * Hands {@code result} to the callback. A callback that throws is logged, not propagated.
     */
    public void runCallback(Result result) {
        requireNonNull(result, "result");
        try {
            callback.accept(result);
        } catch (RuntimeException e) {
            LOGGER.warn("Callback of job {} threw", id, e);
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .toString();
    }
}
