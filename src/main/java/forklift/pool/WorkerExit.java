package forklift.pool;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * What a finished worker hands back to the reaping thread.
 */
public final class WorkerExit {

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;

    private final String workerId;
    private final TerminationReason reason;
    @Nullable
    private final Throwable cause;
    private final List<Map<String, Object>> results;

    WorkerExit(String workerId, TerminationReason reason, @Nullable Throwable cause,
               List<Map<String, Object>> results) {
        this.workerId = requireNonNull(workerId, "workerId");
        this.reason = requireNonNull(reason, "reason");
        this.cause = cause;
        this.results = ImmutableList.copyOf(results);
    }

    public String workerId() {
        return workerId;
    }

    /**
     * Returns {@value #EXIT_SUCCESS} if the worker finished normally, {@value #EXIT_FAILURE} otherwise.
     */
    public int exitCode() {
        return reason == TerminationReason.FINISHED ? EXIT_SUCCESS : EXIT_FAILURE;
    }

    public TerminationReason reason() {
        return reason;
    }

    @Nullable
    public Throwable cause() {
        return cause;
    }

    /**
     * Returns the raw results in the order the worker produced them.
     */
    public List<Map<String, Object>> results() {
        return results;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("workerId", workerId)
                .add("exitCode", exitCode())
                .add("reason", reason)
                .add("cause", cause)
                .add("results", results.size())
                .toString();
    }
}
