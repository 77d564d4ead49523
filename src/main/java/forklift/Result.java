package forklift;

import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of running one {@link Job}.
 *
 * <p>Results cross the worker boundary as raw records (see {@link #toRaw()}) that do not carry the job id;
 * the receiving side reattaches it with {@link #fromRaw(Map, long)}.
 */
public final class Result {

    static final String SUCCESS = "success";
    static final String ERROR = "error";
    static final String DATA = "data";

    private final long jobId;
    private final boolean success;
    @Nullable
    private final String error;
    @Nullable
    private final Object data;

    private Result(long jobId, boolean success, @Nullable String error, @Nullable Object data) {
        this.jobId = jobId;
        this.success = success;
        this.error = error;
        this.data = data;
    }

    public static Result success(long jobId, @Nullable Object data) {
        return new Result(jobId, true, null, data);
    }

    public static Result failure(long jobId, String error) {
        return new Result(jobId, false, requireNonNull(error, "error"), null);
    }

    /**
     * Rebuilds a result from a raw record, attaching {@code jobId}. A record without a {@code success}
     * entry is treated as a failure.
     */
    public static Result fromRaw(Map<String, ?> raw, long jobId) {
        requireNonNull(raw, "raw");
        final boolean success = Boolean.TRUE.equals(raw.get(SUCCESS));
        final Object error = raw.get(ERROR);
        if (!success && error == null) {
            return failure(jobId, "result record has no success flag: " + raw);
        }
        return new Result(jobId, success, error != null ? error.toString() : null, raw.get(DATA));
    }

    public long jobId() {
        return jobId;
    }

    public boolean isSuccess() {
        return success;
    }

    @Nullable
    public String error() {
        return error;
    }

    @Nullable
    public Object data() {
        return data;
    }

    /**
     * Returns the raw record for this result, without the job id.
     */
    public Map<String, Object> toRaw() {
        final Map<String, Object> raw = new LinkedHashMap<>();
        raw.put(SUCCESS, success);
        raw.put(ERROR, error);
        raw.put(DATA, data);
        return Collections.unmodifiableMap(raw);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("jobId", jobId)
                .add("success", success)
                .add("error", error)
                .add("data", data)
                .toString();
    }
}
