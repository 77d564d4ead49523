package forklift;

import javax.annotation.Nullable;

/**
 * The work a {@link Job} performs. The returned value becomes the job's result data.
 */
@FunctionalInterface
public interface JobTask {

    @Nullable
    Object run() throws Exception;
}
