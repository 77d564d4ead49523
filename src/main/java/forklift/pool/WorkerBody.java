package forklift.pool;

import java.util.Map;
import java.util.function.Consumer;

/**
 * The code a worker runs. Raw results are handed to {@code results} as they are produced so that a worker
 * which fails halfway still reports what it finished.
 */
@FunctionalInterface
public interface WorkerBody {

    void run(Consumer<Map<String, Object>> results) throws Exception;
}
