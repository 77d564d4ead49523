package forklift.pool;

/**
 * Invoked by {@link WorkerPool} in the reaping thread once per finished worker.
 */
@FunctionalInterface
public interface FinishCallback {

    FinishCallback NOOP = exit -> {
    };

    void onFinish(WorkerExit exit);
}
