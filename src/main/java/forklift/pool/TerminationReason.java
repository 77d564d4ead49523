package forklift.pool;

/**
 * Why a worker stopped running.
 */
public enum TerminationReason {
    /**
     * The worker body returned normally.
     */
    FINISHED,
    /**
     * The worker body threw.
     */
    FAILED,
    /**
     * The worker was interrupted by {@code Watchdog} because it ran longer than the worker timeout.
     */
    WATCHDOG,
    /**
     * The worker was interrupted by {@link WorkerPool#interruptedShutdown()}.
     */
    SHUTDOWN
}
