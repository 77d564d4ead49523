package forklift.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * A bounded pool of workers, each running one {@link WorkerBody} on its own thread.
 *
 * <p>Starting, reaping and waiting are done by a single controlling thread. A worker that finishes is not
 * forgotten until that thread reaps it: only then is its slot released and the {@link FinishCallback}
 * invoked, always on the reaping thread. With {@code maxWorkers == 0} no thread is started; the body runs
 * in the caller and its exit is dispatched before {@link #start} returns.
 */
public final class WorkerPool {

    static final long NOT_STARTED_MARKER = 0;

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerPool.class);

    // Started and not yet reaped.
    private final Map<String, Worker> workers = new ConcurrentHashMap<>();
    private final BlockingQueue<WorkerExit> finished = new LinkedBlockingQueue<>();
    private final AtomicReference<ShutdownState> shutdownState = new AtomicReference<>(ShutdownState.NOT_SHUTDOWN);
    private final ThreadLocal<Boolean> inWorker = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private final int maxWorkers;
    private final long waitSleepNanos;
    private final FinishCallback finishCallback;
    @Nullable
    private final Watchdog watchdog;

    WorkerPool(int maxWorkers, long waitSleepNanos, long workerTimeoutNanos, long watchdogIntervalNanos,
               FinishCallback finishCallback) {
        this.maxWorkers = maxWorkers;
        this.waitSleepNanos = waitSleepNanos;
        this.finishCallback = finishCallback;

        this.watchdog = workerTimeoutNanos != 0 && maxWorkers != 0 ?
                new Watchdog(this, workerTimeoutNanos, watchdogIntervalNanos) : null;
    }

    public static WorkerPoolBuilder builder(int maxWorkers) {
        return new WorkerPoolBuilder(maxWorkers);
    }

    /**
     * Returns the maximum number of concurrent workers.
     */
    public int maxWorkers() {
        return maxWorkers;
    }

    /**
     * Returns the number of started workers that have not been reaped yet.
     */
    public int runningWorkers() {
        return workers.size();
    }

    /**
     * Returns {@code true} if the calling thread is running a worker body of this pool.
     */
    public boolean isWorker() {
        return inWorker.get();
    }

    boolean isShutdown() {
        return shutdownState.get() != ShutdownState.NOT_SHUTDOWN;
    }

    /**
     * Starts a worker running {@code body}, blocking while every slot is taken.
     */
    public void start(@Nonnull String workerId, @Nonnull WorkerBody body) throws InterruptedException {
        requireNonNull(workerId, "workerId");
        requireNonNull(body, "body");
        checkState(!isWorker(), "%s cannot be started from inside a worker", workerId);
        checkState(!isShutdown(), "%s rejected: pool is shut down", workerId);
        checkState(!workers.containsKey(workerId), "duplicate worker id: %s", workerId);

        if (maxWorkers == 0) {
            LOGGER.debug("Running {} inline", workerId);
            dispatch(runBody(workerId, body, null));
            return;
        }

        waitForAvailableWorkers(1);

        final Worker worker = new Worker(workerId, body);
        workers.put(workerId, worker);
        if (watchdog != null) {
            watchdog.start();
        }
        worker.start();
    }

    /**
     * Dispatches every worker that has finished so far without blocking.
     *
     * @return the number of workers reaped
     */
    public int reapFinishedWorkers() {
        int reaped = 0;
        WorkerExit exit;
        while ((exit = finished.poll()) != null) {
            reap(exit);
            reaped++;
        }
        return reaped;
    }

    /**
     * Blocks until at least {@code numWorkers} slots are free, reaping finished workers meanwhile.
     * A request for more slots than {@link #maxWorkers()} waits for all of them.
     */
    public void waitForAvailableWorkers(int numWorkers) throws InterruptedException {
        checkArgument(numWorkers >= 0, "numWorkers: %s (expected: >= 0)", numWorkers);
        final int wanted = Math.min(numWorkers, maxWorkers);

        reapFinishedWorkers();
        while (maxWorkers - runningWorkers() < wanted) {
            final WorkerExit exit = waitSleepNanos == 0 ?
                    finished.take() : finished.poll(waitSleepNanos, TimeUnit.NANOSECONDS);
            if (exit != null) {
                reap(exit);
                reapFinishedWorkers();
            }
        }
    }

    /**
     * Blocks until every started worker has finished and been reaped.
     */
    public void waitAllWorkers() throws InterruptedException {
        waitForAvailableWorkers(maxWorkers);
    }

    /**
     * Refuses new workers, then waits for the running ones and reaps them.
     */
    public void shutdown() {
        doShutdown(false);
    }

    /**
     * Like {@link #shutdown()}, but interrupts the running workers first.
     */
    public void interruptedShutdown() {
        doShutdown(true);
    }

    private void doShutdown(boolean interrupted) {
        if (interrupted) {
            if (!shutdownState.compareAndSet(ShutdownState.NOT_SHUTDOWN, ShutdownState.SHUTDOWN_BY_INTERRUPT)) {
                shutdownState.compareAndSet(ShutdownState.SHUTDOWN, ShutdownState.SHUTDOWN_BY_INTERRUPT);
                LOGGER.debug("`interruptedShutdown()` is called after `shutdown()`");
            }
        } else {
            shutdownState.compareAndSet(ShutdownState.NOT_SHUTDOWN, ShutdownState.SHUTDOWN);
        }

        if (watchdog != null) {
            watchdog.interrupt(TerminationReason.SHUTDOWN);
        }

        // Every worker posts its exit before its thread ends, so joining them all leaves nothing unreaped.
        final List<Worker> running = new ArrayList<>(workers.values());
        if (interrupted) {
            for (Worker w : running) {
                w.interrupt(TerminationReason.SHUTDOWN);
            }
        }
        for (Worker w : running) {
            w.join();
        }
        reapFinishedWorkers();
    }

    void forEachWorker(Consumer<Worker> consumer) {
        workers.values().forEach(consumer);
    }

    private void reap(WorkerExit exit) {
        final Worker worker = workers.remove(exit.workerId());
        if (worker != null) {
            worker.join();
        }
        if (exit.exitCode() != WorkerExit.EXIT_SUCCESS) {
            LOGGER.warn("Reaped {}, reason: {}", exit.workerId(), exit.reason(), exit.cause());
        } else {
            LOGGER.debug("Reaped {}", exit.workerId());
        }
        dispatch(exit);
    }

    private void dispatch(WorkerExit exit) {
        finishCallback.onFinish(exit);
    }

    private WorkerExit runBody(String workerId, WorkerBody body, @Nullable Worker worker) {
        final List<Map<String, Object>> results = new ArrayList<>();
        Throwable cause = null;
        inWorker.set(Boolean.TRUE);
        try {
            body.run(results::add);
        } catch (Throwable t) {
            cause = t;
        } finally {
            inWorker.remove();
        }

        TerminationReason reason = worker != null ? worker.terminationReason() : null;
        if (reason == null) {
            reason = cause == null ? TerminationReason.FINISHED : TerminationReason.FAILED;
        }
        return new WorkerExit(workerId, reason, cause, results);
    }

    enum ShutdownState {
        NOT_SHUTDOWN,
        SHUTDOWN,
        SHUTDOWN_BY_INTERRUPT
    }

    final class Worker extends AbstractWorker {

        private final String workerId;
        private final WorkerBody body;

        private volatile long startTimeNanos;

        Worker(String workerId, WorkerBody body) {
            super("forklift-" + workerId);
            this.workerId = workerId;
            this.body = body;
        }

        @Override
        void go() {
            LOGGER.debug("Started a new worker: {}", workerName);
            setStartTimeNanos();
            final WorkerExit exit = runBody(workerId, body, this);
            clearStartTimeNanos();
            finished.add(exit);
        }

        long startTimeNanos() {
            return startTimeNanos;
        }

        private void setStartTimeNanos() {
            final long nanoTime = System.nanoTime();
            startTimeNanos = nanoTime == NOT_STARTED_MARKER ? 1 : nanoTime;
        }

        private void clearStartTimeNanos() {
            startTimeNanos = NOT_STARTED_MARKER;
        }
    }
}
