package forklift.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.concurrent.atomic.AtomicBoolean;

abstract class AbstractWorker {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractWorker.class);

    private final AtomicBoolean started = new AtomicBoolean(false);

    final Thread thread;
    final String workerName;

    @Nullable
    private volatile TerminationReason terminationReason;

    AbstractWorker(String workerName) {
        this.workerName = workerName;
        this.thread = new Thread(this::go, workerName);
    }

    String workerName() {
        return workerName;
    }

    void start() {
        if (started.compareAndSet(false, true)) {
            thread.start();
        }
    }

    void setTerminationReason(TerminationReason reason) {
        this.terminationReason = reason;
    }

    void interrupt(TerminationReason reason) {
        setTerminationReason(reason);
        thread.interrupt();
    }

    @Nullable
    TerminationReason terminationReason() {
        return terminationReason;
    }

    void join() {
        if (!started.get()) {
            return;
        }
        // Keep joining until the thread is dead; an early return would leave its exit unreaped.
        boolean interrupted = false;
        while (true) {
            try {
                thread.join();
                break;
            } catch (InterruptedException e) {
                LOGGER.debug("Interrupted while joining {}", workerName);
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    abstract void go();
}
