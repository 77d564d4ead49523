package forklift.pool;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerPoolTest {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerPoolTest.class);

    @Test
    public void neverRunsMoreThanMaxWorkers() throws Exception {
        //given
        final int maxWorkers = 3;
        final List<WorkerExit> exits = new CopyOnWriteArrayList<>();
        final WorkerPool pool = WorkerPool.builder(maxWorkers)
                .waitSleep(Duration.ofMillis(10))
                .onFinish(exits::add)
                .build();

        final AtomicInteger active = new AtomicInteger();
        final AtomicInteger maxActive = new AtomicInteger();

        //when
        final int numWorkers = 10;
        for (int i = 0; i < numWorkers; i++) {
            pool.start("worker-" + i, results -> {
                maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                try {
                    Thread.sleep(50);
                } finally {
                    active.decrementAndGet();
                }
            });
            assertThat(pool.runningWorkers()).isLessThanOrEqualTo(maxWorkers);
        }
        pool.waitAllWorkers();

        //then
        assertThat(maxActive.get()).isLessThanOrEqualTo(maxWorkers);
        assertThat(exits).hasSize(numWorkers);
        assertThat(exits).allSatisfy(exit -> assertThat(exit.exitCode()).isEqualTo(WorkerExit.EXIT_SUCCESS));
        assertThat(pool.runningWorkers()).isZero();
    }

    @Test
    public void finishCallbackRunsOnReapingThread() throws Exception {
        final AtomicReference<Thread> bodyThread = new AtomicReference<>();
        final AtomicReference<Thread> callbackThread = new AtomicReference<>();
        final WorkerPool pool = WorkerPool.builder(2)
                .waitSleep(Duration.ofMillis(10))
                .onFinish(exit -> callbackThread.set(Thread.currentThread()))
                .build();

        pool.start("worker-1", results -> bodyThread.set(Thread.currentThread()));
        pool.waitAllWorkers();

        assertThat(callbackThread.get()).isSameAs(Thread.currentThread());
        assertThat(bodyThread.get()).isNotSameAs(Thread.currentThread());
        assertThat(bodyThread.get().getName()).isEqualTo("forklift-worker-1");
    }

    @Test
    public void slotIsHeldUntilWorkerIsReaped() throws Exception {
        final List<WorkerExit> exits = new CopyOnWriteArrayList<>();
        final WorkerPool pool = WorkerPool.builder(1)
                .onFinish(exits::add)
                .build();
        final CountDownLatch ran = new CountDownLatch(1);

        pool.start("worker-1", results -> {
            results.accept(Map.of("value", 42));
            ran.countDown();
        });
        assertThat(ran.await(10, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(100);

        assertThat(pool.runningWorkers()).isEqualTo(1);
        assertThat(exits).isEmpty();

        assertThat(pool.reapFinishedWorkers()).isEqualTo(1);
        assertThat(pool.runningWorkers()).isZero();
        assertThat(exits).hasSize(1);
        assertThat(exits.get(0).results()).containsExactly(Map.of("value", 42));
    }

    @Test
    public void failedBodyKeepsResultsProducedBeforeTheFailure() throws Exception {
        final List<WorkerExit> exits = new CopyOnWriteArrayList<>();
        final WorkerPool pool = WorkerPool.builder(1)
                .waitSleep(Duration.ofMillis(10))
                .onFinish(exits::add)
                .build();

        pool.start("worker-1", results -> {
            results.accept(Map.of("n", 1));
            throw new IllegalStateException("boom");
        });
        pool.waitAllWorkers();

        assertThat(exits).hasSize(1);
        final WorkerExit exit = exits.get(0);
        assertThat(exit.workerId()).isEqualTo("worker-1");
        assertThat(exit.exitCode()).isEqualTo(WorkerExit.EXIT_FAILURE);
        assertThat(exit.reason()).isEqualTo(TerminationReason.FAILED);
        assertThat(exit.cause()).isInstanceOf(IllegalStateException.class).hasMessage("boom");
        assertThat(exit.results()).containsExactly(Map.of("n", 1));
    }

    @Test
    public void zeroMaxWorkersRunsInlineAndDispatchesImmediately() throws Exception {
        final List<WorkerExit> exits = new CopyOnWriteArrayList<>();
        final WorkerPool pool = WorkerPool.builder(0)
                .onFinish(exits::add)
                .build();
        final AtomicReference<Thread> bodyThread = new AtomicReference<>();
        final AtomicBoolean wasWorker = new AtomicBoolean();

        pool.start("worker-1", results -> {
            bodyThread.set(Thread.currentThread());
            wasWorker.set(pool.isWorker());
        });

        assertThat(bodyThread.get()).isSameAs(Thread.currentThread());
        assertThat(wasWorker.get()).isTrue();
        assertThat(pool.isWorker()).isFalse();
        assertThat(exits).hasSize(1);
        assertThat(pool.runningWorkers()).isZero();
    }

    @Test
    public void watchdogInterruptsWorkerThatRunsTooLong() throws Exception {
        final List<WorkerExit> exits = new CopyOnWriteArrayList<>();
        final WorkerPool pool = WorkerPool.builder(1)
                .waitSleep(Duration.ofMillis(10))
                .workerTimeout(Duration.ofMillis(100))
                .watchdogInterval(Duration.ofMillis(20))
                .onFinish(exits::add)
                .build();

        pool.start("worker-1", results -> Thread.sleep(30000));
        pool.waitAllWorkers();
        pool.shutdown();

        assertThat(exits).hasSize(1);
        assertThat(exits.get(0).reason()).isEqualTo(TerminationReason.WATCHDOG);
        assertThat(exits.get(0).exitCode()).isEqualTo(WorkerExit.EXIT_FAILURE);
    }

    @Test
    public void cannotStartWorkerAfterPoolIsShutdown() throws Exception {
        final WorkerPool pool = WorkerPool.builder(1).build();
        pool.shutdown();

        assertThatThrownBy(() -> pool.start("worker-1", results -> {
        })).isInstanceOf(IllegalStateException.class)
           .hasMessageContaining("shut down");
    }

    @Test
    public void rejectsDuplicateWorkerId() throws Exception {
        final WorkerPool pool = WorkerPool.builder(2)
                .waitSleep(Duration.ofMillis(10))
                .build();
        final CountDownLatch release = new CountDownLatch(1);

        pool.start("worker-1", results -> release.await());
        try {
            assertThatThrownBy(() -> pool.start("worker-1", results -> {
            })).isInstanceOf(IllegalStateException.class)
               .hasMessageContaining("duplicate");
        } finally {
            release.countDown();
        }
        pool.waitAllWorkers();
    }

    @Test
    public void interruptedShutdownStopsRunningWorkers() throws Exception {
        final List<WorkerExit> exits = new CopyOnWriteArrayList<>();
        final WorkerPool pool = WorkerPool.builder(2)
                .onFinish(exits::add)
                .build();
        final CountDownLatch started = new CountDownLatch(2);

        for (int i = 1; i <= 2; i++) {
            pool.start("worker-" + i, results -> {
                started.countDown();
                try {
                    Thread.sleep(30000);
                } catch (InterruptedException e) {
                    LOGGER.warn("{} is interrupted", Thread.currentThread().getName());
                    throw e;
                }
            });
        }
        assertThat(started.await(10, TimeUnit.SECONDS)).isTrue();

        pool.interruptedShutdown();

        assertThat(pool.runningWorkers()).isZero();
        assertThat(exits).hasSize(2);
        assertThat(exits).allSatisfy(exit -> assertThat(exit.reason()).isEqualTo(TerminationReason.SHUTDOWN));
    }

    @Test
    public void rejectsNegativeMaxWorkers() {
        assertThatThrownBy(() -> WorkerPool.builder(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxWorkers");
    }
}
