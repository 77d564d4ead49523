package forklift;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JobTest {

    @Test
    public void successfulTaskProducesItsValue() {
        final Job job = new Job(5, () -> 21 * 2, result -> {
        });

        final Result result = job.run();

        assertThat(result.jobId()).isEqualTo(5);
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.data()).isEqualTo(42);
    }

    @Test
    public void throwingTaskProducesFailure() {
        final Job job = new Job(1, () -> {
            throw new IOException("disk gone");
        }, result -> {
        });

        final Result result = job.run();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error()).contains("IOException").contains("disk gone");
    }

    @Test
    public void interruptedTaskKeepsInterruptFlag() {
        final Job job = new Job(1, () -> {
            throw new InterruptedException();
        }, result -> {
        });

        try {
            final Result result = job.run();

            assertThat(result.isSuccess()).isFalse();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    public void throwingCallbackDoesNotPropagate() {
        final List<Result> seen = new ArrayList<>();
        final Job job = new Job(1, () -> null, result -> {
            seen.add(result);
            throw new IllegalStateException("callback bug");
        });

        job.runCallback(job.run());

        assertThat(seen).hasSize(1);
    }
}
