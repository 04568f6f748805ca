package org.carball.discovery.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class WorkerPoolTest {

    private WorkerPool pool;

    @BeforeEach
    void setUp() {
        pool = new WorkerPool(4, 2);
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    @Test
    public void shouldReturnResultsInTaskOrder() {
        // Given tasks that finish in reverse order
        List<WorkerPool.Task<Integer>> tasks = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            int index = i;
            tasks.add(() -> {
                Thread.sleep((6 - index) * 10L);
                return index;
            });
        }

        // When
        List<WorkerPool.Result<Integer>> results = pool.runAll(tasks, Duration.ofSeconds(10));

        // Then
        assertThat(results).extracting(WorkerPool.Result::value).containsExactly(0, 1, 2, 3, 4, 5);
        assertThat(results).allMatch(WorkerPool.Result::isSuccess);
        assertThat(pool.getCompletedTasks()).isEqualTo(6);
    }

    @Test
    public void shouldCapConcurrentTasks() {
        // Given
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        List<WorkerPool.Task<Integer>> tasks = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            tasks.add(() -> {
                int now = running.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                Thread.sleep(20);
                running.decrementAndGet();
                return now;
            });
        }

        // When
        pool.runAll(tasks, Duration.ofSeconds(10));

        // Then
        assertThat(peak.get()).isLessThanOrEqualTo(2);
        assertThat(pool.getActiveTasks()).isZero();
    }

    @Test
    public void shouldReportFailureWithoutAffectingOtherTasks() {
        // Given
        List<WorkerPool.Task<String>> tasks = List.of(
                () -> "Transaction",
                () -> {
                    throw new IllegalStateException("PageView failed");
                },
                () -> "Deployment");

        // When
        List<WorkerPool.Result<String>> results = pool.runAll(tasks, Duration.ofSeconds(10));

        // Then
        assertThat(results.get(0).value()).isEqualTo("Transaction");
        assertThat(results.get(1).isSuccess()).isFalse();
        assertThat(results.get(1).error())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("PageView failed");
        assertThat(results.get(2).value()).isEqualTo("Deployment");
        assertThat(pool.getFailedTasks()).isEqualTo(1);
    }

    @Test
    public void shouldTimeOutTasksPastDeadline() {
        // Given
        List<WorkerPool.Task<String>> tasks = List.of(
                () -> "fast",
                () -> {
                    Thread.sleep(10_000);
                    return "slow";
                });

        // When
        List<WorkerPool.Result<String>> results = pool.runAll(tasks, Duration.ofMillis(200));

        // Then
        assertThat(results.get(0).value()).isEqualTo("fast");
        assertThat(results.get(1).error())
                .isInstanceOf(TimeoutException.class)
                .hasMessageContaining("deadline");
    }

    @Test
    public void shouldShutDownOnClose() {
        // When
        pool.close();

        // Then
        assertThat(pool.isShutdown()).isTrue();
    }

    @Test
    public void shouldRejectNonPositiveSizes() {
        // When/Then
        assertThatThrownBy(() -> new WorkerPool(0, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be positive");
    }
}
