package org.carball.discovery.engine;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed thread pool whose concurrently running tasks are capped by a semaphore. Results come back
 * in task order, each carrying either a value or the error that task raised.
 */
@Slf4j
public class WorkerPool implements AutoCloseable {

    @FunctionalInterface
    public interface Task<T> {
        T call() throws Exception;
    }

    public record Result<T>(T value, Throwable error) {

        public boolean isSuccess() {
            return error == null;
        }
    }

    private final ExecutorService executor;
    private final Semaphore permits;
    private final int poolSize;
    private final int maxConcurrency;

    private final AtomicInteger activeTasks = new AtomicInteger();
    private final AtomicLong completedTasks = new AtomicLong();
    private final AtomicLong failedTasks = new AtomicLong();

    public WorkerPool(int poolSize, int maxConcurrency) {
        if (poolSize < 1 || maxConcurrency < 1) {
            throw new IllegalArgumentException("Pool size and concurrency must be positive");
        }
        this.poolSize = poolSize;
        this.maxConcurrency = maxConcurrency;
        this.permits = new Semaphore(maxConcurrency, true);
        this.executor = Executors.newFixedThreadPool(poolSize, daemonThreads());
        log.debug("Worker pool started with {} threads, {} concurrent tasks", poolSize, maxConcurrency);
    }

    /**
     * Runs every task and waits until all finish or {@code deadline} passes. Tasks still running
     * at the deadline are cancelled and reported with a {@link TimeoutException}.
     */
    public <T> List<Result<T>> runAll(List<Task<T>> tasks, Duration deadline) {
        List<Future<T>> futures = new ArrayList<>(tasks.size());
        for (Task<T> task : tasks) {
            futures.add(executor.submit(() -> runBounded(task)));
        }

        long deadlineNanos = System.nanoTime() + deadline.toNanos();
        List<Result<T>> results = new ArrayList<>(tasks.size());
        boolean interrupted = false;

        for (Future<T> future : futures) {
            if (interrupted) {
                future.cancel(true);
                results.add(new Result<>(null, new CancellationException("Discovery interrupted")));
                continue;
            }
            try {
                long remaining = Math.max(0, deadlineNanos - System.nanoTime());
                results.add(new Result<>(future.get(remaining, TimeUnit.NANOSECONDS), null));
            } catch (ExecutionException e) {
                results.add(new Result<>(null, e.getCause() != null ? e.getCause() : e));
            } catch (TimeoutException e) {
                future.cancel(true);
                results.add(new Result<>(null,
                        new TimeoutException("Discovery deadline of " + deadline + " exceeded")));
            } catch (CancellationException e) {
                results.add(new Result<>(null, e));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                future.cancel(true);
                results.add(new Result<>(null, new CancellationException("Discovery interrupted")));
            }
        }

        long failures = results.stream().filter(r -> !r.isSuccess()).count();
        log.debug("Batch of {} tasks finished with {} failures", tasks.size(), failures);
        return results;
    }

    private <T> T runBounded(Task<T> task) throws Exception {
        permits.acquire();
        activeTasks.incrementAndGet();
        try {
            T value = task.call();
            completedTasks.incrementAndGet();
            return value;
        } catch (Exception e) {
            failedTasks.incrementAndGet();
            throw e;
        } finally {
            activeTasks.decrementAndGet();
            permits.release();
        }
    }

    public int getActiveTasks() {
        return activeTasks.get();
    }

    public long getCompletedTasks() {
        return completedTasks.get();
    }

    public long getFailedTasks() {
        return failedTasks.get();
    }

    public int getPoolSize() {
        return poolSize;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "discovery-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
