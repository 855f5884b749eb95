package utilities;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a measurement on a single worker thread with a deadline.
 * A task that misses the deadline is cancelled and its result, including any
 * structure it was building, must not be used again.
 */
public final class TimeoutGuard {

    private final long timeoutMillis;

    public TimeoutGuard(long timeoutMillis) {
        if (timeoutMillis <= 0) throw new IllegalArgumentException("timeoutMillis must be positive");
        this.timeoutMillis = timeoutMillis;
    }

    public static TimeoutGuard ofSeconds(long seconds) {
        return new TimeoutGuard(TimeUnit.SECONDS.toMillis(seconds));
    }

    public long timeoutMillis() { return timeoutMillis; }

    /**
     * @return the task's result, or empty when the deadline passed
     * @throws RuntimeException whatever unchecked exception the task threw
     */
    public <T> Optional<T> run(Callable<T> task) {
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "rmq-benchmark-worker");
            t.setDaemon(true);
            return t;
        });
        Future<T> future = executor.submit(task);
        try {
            return Optional.ofNullable(future.get(timeoutMillis, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            return Optional.empty();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException("Benchmark task failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new IllegalStateException("Interrupted while waiting for benchmark task", e);
        } finally {
            executor.shutdownNow();
        }
    }
}
