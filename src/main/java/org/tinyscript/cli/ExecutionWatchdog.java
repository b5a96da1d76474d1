package org.tinyscript.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs an evaluation on a daemon worker thread and gives up waiting after a wall-clock limit.
 * <p>
 * The interpreter has no cancellation points, so a timed-out evaluation is abandoned rather
 * than stopped: its thread keeps running until it finishes or the JVM exits. Anything the
 * abandoned evaluation can still reach (such as its environment) must not be reused.
 */
public class ExecutionWatchdog {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutionWatchdog.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final Duration timeout;

    /**
     * @param timeout The wall-clock limit; zero or negative runs the task on the calling thread without a limit.
     */
    public ExecutionWatchdog(Duration timeout) {
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Runs a task and waits for its result.
     * @param task The evaluation to run.
     * @param <T> The result type.
     * @return The task's result.
     * @throws TimeoutException if the task did not finish in time.
     * @throws InterruptedException if the calling thread was interrupted while waiting.
     */
    public <T> T run(Supplier<T> task) throws TimeoutException, InterruptedException {
        if (timeout.isZero() || timeout.isNegative()) {
            return task.get();
        }

        ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "tinyscript-eval-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        try {
            Future<T> future = executor.submit(task::get);
            try {
                return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                LOG.warn("Evaluation exceeded {} ms and was abandoned", timeout.toMillis());
                throw e;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException runtimeException) {
                    throw runtimeException;
                }
                if (cause instanceof Error error) {
                    throw error;
                }
                throw new IllegalStateException("Evaluation failed", cause);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
