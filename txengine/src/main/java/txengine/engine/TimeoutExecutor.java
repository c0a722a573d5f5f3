package txengine.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import txengine.exceptions.OperationTimeoutException;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs operation callbacks under a deadline.
 *
 * <p>Used by {@link TransactionManager} when
 * {@code txengine.operation.timeout.enforced} is on. A callable that misses its
 * deadline is cancelled with an interrupt and the caller gets an
 * {@link OperationTimeoutException}. Before that exception is thrown the
 * caller waits up to {@link #STOP_GRACE} for the worker to stop, so a rollback
 * that follows does not overlap the timed-out work. Callables that ignore
 * interrupts for longer than that keep running on their worker.
 *
 * @see OperationTimeoutException
 */
public final class TimeoutExecutor {

    private static final Logger log = LoggerFactory.getLogger(TimeoutExecutor.class);

    /** How long a timed-out caller waits for the cancelled worker to stop. */
    static final Duration STOP_GRACE = Duration.ofSeconds(1);

    private static final AtomicInteger WORKER_COUNT = new AtomicInteger();

    private static final ExecutorService WORKERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "txengine-op-" + WORKER_COUNT.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private TimeoutExecutor() {
    }

    /**
     * Returns true if the timeout is positive.
     */
    public static boolean isEnabled(Duration timeout) {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }

    /**
     * Calls {@code callable} on a worker thread and waits at most {@code timeout}.
     * Without a positive timeout the callable runs on the calling thread.
     *
     * @param operation operation name used in log lines and the timeout message
     * @param timeout deadline, or null/zero to run inline
     * @param callable the work
     * @return the callable's result
     * @throws OperationTimeoutException if the deadline passes or the wait is interrupted
     * @throws Exception whatever the callable threw
     */
    public static <T> T call(String operation, Duration timeout, Callable<T> callable) throws Exception {
        if (!isEnabled(timeout)) {
            return callable.call();
        }

        long millis = timeout.toMillis();
        log.debug("Running '{}' with a {} ms deadline", operation, millis);
        AtomicBoolean started = new AtomicBoolean();
        CountDownLatch stopped = new CountDownLatch(1);
        Future<T> future = WORKERS.submit(() -> {
            started.set(true);
            try {
                return callable.call();
            } finally {
                stopped.countDown();
            }
        });
        try {
            return future.get(millis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            // a task cancelled before it started never runs
            if (started.get()) {
                awaitStop(operation, stopped);
            }
            log.warn("'{}' missed its {} ms deadline", operation, millis);
            throw new OperationTimeoutException(operation, timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new OperationTimeoutException(operation, timeout, e);
        } catch (ExecutionException e) {
            throw unwrap(operation, e.getCause());
        }
    }

    private static void awaitStop(String operation, CountDownLatch stopped) {
        try {
            if (!stopped.await(STOP_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("'{}' ignored cancellation and is still running", operation);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static Exception unwrap(String operation, Throwable cause) {
        if (cause instanceof Error error) {
            throw error;
        }
        if (cause instanceof Exception exception) {
            return exception;
        }
        return new IllegalStateException("'" + operation + "' failed", cause);
    }
}
