package io.entryheal.core.strategy;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a blocking collaborator call (legacy bridge, reference check) on an I/O executor and
 * waits for it at most a fixed time. On timeout or interruption the task is cancelled with
 * interruption, so an unreachable peer never pins the calling thread.
 *
 * <p>The bound only holds when the executor runs the task on another thread. An executor that
 * runs it inline (such as {@code Runnable::run}) completes the call inside {@link #start}; this
 * is logged at WARN and {@link #ranInline()} reports it.
 *
 * @param <T> the call's result type
 */
public final class BoundedCall<T> {

    private static final Logger LOG = LoggerFactory.getLogger(BoundedCall.class);

    private final FutureTask<T> task;
    private final boolean ranInline;

    private BoundedCall(FutureTask<T> task, boolean ranInline) {
        this.task = task;
        this.ranInline = ranInline;
    }

    /**
     * Starts a call on the executor.
     *
     * @param executor the I/O executor
     * @param callable the blocking call
     * @return a handle to await
     */
    public static <T> BoundedCall<T> start(Executor executor, Callable<T> callable) {
        Thread caller = Thread.currentThread();
        AtomicBoolean inline = new AtomicBoolean();
        FutureTask<T> task = new FutureTask<>(() -> {
            inline.set(Thread.currentThread() == caller);
            return callable.call();
        });
        executor.execute(task);
        if (inline.get()) {
            LOG.warn("bounded_call.inline executor={} ran the call on the calling thread; timeout not enforced",
                    executor.getClass().getName());
        }
        return new BoundedCall<>(task, inline.get());
    }

    /**
     * Starts a call and waits for it.
     *
     * @throws TimeoutException if the call did not finish within the timeout (it is cancelled)
     * @throws InterruptedException if the waiting thread was interrupted (the call is cancelled)
     * @throws ExecutionException if the call threw; the cause is the thrown exception
     */
    public static <T> T run(Executor executor, Callable<T> callable, Duration timeout)
            throws TimeoutException, InterruptedException, ExecutionException {
        return start(executor, callable).await(System.nanoTime() + timeout.toNanos());
    }

    /**
     * Waits until the given {@link System#nanoTime()} deadline.
     *
     * @throws TimeoutException if the deadline passed first (the call is cancelled)
     * @throws InterruptedException if the waiting thread was interrupted (the call is cancelled)
     * @throws ExecutionException if the call threw
     */
    public T await(long deadlineNanos) throws TimeoutException, InterruptedException, ExecutionException {
        long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
        try {
            return task.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException | InterruptedException e) {
            task.cancel(true);
            throw e;
        }
    }

    /** Whether the executor ran the call on the thread that started it. */
    public boolean ranInline() {
        return ranInline;
    }

    /** Cancels the call if it is still running. */
    public void cancel() {
        task.cancel(true);
    }
}
