package io.reviewmind.core.external;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs independent external calls on a bounded pool. Every call gets its own time box,
 * measured from the moment it starts running; a call still running when its box expires
 * is cancelled. Results come back in input order; a failed or timed-out call yields a
 * failed {@link Outcome} instead of aborting the batch.
 */
public final class TimeBoxedCalls implements AutoCloseable {
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final ExecutorService executor;
    private final ScheduledThreadPoolExecutor watchdog;
    private final Duration timeout;

    public TimeBoxedCalls(int parallelism, Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        int pool = POOL_SEQUENCE.incrementAndGet();
        this.executor = Executors.newFixedThreadPool(Math.max(1, parallelism), daemonThreads("reviewmind-calls-" + pool));
        this.watchdog = new ScheduledThreadPoolExecutor(1, daemonThreads("reviewmind-watchdog-" + pool));
        this.watchdog.setRemoveOnCancelPolicy(true);
        this.timeout = timeout;
    }

    public <T, R> List<Outcome<R>> map(List<T> inputs, Function<T, R> call) {
        List<TimedCall<R>> calls = new ArrayList<>(inputs.size());
        for (T input : inputs) {
            TimedCall<R> timed = new TimedCall<>(call, input);
            calls.add(timed);
            executor.execute(timed.task);
        }

        List<Outcome<R>> outcomes = new ArrayList<>(calls.size());
        for (TimedCall<R> timed : calls) {
            outcomes.add(await(timed));
        }
        return outcomes;
    }

    private <R> Outcome<R> await(TimedCall<R> timed) {
        try {
            return Outcome.success(timed.task.get());
        } catch (CancellationException e) {
            return Outcome.failure(new ExternalCallTimeoutException("call exceeded " + timeout.toMillis() + "ms", e));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExternalCallException external) {
                return Outcome.failure(external);
            }
            String message = cause == null ? e.getMessage() : cause.getMessage();
            return Outcome.failure(new ExternalCallException("call failed: " + message, cause == null ? e : cause));
        } catch (InterruptedException e) {
            timed.task.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExternalCallException("interrupted while waiting for external call", e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
        watchdog.shutdownNow();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger thread = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + "-" + thread.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * A call whose watchdog is armed when a worker picks it up.
     */
    private final class TimedCall<R> {
        private final FutureTask<R> task;

        <T> TimedCall(Function<T, R> call, T input) {
            this.task = new FutureTask<>(() -> {
                ScheduledFuture<?> alarm = watchdog.schedule(this::expire, timeout.toNanos(), TimeUnit.NANOSECONDS);
                try {
                    return call.apply(input);
                } finally {
                    alarm.cancel(false);
                }
            });
        }

        private void expire() {
            task.cancel(true);
        }
    }

    public record Outcome<R>(R value, ExternalCallException failure) {

        static <R> Outcome<R> success(R value) {
            return new Outcome<>(value, null);
        }

        static <R> Outcome<R> failure(ExternalCallException failure) {
            return new Outcome<>(null, failure);
        }

        public boolean succeeded() {
            return failure == null;
        }
    }
}
