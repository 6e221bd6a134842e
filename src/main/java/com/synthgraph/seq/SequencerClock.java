package com.synthgraph.seq;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;
import java.util.function.LongSupplier;

/**
 * Step timing loop.
 *
 * <p>
 * Each step is due at an absolute deadline, the previous deadline plus one
 * step duration, so timing error does not accumulate. While more than the
 * spin threshold remains the loop parks in short slices; inside it the loop
 * busy-waits. A loop that falls more than two steps behind resynchronizes to
 * one step from now instead of firing the missed steps back to back.
 *
 * One clock per run; once cancelled it cannot be restarted.
 */
final class SequencerClock {
    private final LongSupplier stepNanos;
    private final long spinThresholdNanos;
    private final long sleepNanos;
    private final long initialDelayNanos;

    private volatile boolean cancelled;
    private long resyncs;

    SequencerClock(LongSupplier stepNanos, long spinThresholdMicros, long sleepMicros, long initialDelayMillis) {
        this.stepNanos = stepNanos;
        this.spinThresholdNanos = TimeUnit.MICROSECONDS.toNanos(spinThresholdMicros);
        this.sleepNanos = TimeUnit.MICROSECONDS.toNanos(sleepMicros);
        this.initialDelayNanos = TimeUnit.MILLISECONDS.toNanos(initialDelayMillis);
    }

    /** Sixteenth-note duration at the given tempo. */
    static long stepNanos(int bpm) {
        return 15_000_000_000L / bpm;
    }

    /**
     * Deadline of the step after the one due at {@code deadline}, which fired
     * when the clock read {@code now}.
     */
    static long nextDeadline(long deadline, long now, long stepNanos) {
        long next = deadline + stepNanos;
        if (next < now - 2 * stepNanos)
            return now + stepNanos;
        return next;
    }

    /** Runs on the calling thread until {@link #cancel()}. */
    void run(Runnable step) {
        long deadline = System.nanoTime() + initialDelayNanos;
        while (!cancelled) {
            long now = System.nanoTime();
            long wait = deadline - now;
            if (wait > spinThresholdNanos) {
                LockSupport.parkNanos(Math.min(wait, sleepNanos));
                continue;
            }
            if (wait > 0) {
                Thread.onSpinWait();
                continue;
            }
            long duration = stepNanos.getAsLong();
            step.run();
            long next = nextDeadline(deadline, now, duration);
            if (next != deadline + duration)
                resyncs++;
            deadline = next;
        }
    }

    void cancel() {
        cancelled = true;
    }

    boolean isCancelled() {
        return cancelled;
    }

    /** Times the loop gave up on catching up. Read only from the loop thread or after it ended. */
    long resyncs() {
        return resyncs;
    }
}
