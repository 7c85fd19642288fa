package com.amcrest2mqtt.telemetry;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.time.Duration;

/**
 * Named recurring job run by {@link TelemetryScheduler}. A zero interval disables the task: it is never armed.
 */
public abstract class TelemetryTask {
    final String name;
    final Duration interval;
    final boolean runAtStart;

    volatile TaskOutcome lastOutcome = TaskOutcome.NOT_RUN;
    volatile long nextDeadlineNanos;

    protected TelemetryTask(String name, Duration interval, boolean runAtStart) {
        checkArgument(!interval.isNegative(), "Interval of %s must not be negative", name);
        this.name = checkNotNull(name);
        this.interval = interval;
        this.runAtStart = runAtStart;
    }

    /** Runs one tick. Runtime exceptions count as {@link TaskOutcome#FAILURE}. */
    protected abstract TaskOutcome tick();

    public String name() {
        return name;
    }

    public Duration interval() {
        return interval;
    }

    public boolean isEnabled() {
        return !interval.isZero();
    }

    /** First tick right away instead of one interval after start */
    public boolean runAtStart() {
        return runAtStart;
    }

    public TaskOutcome lastOutcome() {
        return lastOutcome;
    }

    /** {@link MonotonicClock} time of the next armed run */
    public long nextDeadlineNanos() {
        return nextDeadlineNanos;
    }

    @Override
    public String toString() {
        return String.format("%s every %s", name, interval);
    }
}
