package com.amcrest2mqtt.telemetry;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs each {@link TelemetryTask} on its own single-shot timer. A task is re-armed for {@code now + interval}
 * only after its tick returned, so a task never overlaps with its own next run. {@link #stop()} cancels every
 * pending timer; a tick already running completes but isn't re-armed.
 */
public class TelemetryScheduler {
    final static Logger LOGGER = LoggerFactory.getLogger(TelemetryScheduler.class);

    final TaskScheduler scheduler;
    final MonotonicClock clock;
    final ImmutableList<TelemetryTask> tasks;

    final Map<TelemetryTask, Cancellable> armed = new HashMap<>();
    boolean started = false;
    boolean stopped = false;

    public TelemetryScheduler(TaskScheduler scheduler, MonotonicClock clock, List<TelemetryTask> tasks) {
        this.scheduler = checkNotNull(scheduler);
        this.clock = checkNotNull(clock);
        this.tasks = ImmutableList.copyOf(tasks);
    }

    public synchronized void start() {
        checkState(!started, "Telemetry already started");
        started = true;
        for (TelemetryTask task : tasks) {
            if (!task.isEnabled()) {
                LOGGER.info("{} disabled", task.name());
                continue;
            }
            LOGGER.info("Starting {}", task);
            arm(task, task.runAtStart() ? Duration.ZERO : task.interval());
        }
    }

    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        for (Cancellable cancellable : armed.values()) {
            cancellable.cancel();
        }
        armed.clear();
        scheduler.shutdown();
    }

    public synchronized boolean isArmed(TelemetryTask task) {
        return armed.containsKey(task);
    }

    synchronized void arm(TelemetryTask task, Duration delay) {
        if (stopped) {
            return;
        }
        task.nextDeadlineNanos = clock.nanoTime() + delay.toNanos();
        armed.put(task, scheduler.schedule(() -> runAndRearm(task), delay));
    }

    void runAndRearm(TelemetryTask task) {
        synchronized (this) {
            if (stopped) {
                return;
            }
            armed.remove(task);
        }

        TaskOutcome outcome;
        try {
            outcome = task.tick();
        } catch (RuntimeException e) {
            LOGGER.error("{} failed", task.name(), e);
            outcome = TaskOutcome.FAILURE;
        }
        task.lastOutcome = outcome;

        arm(task, task.interval());
    }
}
