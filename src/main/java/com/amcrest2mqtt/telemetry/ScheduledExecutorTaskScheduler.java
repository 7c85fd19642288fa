package com.amcrest2mqtt.telemetry;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * {@link TaskScheduler} on a {@link ScheduledThreadPoolExecutor} with daemon threads, one per telemetry task so
 * a slow device query never delays the other timer.
 * <p>
 * {@link #shutdown()} drops pending timers but doesn't interrupt a running task: shutdown may be requested from
 * a telemetry thread, which still has to announce the offline status.
 */
public class ScheduledExecutorTaskScheduler implements TaskScheduler {
    final ScheduledThreadPoolExecutor executor;

    public ScheduledExecutorTaskScheduler(int threads) {
        this.executor = new ScheduledThreadPoolExecutor(threads,
                new ThreadFactoryBuilder()
                        .setNameFormat("telemetry-%d")
                        .setDaemon(true)
                        .build());
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setRemoveOnCancelPolicy(true);
    }

    @Override
    public Cancellable schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = executor.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void shutdown() {
        executor.shutdown();
    }
}
