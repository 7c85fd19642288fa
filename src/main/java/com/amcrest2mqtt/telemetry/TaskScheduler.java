package com.amcrest2mqtt.telemetry;

import java.time.Duration;

/** Single-shot timers. */
public interface TaskScheduler {
    Cancellable schedule(Runnable task, Duration delay);

    /** Cancels pending timers and stops the worker threads */
    void shutdown();
}
