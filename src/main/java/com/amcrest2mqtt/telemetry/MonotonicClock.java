package com.amcrest2mqtt.telemetry;

/** Source of monotonic time for deadlines. */
@FunctionalInterface
public interface MonotonicClock {
    long nanoTime();
}
