package com.amcrest2mqtt.telemetry;

/** Handle of an armed timer. */
@FunctionalInterface
public interface Cancellable {
    /** Prevents the task from running if it hasn't started yet. Has no effect on a running task */
    void cancel();
}
