package com.amcrest2mqtt.telemetry;

public class SystemMonotonicClock implements MonotonicClock {
    @Override
    public long nanoTime() {
        return System.nanoTime();
    }
}
