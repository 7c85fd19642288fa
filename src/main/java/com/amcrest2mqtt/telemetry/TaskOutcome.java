package com.amcrest2mqtt.telemetry;

public enum TaskOutcome {
    NOT_RUN,
    SUCCESS,
    FAILURE
}
