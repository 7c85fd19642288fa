package com.amcrest2mqtt.core;

/** Receives conditions the bridge can't recover from. Implementations terminate the process. */
@FunctionalInterface
public interface FatalErrorHandler {
    /**
     * @param exitCode non-zero status of the triggering failure
     * @param reason human readable cause, logged and journaled
     */
    void fatal(int exitCode, String reason);
}
