package com.amcrest2mqtt.core;

/** Process exit seam. Production implementation is {@link SystemProcessTerminator}. */
public interface ProcessTerminator {
    /** Orderly JVM exit, shutdown hooks run */
    void exit(int status);

    /** Immediate exit, no shutdown hooks, no further I/O */
    void halt(int status);
}
