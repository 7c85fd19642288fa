package com.amcrest2mqtt.device;

import java.io.Closeable;

/** Blocking source of device events. */
public interface DeviceEventStream extends Closeable {
    /**
     * Blocks until the next event arrives.
     *
     * @throws AmcrestException when the stream can't be (re)established within its retry budget
     */
    DeviceEvent take() throws AmcrestException, InterruptedException;
}
