package com.amcrest2mqtt.device;

import java.time.Duration;

/** Device-protocol client consumed by the bridge. */
public interface AmcrestDevice {
    String getDeviceType() throws AmcrestException;

    String getSerialNumber() throws AmcrestException;

    String getSoftwareVersion() throws AmcrestException;

    /** Machine name configured on the device */
    String getDisplayName() throws AmcrestException;

    String getHost();

    /** @throws AmcrestException on any I/O or response error; callers treat it as transient */
    StorageStats getStorageStats() throws AmcrestException;

    /**
     * Opens the event stream for the given channel ("All" for every event code).
     *
     * @param retries consecutive failed (re)connect attempts tolerated before the stream fails for good
     * @param timeout connect timeout for each attempt
     */
    DeviceEventStream streamEvents(String channel, int retries, Duration timeout);
}
