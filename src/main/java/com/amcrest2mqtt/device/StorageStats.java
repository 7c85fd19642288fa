package com.amcrest2mqtt.device;

import org.immutables.value.Value;

/** Storage totals summed over all of the device's storage volumes. */
@Value.Immutable
public interface StorageStats {
    long usedBytes();

    long totalBytes();

    /** 0..100, two decimals */
    double usedPercent();
}
