package com.amcrest2mqtt.device;

import org.immutables.value.Value;

/** Static descriptor of the bridged device, resolved once at startup. */
@Value.Immutable
public interface DeviceIdentity {
    String deviceType();

    /** Namespace key for every topic of this device */
    String serialNumber();

    String softwareVersion();

    String displayName();

    String host();

    @Value.Check
    default void check() {
        if (serialNumber().isBlank()) {
            throw new IllegalStateException("Device serial number must not be empty");
        }
    }
}
