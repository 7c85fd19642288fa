package com.amcrest2mqtt.device;

/** Reachability check against the device host. */
@FunctionalInterface
public interface HostProbe {
    boolean isReachable();
}
