package com.amcrest2mqtt.device;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;

/** Feature flags derived from the device type. Immutable. */
public final class Capabilities {
    final DeviceFamily family;

    private Capabilities(DeviceFamily family) {
        this.family = family;
    }

    public static Capabilities forDeviceType(String deviceType) {
        return new Capabilities(DeviceFamily.fromDeviceType(checkNotNull(deviceType)));
    }

    public DeviceFamily family() {
        return family;
    }

    public boolean isRecognisedModel() {
        return family != DeviceFamily.UNRECOGNISED;
    }

    public boolean isDoorbell() {
        return family.doorbell;
    }

    public boolean supportsHuman() {
        return family.humanDetection;
    }

    public String motionEventCode() {
        return family.motionEventCode;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("family", family)
                .add("doorbell", isDoorbell())
                .add("human", supportsHuman())
                .add("motionEventCode", motionEventCode())
                .toString();
    }
}
