package com.amcrest2mqtt.device;

import java.util.Locale;

/**
 * Known device models. Motion is reported with a different event code depending on the model line, and there
 * is no capability query that tells which one, so it's a fixed table.
 */
public enum DeviceFamily {
    /** Video doorbell, reports motion as ProfileAlarmTransmit */
    AD110("ProfileAlarmTransmit", true, false),
    /** Video doorbell with human detection */
    AD410("VideoMotion", true, true),
    /** Not in the table. Handled as a plain IP camera */
    UNRECOGNISED("VideoMotion", false, false);

    final String motionEventCode;
    final boolean doorbell;
    final boolean humanDetection;

    DeviceFamily(String motionEventCode, boolean doorbell, boolean humanDetection) {
        this.motionEventCode = motionEventCode;
        this.doorbell = doorbell;
        this.humanDetection = humanDetection;
    }

    public static DeviceFamily fromDeviceType(String deviceType) {
        String normalized = deviceType.trim().toUpperCase(Locale.ROOT);
        for (DeviceFamily family : values()) {
            if (family != UNRECOGNISED && family.name().equals(normalized)) {
                return family;
            }
        }
        return UNRECOGNISED;
    }
}
