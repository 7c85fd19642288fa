package com.amcrest2mqtt.device;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class CapabilitiesTest {
    @Test
    public void ad110() {
        Capabilities capabilities = Capabilities.forDeviceType("AD110");
        assertTrue(capabilities.isRecognisedModel());
        assertTrue(capabilities.isDoorbell());
        assertFalse(capabilities.supportsHuman());
        assertEquals("ProfileAlarmTransmit", capabilities.motionEventCode());
    }

    @Test
    public void ad410() {
        Capabilities capabilities = Capabilities.forDeviceType(" ad410 ");
        assertEquals(DeviceFamily.AD410, capabilities.family());
        assertTrue(capabilities.isDoorbell());
        assertTrue(capabilities.supportsHuman());
        assertEquals("VideoMotion", capabilities.motionEventCode());
    }

    @Test
    public void unknownDeviceTypeIsFlagged() {
        Capabilities capabilities = Capabilities.forDeviceType("IP4M-1041B");
        assertFalse(capabilities.isRecognisedModel());
        assertFalse(capabilities.isDoorbell());
        assertFalse(capabilities.supportsHuman());
        assertEquals("VideoMotion", capabilities.motionEventCode());
        assertEquals(DeviceFamily.UNRECOGNISED, Capabilities.forDeviceType("UNRECOGNISED").family());
    }
}
