package com.amcrest2mqtt.topics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.amcrest2mqtt.device.DeviceIdentity;
import com.amcrest2mqtt.device.ImmutableDeviceIdentity;
import com.google.common.collect.Sets;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class TopicNamespaceTest {
    static DeviceIdentity identity(String serialNumber, String displayName) {
        return ImmutableDeviceIdentity.builder()
                .deviceType("AD410")
                .serialNumber(serialNumber)
                .softwareVersion("1.0")
                .displayName(displayName)
                .host("10.0.0.2")
                .build();
    }

    @Test
    public void channelTopicsAreKeyedBySerialNumber() {
        Topics topics = TopicNamespace.forDevice(identity("ABC123", "Front Door"), "homeassistant");

        assertEquals("amcrest2mqtt/ABC123/status", topics.status());
        assertEquals("amcrest2mqtt/ABC123/config", topics.config());
        assertEquals("amcrest2mqtt/ABC123/event", topics.channel(Channel.EVENT));
        assertEquals("amcrest2mqtt/ABC123/motion", topics.channel(Channel.MOTION));
        assertEquals("amcrest2mqtt/ABC123/storage/used_percent", topics.channel(Channel.STORAGE_USED_PERCENT));
        assertEquals("amcrest2mqtt/ABC123/storage/total", topics.channel(Channel.STORAGE_TOTAL));
    }

    @Test
    public void discoveryTopicsHaveCurrentAndLegacyForms() {
        Topics topics = TopicNamespace.forDevice(identity("ABC123", "Front Door"), "ha");

        assertEquals("ha/binary_sensor/amcrest2mqtt-ABC123/motion/config", topics.discovery(DiscoveryEntity.MOTION));
        assertEquals("ha/binary_sensor/amcrest2mqtt-ABC123/front_door_motion/config",
                topics.legacyDiscovery(DiscoveryEntity.MOTION));
        assertEquals("ha/sensor/amcrest2mqtt-ABC123/storage_used/config",
                topics.discovery(DiscoveryEntity.STORAGE_USED));
        assertEquals("ha/sensor/amcrest2mqtt-ABC123/front_door_serial_number/config",
                topics.legacyDiscovery(DiscoveryEntity.SERIAL_NUMBER));
    }

    @Test
    public void devicesWithDifferentSerialNumbersNeverShareTopics() {
        Set<String> first = TopicNamespace.forDevice(identity("ABC123", "Front Door"), "homeassistant").all();
        Set<String> second = TopicNamespace.forDevice(identity("ABC124", "Front Door"), "homeassistant").all();

        assertEquals(Channel.values().length + 2 * DiscoveryEntity.values().length, first.size());
        assertTrue(Sets.intersection(first, second).isEmpty());
    }

    @Test
    public void emptyPrefixIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> TopicNamespace.forDevice(identity("ABC123", "Front Door"), " "));
    }
}
