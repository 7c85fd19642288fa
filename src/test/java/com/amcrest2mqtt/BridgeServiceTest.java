package com.amcrest2mqtt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.amcrest2mqtt.config.Config;
import com.amcrest2mqtt.config.ConfigLoader;
import com.amcrest2mqtt.device.DeviceIdentity;
import com.amcrest2mqtt.device.FakeAmcrestDevice;
import com.amcrest2mqtt.mqtt.BusException;
import com.amcrest2mqtt.topics.Channel;
import com.amcrest2mqtt.topics.DiscoveryEntity;
import com.amcrest2mqtt.topics.TopicNamespace;
import com.amcrest2mqtt.topics.Topics;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class BridgeServiceTest {
    static final String DISCOVERY_PREFIX = "homeassistant/";

    TestBridgeComponents components;
    Topics topics;

    @BeforeEach
    public void setUp() throws Exception {
        components = new TestBridgeComponents();
        components.camera.withEvent(FakeAmcrestDevice.event("VideoMotion", "Start"));
        topics = TopicNamespace.forDevice(BridgeService.resolveIdentity(components.camera, null), "homeassistant");
    }

    static Config config(boolean homeAssistant) throws Exception {
        return new ConfigLoader(ImmutableMap.of(
                "AMCREST_HOST", "10.0.0.2",
                "AMCREST_PASSWORD", "secret",
                "MQTT_USERNAME", "bridge",
                "HOME_ASSISTANT", Boolean.toString(homeAssistant))).load(null);
    }

    /** Lets telemetry fire once the event stream is drained, then stops the bridge like a SIGINT would */
    void stopAfterEvents() {
        components.camera.afterLastEvent = () -> {
            components.scheduler.runDue();
            components.sendSigint();
        };
    }

    static int firstIndex(List<String> topics, String prefix) {
        for (int i = 0; i < topics.size(); i++) {
            if (topics.get(i).startsWith(prefix)) {
                return i;
            }
        }
        return -1;
    }

    static int lastIndex(List<String> topics, String prefix) {
        for (int i = topics.size() - 1; i >= 0; i--) {
            if (topics.get(i).startsWith(prefix)) {
                return i;
            }
        }
        return -1;
    }

    @Test
    public void startupPublishesInOrder() throws Exception {
        List<Integer> armedTimersAtPublish = new CopyOnWriteArrayList<>();
        components.busClient.beforePublish = () -> armedTimersAtPublish.add(components.scheduler.pending());
        stopAfterEvents();

        BridgeService.run(config(true), components);

        List<String> published = components.busClient.topics();
        assertEquals(topics.status(), published.get(0));
        assertEquals("online", components.busClient.published.get(0).payloadAsString());
        assertEquals(topics.config(), published.get(1));

        int firstDiscovery = firstIndex(published, DISCOVERY_PREFIX);
        int lastDiscovery = lastIndex(published, DISCOVERY_PREFIX);
        int storage = published.indexOf(topics.channel(Channel.STORAGE_USED_PERCENT));
        int motion = published.indexOf(topics.channel(Channel.MOTION));
        assertEquals(2, firstDiscovery);
        assertTrue(lastDiscovery < motion, published.toString());
        assertTrue(lastDiscovery < storage, published.toString());
        assertEquals(motion + 1, published.indexOf(topics.channel(Channel.EVENT)));

        // telemetry isn't armed until discovery went out
        for (int i = 0; i <= lastDiscovery; i++) {
            assertEquals(0, armedTimersAtPublish.get(i).intValue(), "timer armed before " + published.get(i));
        }

        assertEquals(topics.status(), published.get(published.size() - 1));
        assertEquals(ImmutableList.of("online", "offline"), components.busClient.payloadsTo(topics.status()));
        assertEquals(ImmutableList.of(0), components.terminator.exits);
        assertTrue(components.camera.streamClosed);
        assertEquals("amcrest2mqtt_ABC123", components.clientId);
    }

    @Test
    public void discoveryDisabledPublishesNoDescriptors() throws Exception {
        stopAfterEvents();

        BridgeService.run(config(false), components);

        List<String> published = components.busClient.topics();
        assertEquals(-1, firstIndex(published, DISCOVERY_PREFIX), published.toString());
        assertEquals(ImmutableList.of("on"), components.busClient.payloadsTo(topics.channel(Channel.MOTION)));
        assertEquals(ImmutableList.of("25.0"),
                components.busClient.payloadsTo(topics.channel(Channel.STORAGE_USED_PERCENT)));
        assertEquals(ImmutableList.of(0), components.terminator.exits);
    }

    @Test
    public void discoveryFailureNeverStartsTelemetry() throws Exception {
        components.busClient.failingTopic = topics.discovery(DiscoveryEntity.MOTION);
        components.busClient.failureReasonCode = 7;

        BridgeService.run(config(true), components);

        assertEquals(ImmutableList.of(7), components.terminator.exits);
        assertEquals(0, components.scheduler.pending());
        assertTrue(components.scheduler.shutdown);
        assertEquals(0, components.camera.storageCalls);
        assertEquals(1, components.camera.events.size());
        assertTrue(components.camera.streamClosed);
        assertFalse(components.busClient.topics().contains(topics.channel(Channel.EVENT)));
        assertEquals(ImmutableList.of("online", "offline"), components.busClient.payloadsTo(topics.status()));
    }

    @Test
    public void sigintDuringIdentityResolutionExitsCleanly() throws Exception {
        components.camera = new FakeAmcrestDevice() {
            @Override
            public String getSerialNumber() {
                components.sendSigint();
                return super.getSerialNumber();
            }
        };

        BridgeService.run(config(true), components);

        assertEquals(ImmutableList.of(0), components.terminator.exits);
        assertTrue(components.terminator.halts.isEmpty());
        assertFalse(components.busClient.connected);
        assertTrue(components.busClient.attemptedTopics.isEmpty());
        assertEquals(0, components.scheduler.pending());
    }

    @Test
    public void connectFailureExitsWithReasonCode() throws Exception {
        components.busClient.connectFailure = new BusException(5, "Not authorized");

        BridgeService.run(config(true), components);

        assertEquals(ImmutableList.of(5), components.terminator.exits);
        assertTrue(components.busClient.attemptedTopics.isEmpty());
        assertEquals(0, components.camera.storageCalls);
        assertEquals(1, components.busClient.disconnects);
    }

    @Test
    public void resolvesIdentityFromDevice() throws Exception {
        DeviceIdentity identity = BridgeService.resolveIdentity(new FakeAmcrestDevice(), null);

        assertEquals("AD410", identity.deviceType());
        assertEquals("ABC123", identity.serialNumber());
        assertEquals("1.000.0000000.3.R", identity.softwareVersion());
        assertEquals("Front Door", identity.displayName());
        assertEquals("10.0.0.2", identity.host());
    }

    @Test
    public void configuredDeviceNameOverridesMachineName() throws Exception {
        DeviceIdentity identity = BridgeService.resolveIdentity(new FakeAmcrestDevice(), "Garage");

        assertEquals("Garage", identity.displayName());
    }

    @Test
    public void versionComesFromFilteredResource() {
        String version = BridgeService.loadVersion();

        assertFalse(version.isEmpty());
        assertFalse(version.contains("${"), version);
    }
}
