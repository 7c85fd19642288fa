package com.amcrest2mqtt;

import com.amcrest2mqtt.config.Config;
import com.amcrest2mqtt.core.BridgeEventNotifier;
import com.amcrest2mqtt.core.BridgeEventType;
import com.amcrest2mqtt.core.DatedFileBridgeEventNotifier;
import com.amcrest2mqtt.core.LogBridgeEventNotifier;
import com.amcrest2mqtt.core.ShutdownCoordinator;
import com.amcrest2mqtt.device.AmcrestDevice;
import com.amcrest2mqtt.device.AmcrestException;
import com.amcrest2mqtt.device.Capabilities;
import com.amcrest2mqtt.device.DeviceEventStream;
import com.amcrest2mqtt.device.DeviceIdentity;
import com.amcrest2mqtt.device.ImmutableDeviceIdentity;
import com.amcrest2mqtt.discovery.DiscoveryDescriptors;
import com.amcrest2mqtt.discovery.DiscoveryPublisher;
import com.amcrest2mqtt.events.EventMapper;
import com.amcrest2mqtt.events.EventTranslator;
import com.amcrest2mqtt.mqtt.BusException;
import com.amcrest2mqtt.mqtt.ConfigSnapshot;
import com.amcrest2mqtt.mqtt.MqttTransport;
import com.amcrest2mqtt.telemetry.LivenessProbeTask;
import com.amcrest2mqtt.telemetry.StorageSensorsTask;
import com.amcrest2mqtt.telemetry.TelemetryScheduler;
import com.amcrest2mqtt.topics.TopicNamespace;
import com.amcrest2mqtt.topics.Topics;
import com.google.common.base.Charsets;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;
import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.time.Duration;
import java.util.Properties;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class BridgeService {
    final static Logger LOGGER = LoggerFactory.getLogger(BridgeService.class);

    public static final String AMCREST2MQTT = "amcrest2mqtt";
    static final String VERSION_RESOURCE = "amcrest2mqtt-version.properties";
    static final String ALL_EVENTS = "All";
    static final int STARTUP_FAILED_EXIT_CODE = 1;

    public static void run(Config config) throws InterruptedException {
        run(config, new SystemBridgeComponents());
    }

    static void run(Config config, BridgeComponents components) throws InterruptedException {
        BridgeEventNotifier eventNotifier = Strings.isNullOrEmpty(config.eventLogFolder())
                ? new LogBridgeEventNotifier()
                : new DatedFileBridgeEventNotifier(new File(config.eventLogFolder()));

        String version = loadVersion();
        String eventTitleStarting = String.format("Starting AMCREST2MQTT %s.", version);
        eventNotifier.notifyEvent(AMCREST2MQTT, BridgeEventType.BRIDGE_PROCESS, null,
                eventTitleStarting, eventTitleStarting);

        ShutdownCoordinator coordinator = new ShutdownCoordinator(components.terminator(), eventNotifier);
        components.installSignalHandlers(coordinator);

        Config.Amcrest amcrest = config.amcrest();
        Duration requestTimeout = Duration.ofSeconds(amcrest.requestTimeoutSeconds());
        AmcrestDevice camera = components.camera(amcrest, requestTimeout);

        LOGGER.info("Fetching camera details...");
        DeviceIdentity identity;
        try {
            identity = resolveIdentity(camera, amcrest.deviceName());
        } catch (AmcrestException | IllegalStateException e) {
            if (!coordinator.isShuttingDown()) {
                coordinator.fatal(STARTUP_FAILED_EXIT_CODE, "Could not fetch camera details: " + e.getMessage());
            }
            return;
        }
        if (coordinator.isShuttingDown()) {
            LOGGER.info("Shutdown requested during startup");
            return;
        }
        String deviceName = identity.displayName();
        LOGGER.info("Device type: {}", identity.deviceType());
        LOGGER.info("Serial number: {}", identity.serialNumber());
        LOGGER.info("Software version: {}", identity.softwareVersion());
        LOGGER.info("Device name: {}", deviceName);
        eventNotifier.notifyEvent(AMCREST2MQTT, BridgeEventType.DEVICE_RESOLVED, deviceName,
                "Device resolved", identity.toString());

        Capabilities capabilities = Capabilities.forDeviceType(identity.deviceType());
        if (!capabilities.isRecognisedModel()) {
            LOGGER.warn("Unsupported model {}: using {} for motion, no doorbell or human sensors",
                    identity.deviceType(), capabilities.motionEventCode());
            eventNotifier.notifyEvent(AMCREST2MQTT, BridgeEventType.UNSUPPORTED_MODEL, deviceName,
                    "Unsupported model", String.format("Device type [%s] is not a known model", identity.deviceType()));
        }

        Topics topics = TopicNamespace.forDevice(identity, config.homeAssistant().prefix());
        Config.Mqtt mqtt = config.mqtt();
        String clientId = Strings.isNullOrEmpty(mqtt.clientId())
                ? String.format("%s_%s", AMCREST2MQTT, identity.serialNumber())
                : mqtt.clientId();
        MqttTransport transport = new MqttTransport(components.busClient(mqtt, clientId), topics, mqtt.qos(),
                coordinator, eventNotifier, deviceName);

        Duration storageInterval = Duration.ofSeconds(config.storagePollIntervalSeconds());
        TelemetryScheduler telemetry = new TelemetryScheduler(
                components.telemetryScheduler(),
                components.clock(),
                ImmutableList.of(
                        new StorageSensorsTask(storageInterval, camera, transport, topics, eventNotifier, deviceName),
                        new LivenessProbeTask(Duration.ofSeconds(config.livenessProbeIntervalSeconds()),
                                components.hostProbe(amcrest, requestTimeout),
                                coordinator, eventNotifier, deviceName, amcrest.host())));
        DeviceEventStream events = camera.streamEvents(ALL_EVENTS, amcrest.eventStreamRetries(), requestTimeout);

        coordinator.addShutdownAction("Stop telemetry", telemetry::stop);
        coordinator.addShutdownAction("Close event stream", events::close);
        coordinator.addShutdownAction("Close MQTT connection", transport::close);

        // A request that started before the actions were registered hasn't seen them
        if (coordinator.isShuttingDown()) {
            LOGGER.info("Shutdown requested during startup");
            telemetry.stop();
            return;
        }

        try {
            transport.connect(ConfigSnapshot.of(version, identity));
        } catch (BusException | IllegalStateException e) {
            if (!coordinator.isShuttingDown()) {
                coordinator.fatal(STARTUP_FAILED_EXIT_CODE, e.getMessage());
            }
            coordinator.awaitShutdown();
            return;
        }

        if (config.homeAssistant().enabled()) {
            DiscoveryDescriptors descriptors = new DiscoveryDescriptors(identity, capabilities, topics,
                    mqtt.qos(), !storageInterval.isZero());
            if (!new DiscoveryPublisher(descriptors, topics, transport).publish()) {
                coordinator.awaitShutdown();
                return;
            }
        } else {
            LOGGER.info("Home Assistant discovery disabled");
        }

        telemetry.start();

        String eventTitleStarted = "AMCREST2MQTT started.";
        eventNotifier.notifyEvent(AMCREST2MQTT, BridgeEventType.BRIDGE_PROCESS, deviceName,
                eventTitleStarted, String.format("%s Topics: %s", eventTitleStarted, topics));

        // This will block
        new EventTranslator(new EventMapper(capabilities), transport, topics, coordinator, eventNotifier, deviceName)
                .run(events);

        if (!coordinator.isShuttingDown()) {
            coordinator.requestShutdown(STARTUP_FAILED_EXIT_CODE, "Event loop stopped");
        }
        coordinator.awaitShutdown();
    }

    static DeviceIdentity resolveIdentity(AmcrestDevice camera, @Nullable String deviceNameOverride) throws AmcrestException {
        String displayName = Strings.isNullOrEmpty(deviceNameOverride) ? camera.getDisplayName() : deviceNameOverride;
        return ImmutableDeviceIdentity.builder()
                .deviceType(camera.getDeviceType())
                .serialNumber(camera.getSerialNumber())
                .softwareVersion(camera.getSoftwareVersion())
                .displayName(displayName)
                .host(camera.getHost())
                .build();
    }

    static String loadVersion() {
        try {
            Properties properties = new Properties();
            properties.load(new StringReader(
                    Resources.toString(Resources.getResource(VERSION_RESOURCE), Charsets.UTF_8)));
            return properties.getProperty("version", "unknown");
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.warn("Can't read {}: {}", VERSION_RESOURCE, e.getMessage());
            return "unknown";
        }
    }
}
