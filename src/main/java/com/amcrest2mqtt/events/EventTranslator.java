package com.amcrest2mqtt.events;

import static com.google.common.base.Preconditions.checkNotNull;

import com.amcrest2mqtt.core.BridgeEventNotifier;
import com.amcrest2mqtt.core.BridgeEventType;
import com.amcrest2mqtt.core.ShutdownCoordinator;
import com.amcrest2mqtt.device.AmcrestException;
import com.amcrest2mqtt.device.DeviceEvent;
import com.amcrest2mqtt.device.DeviceEventStream;
import com.amcrest2mqtt.mqtt.MqttTransport;
import com.amcrest2mqtt.topics.Channel;
import com.amcrest2mqtt.topics.Topics;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main loop of the bridge: publishes mapped sensor states and passes every event through to the {@code event}
 * channel. Returns only on shutdown; a stream that gave up is fatal.
 */
public class EventTranslator {
    final static Logger LOGGER = LoggerFactory.getLogger(EventTranslator.class);
    static final String EVENT_TRANSLATOR = "EventTranslator";
    static final int STREAM_FAILED_EXIT_CODE = 1;

    final EventMapper mapper;
    final MqttTransport transport;
    final Topics topics;
    final ShutdownCoordinator coordinator;
    final BridgeEventNotifier eventNotifier;
    final String deviceName;

    public EventTranslator(EventMapper mapper, MqttTransport transport, Topics topics,
                           ShutdownCoordinator coordinator, BridgeEventNotifier eventNotifier, String deviceName) {
        this.mapper = checkNotNull(mapper);
        this.transport = checkNotNull(transport);
        this.topics = checkNotNull(topics);
        this.coordinator = checkNotNull(coordinator);
        this.eventNotifier = checkNotNull(eventNotifier);
        this.deviceName = checkNotNull(deviceName);
    }

    public void run(DeviceEventStream stream) {
        LOGGER.info("Listening for events...");
        while (!coordinator.isShuttingDown()) {
            DeviceEvent event;
            try {
                event = stream.take();
            } catch (AmcrestException e) {
                if (coordinator.isShuttingDown()) {
                    break;
                }
                LOGGER.error("Amcrest error: {}", e.getMessage(), e);
                eventNotifier.notifyEvent(EVENT_TRANSLATOR, BridgeEventType.EVENT_STREAM_FAILED, deviceName,
                        "Event stream failed", e.getMessage());
                coordinator.fatal(STREAM_FAILED_EXIT_CODE, "Event stream failed: " + e.getMessage());
                break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.info("Interrupted while waiting for events");
                break;
            }
            handle(event);
        }
        LOGGER.info("Stopped listening for events");
    }

    void handle(DeviceEvent event) {
        Optional<SensorUpdate> update = mapper.map(event);
        if (update.isPresent()) {
            transport.publish(topics.channel(update.get().channel()), update.get().payload());
        }
        transport.publishJson(topics.channel(Channel.EVENT), event.payload());
        LOGGER.info("Event {}: {}", event.code(), event.payload());
    }
}
