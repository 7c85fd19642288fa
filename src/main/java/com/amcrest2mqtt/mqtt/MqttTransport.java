package com.amcrest2mqtt.mqtt;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.amcrest2mqtt.core.BridgeEventNotifier;
import com.amcrest2mqtt.core.BridgeEventType;
import com.amcrest2mqtt.core.FatalErrorHandler;
import com.amcrest2mqtt.topics.Topics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.google.common.base.Charsets;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the bus connection of one device.
 * <pre>
 * DISCONNECTED -> CONNECTING -> CONNECTED -> CLOSING -> DISCONNECTED (terminal)
 * </pre>
 * Every message is retained and sent with the same QoS. {@link #publish} blocks until the broker acknowledged
 * it; calls from different threads are serialized one call at a time. A failed publish is fatal unless the
 * caller opts out, and the connection dropping without a local disconnect is always fatal. Escalation goes to
 * the {@link FatalErrorHandler} once, after the connection lock has been released, because handling it
 * closes this transport.
 */
public class MqttTransport {
    final static Logger LOGGER = LoggerFactory.getLogger(MqttTransport.class);
    static final String MQTT_TRANSPORT = "MqttTransport";

    public static final String ONLINE = "online";
    public static final String OFFLINE = "offline";

    static final ObjectMapper MAPPER = new ObjectMapper().registerModule(new GuavaModule());

    final BusClient client;
    final Topics topics;
    final int qos;
    final FatalErrorHandler fatalErrorHandler;
    final BridgeEventNotifier eventNotifier;
    final String deviceName;

    final ReentrantLock lock = new ReentrantLock();
    final AtomicBoolean escalated = new AtomicBoolean(false);
    volatile ConnectionState state = ConnectionState.DISCONNECTED;
    volatile boolean terminated = false;

    public MqttTransport(BusClient client, Topics topics, int qos, FatalErrorHandler fatalErrorHandler,
                         BridgeEventNotifier eventNotifier, String deviceName) {
        checkArgument(qos >= 0 && qos <= 2, "QoS must be 0, 1 or 2");
        this.client = checkNotNull(client);
        this.topics = checkNotNull(topics);
        this.qos = qos;
        this.fatalErrorHandler = checkNotNull(fatalErrorHandler);
        this.eventNotifier = checkNotNull(eventNotifier);
        this.deviceName = checkNotNull(deviceName);
    }

    public ConnectionState state() {
        return state;
    }

    /**
     * Registers the last will, connects, then announces {@code online} and publishes the config snapshot.
     *
     * @throws BusException if the broker can't be reached or the announcements fail
     */
    public void connect(ConfigSnapshot snapshot) throws BusException {
        lock.lock();
        try {
            checkState(state == ConnectionState.DISCONNECTED && !terminated, "Can't connect in state %s", state);
            state = ConnectionState.CONNECTING;

            client.setLastWill(topics.status(), OFFLINE.getBytes(Charsets.UTF_8), qos, true);
            client.setDisconnectListener(this::onConnectionLost);
            try {
                client.connect();
            } catch (BusException e) {
                state = ConnectionState.DISCONNECTED;
                throw e;
            }
            state = ConnectionState.CONNECTED;
            LOGGER.info("Connected to MQTT broker");

            send(BusMessage.of(topics.status(), ONLINE, qos));
            send(ImmutableBusMessage.builder()
                    .topic(topics.config())
                    .payload(toJson(snapshot))
                    .qos(qos)
                    .build());
        } finally {
            lock.unlock();
        }

        eventNotifier.notifyEvent(MQTT_TRANSPORT, BridgeEventType.MQTT_CONNECTED, deviceName,
                "Connected to MQTT broker", String.format("Status topic %s", topics.status()));
    }

    /** Publishes a retained message; failure is fatal. */
    public boolean publish(String topic, String payload) {
        return publish(BusMessage.of(topic, payload, qos), true);
    }

    /** Publishes a value serialized to JSON; failure is fatal. */
    public boolean publishJson(String topic, Object value) {
        return publish(ImmutableBusMessage.builder()
                .topic(topic)
                .payload(toJson(value))
                .qos(qos)
                .build(), true);
    }

    /**
     * @param escalateOnFailure when false a failure is only logged
     * @return true once the broker acknowledged the message
     */
    public boolean publish(BusMessage message, boolean escalateOnFailure) {
        checkArgument(message.qos() == qos, "Message QoS %s differs from transport QoS %s", message.qos(), qos);
        @Nullable BusException failure = null;

        lock.lock();
        try {
            if (state != ConnectionState.CONNECTED) {
                LOGGER.debug("Dropping message to {}, connection is {}", message.topic(), state);
                return false;
            }
            try {
                send(message);
                return true;
            } catch (BusException e) {
                failure = e;
            }
        } finally {
            lock.unlock();
        }

        LOGGER.error("Error publishing MQTT message to {}: {}", message.topic(), failure.getMessage());
        eventNotifier.notifyEvent(MQTT_TRANSPORT, BridgeEventType.MQTT_PUBLISH_FAILED, deviceName,
                "MQTT publish failed", String.format("Topic %s, reason code %d: %s",
                        message.topic(), failure.getReasonCode(), failure.getMessage()));
        if (escalateOnFailure) {
            escalate(failure.getReasonCode(), "MQTT publish failed: " + failure.getMessage());
        }
        return false;
    }

    void send(BusMessage message) throws BusException {
        client.publish(message.topic(), message.payload(), message.qos(), message.retain());
        LOGGER.trace("Published {} -> {}", message.topic(), message.payloadAsString());
    }

    void onConnectionLost(int reasonCode, Throwable cause) {
        lock.lock();
        try {
            if (state == ConnectionState.CLOSING || terminated) {
                LOGGER.debug("Connection closed during shutdown: {}", cause.getMessage());
                return;
            }
            state = ConnectionState.DISCONNECTED;
        } finally {
            lock.unlock();
        }

        LOGGER.error("Unexpected MQTT disconnection, reason code {}", reasonCode, cause);
        eventNotifier.notifyEvent(MQTT_TRANSPORT, BridgeEventType.MQTT_CONNECTION_LOST, deviceName,
                "Unexpected MQTT disconnection", String.format("Reason code %d: %s", reasonCode, cause.getMessage()));
        escalate(reasonCode, "Unexpected MQTT disconnection");
    }

    void escalate(int reasonCode, String reason) {
        if (escalated.compareAndSet(false, true)) {
            fatalErrorHandler.fatal(reasonCode == 0 ? 1 : reasonCode, reason);
        } else {
            LOGGER.debug("Already escalated, ignoring: {}", reason);
        }
    }

    /**
     * Announces {@code offline} if still connected (best effort) and disconnects. The transport can't be
     * reused afterwards.
     */
    public void close() {
        lock.lock();
        try {
            if (terminated) {
                return;
            }
            boolean wasConnected = state == ConnectionState.CONNECTED && client.isConnected();
            state = ConnectionState.CLOSING;

            if (wasConnected) {
                try {
                    send(BusMessage.of(topics.status(), OFFLINE, qos));
                } catch (BusException e) {
                    LOGGER.warn("Could not announce offline status: {}", e.getMessage());
                }
            }
            try {
                client.disconnect();
            } catch (BusException e) {
                LOGGER.warn("MQTT disconnect failed: {}", e.getMessage());
            }
        } finally {
            state = ConnectionState.DISCONNECTED;
            terminated = true;
            lock.unlock();
        }
        LOGGER.info("MQTT connection closed");
    }

    static byte[] toJson(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Can't serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
