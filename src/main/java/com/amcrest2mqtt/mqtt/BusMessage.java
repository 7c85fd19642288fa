package com.amcrest2mqtt.mqtt;

import com.google.common.base.Charsets;
import org.immutables.value.Value;

/** Outbound message. Built per publish call and dropped afterwards. */
@Value.Immutable
public interface BusMessage {
    String topic();

    byte[] payload();

    int qos();

    @Value.Default
    default boolean retain() { return true; }

    static BusMessage of(String topic, String payload, int qos) {
        return ImmutableBusMessage.builder()
                .topic(topic)
                .payload(payload.getBytes(Charsets.UTF_8))
                .qos(qos)
                .build();
    }

    default String payloadAsString() {
        return new String(payload(), Charsets.UTF_8);
    }
}
