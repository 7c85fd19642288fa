package com.amcrest2mqtt.events;

import com.amcrest2mqtt.topics.Channel;
import org.immutables.value.Value;

/** New state of a binary sensor channel. */
@Value.Immutable
public interface SensorUpdate {
    String ON = "on";
    String OFF = "off";

    @Value.Parameter
    Channel channel();

    /** {@link #ON} or {@link #OFF} */
    @Value.Parameter
    String payload();

    static SensorUpdate of(Channel channel, boolean on) {
        return ImmutableSensorUpdate.of(channel, on ? ON : OFF);
    }
}
