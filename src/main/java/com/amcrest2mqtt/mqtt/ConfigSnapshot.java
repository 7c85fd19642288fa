package com.amcrest2mqtt.mqtt;

import com.amcrest2mqtt.device.DeviceIdentity;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/** Payload of the retained {@code config} topic, published once per connection. */
@Value.Immutable
@JsonSerialize(as = ImmutableConfigSnapshot.class)
@JsonPropertyOrder({"version", "device_type", "device_name", "sw_version", "serial_number", "host"})
public interface ConfigSnapshot {
    @JsonProperty("version")
    String version();

    @JsonProperty("device_type")
    String deviceType();

    @JsonProperty("device_name")
    String deviceName();

    @JsonProperty("sw_version")
    String softwareVersion();

    @JsonProperty("serial_number")
    String serialNumber();

    @JsonProperty("host")
    String host();

    static ConfigSnapshot of(String version, DeviceIdentity identity) {
        return ImmutableConfigSnapshot.builder()
                .version(version)
                .deviceType(identity.deviceType())
                .deviceName(identity.displayName())
                .softwareVersion(identity.softwareVersion())
                .serialNumber(identity.serialNumber())
                .host(identity.host())
                .build();
    }
}
