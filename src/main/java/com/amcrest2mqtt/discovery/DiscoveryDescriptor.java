package com.amcrest2mqtt.discovery;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import javax.annotation.Nullable;
import org.immutables.value.Value;

/** Home Assistant MQTT discovery payload of one entity. Absent fields are left out of the JSON. */
@Value.Immutable
@JsonSerialize(as = ImmutableDiscoveryDescriptor.class)
@JsonDeserialize(as = ImmutableDiscoveryDescriptor.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"availability_topic", "qos", "device", "state_topic", "value_template", "payload_on",
        "payload_off", "device_class", "unit_of_measurement", "icon", "name", "unique_id", "entity_category",
        "enabled_by_default"})
public interface DiscoveryDescriptor {
    @Value.Immutable
    @JsonSerialize(as = ImmutableDeviceInfo.class)
    @JsonDeserialize(as = ImmutableDeviceInfo.class)
    @JsonPropertyOrder({"name", "manufacturer", "model", "identifiers", "sw_version", "via_device"})
    interface DeviceInfo {
        @JsonProperty("name")
        String name();

        @Value.Default
        @JsonProperty("manufacturer")
        default String manufacturer() { return "Amcrest"; }

        @JsonProperty("model")
        String model();

        @JsonProperty("identifiers")
        String identifiers();

        @JsonProperty("sw_version")
        String softwareVersion();

        @Value.Default
        @JsonProperty("via_device")
        default String viaDevice() { return "amcrest2mqtt"; }
    }

    @JsonProperty("availability_topic")
    String availabilityTopic();

    @JsonProperty("qos")
    int qos();

    @JsonProperty("device")
    DeviceInfo device();

    @JsonProperty("state_topic")
    String stateTopic();

    @JsonProperty("value_template")
    @Nullable
    String valueTemplate();

    @JsonProperty("payload_on")
    @Nullable
    String payloadOn();

    @JsonProperty("payload_off")
    @Nullable
    String payloadOff();

    @JsonProperty("device_class")
    @Nullable
    String deviceClass();

    @JsonProperty("unit_of_measurement")
    @Nullable
    String unitOfMeasurement();

    @JsonProperty("icon")
    @Nullable
    String icon();

    @JsonProperty("name")
    String name();

    @JsonProperty("unique_id")
    String uniqueId();

    @JsonProperty("entity_category")
    @Nullable
    String entityCategory();

    @JsonProperty("enabled_by_default")
    @Nullable
    Boolean enabledByDefault();
}
