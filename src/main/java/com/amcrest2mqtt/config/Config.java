package com.amcrest2mqtt.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

import javax.annotation.Nullable;

@Value.Immutable
@JsonSerialize(as = ImmutableConfig.class)
@JsonDeserialize(as = ImmutableConfig.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public interface Config {
    /** Amcrest camera / doorbell connection */
    @Value.Immutable
    @JsonSerialize(as = ImmutableAmcrest.class)
    @JsonDeserialize(as = ImmutableAmcrest.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    interface Amcrest {
        @JsonProperty
        String host();

        @Value.Default
        @JsonProperty
        default int port() { return 80; }

        @Value.Default
        @JsonProperty
        default String username() { return "admin"; }

        @JsonProperty
        String password();

        /** Overrides the machine name reported by the device */
        @JsonProperty
        @Nullable
        String deviceName();

        /** Consecutive failed attempts tolerated by the event stream before giving up */
        @Value.Default
        @JsonProperty
        default int eventStreamRetries() { return 5; }

        /** HTTP connect / request timeout, seconds */
        @Value.Default
        @JsonProperty
        default long requestTimeoutSeconds() { return 10L; }
    }

    /** Key / trust stores for MQTT over TLS. Store type is derived from the file extension. */
    @Value.Immutable
    @JsonSerialize(as = ImmutableTls.class)
    @JsonDeserialize(as = ImmutableTls.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    interface Tls {
        @Value.Default
        @JsonProperty
        default boolean enabled() { return false; }

        @JsonProperty
        @Nullable
        String truststore();

        @JsonProperty
        @Nullable
        String truststorePassword();

        @JsonProperty
        @Nullable
        String keystore();

        @JsonProperty
        @Nullable
        String keystorePassword();
    }

    @Value.Immutable
    @JsonSerialize(as = ImmutableMqtt.class)
    @JsonDeserialize(as = ImmutableMqtt.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    interface Mqtt {
        @Value.Default
        @JsonProperty
        default String host() { return "localhost"; }

        @Value.Default
        @JsonProperty
        default int port() { return 1883; }

        @JsonProperty
        String username();

        @JsonProperty
        @Nullable
        String password();

        @Value.Default
        @JsonProperty
        default int qos() { return 0; }

        /** Defaults to amcrest2mqtt_{serialNumber} */
        @JsonProperty
        @Nullable
        String clientId();

        @Value.Default
        @JsonProperty
        default Tls tls() { return ImmutableTls.builder().build(); }

        @Value.Check
        default void check() {
            if (qos() < 0 || qos() > 2) {
                throw new IllegalStateException("MQTT QoS must be 0, 1 or 2, got " + qos());
            }
        }
    }

    @Value.Immutable
    @JsonSerialize(as = ImmutableHomeAssistant.class)
    @JsonDeserialize(as = ImmutableHomeAssistant.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    interface HomeAssistant {
        @Value.Default
        @JsonProperty
        default boolean enabled() { return false; }

        @Value.Default
        @JsonProperty
        default String prefix() { return "homeassistant"; }
    }

    @JsonProperty
    @Nullable
    String log4jFolder();

    /** Folder for the dated lifecycle event journal; journal is off when not set */
    @JsonProperty
    @Nullable
    String eventLogFolder();

    @JsonProperty
    Amcrest amcrest();

    @JsonProperty
    Mqtt mqtt();

    @Value.Default
    @JsonProperty
    default HomeAssistant homeAssistant() { return ImmutableHomeAssistant.builder().build(); }

    /** Storage sensors refresh period, seconds. 0 disables storage polling (and its discovery entities) */
    @Value.Default
    @JsonProperty
    default long storagePollIntervalSeconds() { return 3600L; }

    /** Device reachability check period, seconds */
    @Value.Default
    @JsonProperty
    default long livenessProbeIntervalSeconds() { return 30L; }

    @Value.Check
    default void checkIntervals() {
        if (storagePollIntervalSeconds() < 0) {
            throw new IllegalStateException("storagePollIntervalSeconds must be >= 0");
        }
        if (livenessProbeIntervalSeconds() <= 0) {
            throw new IllegalStateException("livenessProbeIntervalSeconds must be > 0");
        }
    }
}
