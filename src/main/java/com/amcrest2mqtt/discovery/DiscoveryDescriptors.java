package com.amcrest2mqtt.discovery;

import static com.google.common.base.Preconditions.checkNotNull;

import com.amcrest2mqtt.device.Capabilities;
import com.amcrest2mqtt.device.DeviceIdentity;
import com.amcrest2mqtt.events.SensorUpdate;
import com.amcrest2mqtt.topics.Channel;
import com.amcrest2mqtt.topics.DiscoveryEntity;
import com.amcrest2mqtt.topics.Topics;
import com.google.common.collect.ImmutableList;

/**
 * Builds the descriptor of each entity from a base shared by all of them (availability, QoS, device block)
 * plus the entity's own fields.
 */
public class DiscoveryDescriptors {
    static final String DIAGNOSTIC = "diagnostic";
    static final String MOTION_CLASS = "motion";
    static final String STORAGE_ICON = "mdi:micro-sd";

    final DeviceIdentity identity;
    final Capabilities capabilities;
    final Topics topics;
    final int qos;
    final boolean storageEnabled;
    final DiscoveryDescriptor.DeviceInfo deviceInfo;

    public DiscoveryDescriptors(DeviceIdentity identity, Capabilities capabilities, Topics topics, int qos,
                                boolean storageEnabled) {
        this.identity = checkNotNull(identity);
        this.capabilities = checkNotNull(capabilities);
        this.topics = checkNotNull(topics);
        this.qos = qos;
        this.storageEnabled = storageEnabled;
        this.deviceInfo = ImmutableDeviceInfo.builder()
                .name("Amcrest " + identity.deviceType())
                .model(identity.deviceType())
                .identifiers(identity.serialNumber())
                .softwareVersion(identity.softwareVersion())
                .build();
    }

    /** Entities exposed for this device, in publishing order */
    public ImmutableList<DiscoveryEntity> entities() {
        ImmutableList.Builder<DiscoveryEntity> entities = ImmutableList.builder();
        for (DiscoveryEntity entity : DiscoveryEntity.values()) {
            if (isExposed(entity)) {
                entities.add(entity);
            }
        }
        return entities.build();
    }

    boolean isExposed(DiscoveryEntity entity) {
        switch (entity) {
            case DOORBELL:
                return capabilities.isDoorbell();
            case HUMAN:
                return capabilities.supportsHuman();
            case STORAGE_USED_PERCENT:
            case STORAGE_USED:
            case STORAGE_TOTAL:
                return storageEnabled;
            default:
                return true;
        }
    }

    public DiscoveryDescriptor descriptor(DiscoveryEntity entity) {
        switch (entity) {
            case DOORBELL:
                return binarySensor(entity, Channel.DOORBELL, "Doorbell")
                        .icon("mdi:doorbell")
                        .build();
            case HUMAN:
                return binarySensor(entity, Channel.HUMAN, "Human")
                        .deviceClass(MOTION_CLASS)
                        .build();
            case MOTION:
                return binarySensor(entity, Channel.MOTION, "Motion")
                        .deviceClass(MOTION_CLASS)
                        .build();
            case VERSION:
                return configSensor(entity, "Version", "sw_version", "mdi:package-up");
            case SERIAL_NUMBER:
                return configSensor(entity, "Serial Number", "serial_number", "mdi:alphabetical-variant");
            case HOST:
                return configSensor(entity, "Host", "host", "mdi:ip-network");
            case STORAGE_USED_PERCENT:
                return storageSensor(entity, Channel.STORAGE_USED_PERCENT, "Storage Used %", "%");
            case STORAGE_USED:
                return storageSensor(entity, Channel.STORAGE_USED, "Storage Used", "GB");
            case STORAGE_TOTAL:
                return storageSensor(entity, Channel.STORAGE_TOTAL, "Storage Total", "GB");
            default:
                throw new IllegalArgumentException("Unknown entity " + entity);
        }
    }

    ImmutableDiscoveryDescriptor.Builder base(DiscoveryEntity entity, String stateTopic, String label) {
        return ImmutableDiscoveryDescriptor.builder()
                .availabilityTopic(topics.status())
                .qos(qos)
                .device(deviceInfo)
                .stateTopic(stateTopic)
                .name(String.format("%s %s", identity.displayName(), label))
                .uniqueId(String.format("%s.%s", identity.serialNumber(), entity.key()));
    }

    ImmutableDiscoveryDescriptor.Builder binarySensor(DiscoveryEntity entity, Channel channel, String label) {
        return base(entity, topics.channel(channel), label)
                .payloadOn(SensorUpdate.ON)
                .payloadOff(SensorUpdate.OFF);
    }

    ImmutableDiscoveryDescriptor.Builder diagnostic(DiscoveryEntity entity, String stateTopic, String label) {
        return base(entity, stateTopic, label)
                .entityCategory(DIAGNOSTIC)
                .enabledByDefault(false);
    }

    /** Sensor reading one field of the retained config snapshot */
    DiscoveryDescriptor configSensor(DiscoveryEntity entity, String label, String field, String icon) {
        return diagnostic(entity, topics.config(), label)
                .valueTemplate(String.format("{{ value_json.%s }}", field))
                .icon(icon)
                .build();
    }

    DiscoveryDescriptor storageSensor(DiscoveryEntity entity, Channel channel, String label, String unit) {
        return diagnostic(entity, topics.channel(channel), label)
                .unitOfMeasurement(unit)
                .icon(STORAGE_ICON)
                .build();
    }
}
