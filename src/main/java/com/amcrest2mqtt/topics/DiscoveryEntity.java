package com.amcrest2mqtt.topics;

/** Entities the automation platform can discover, with the platform component each one maps to. */
public enum DiscoveryEntity {
    DOORBELL("doorbell", Component.BINARY_SENSOR),
    HUMAN("human", Component.BINARY_SENSOR),
    MOTION("motion", Component.BINARY_SENSOR),
    VERSION("version", Component.SENSOR),
    SERIAL_NUMBER("serial_number", Component.SENSOR),
    HOST("host", Component.SENSOR),
    STORAGE_USED_PERCENT("storage_used_percent", Component.SENSOR),
    STORAGE_USED("storage_used", Component.SENSOR),
    STORAGE_TOTAL("storage_total", Component.SENSOR);

    public enum Component {
        BINARY_SENSOR("binary_sensor"),
        SENSOR("sensor");

        final String id;

        Component(String id) {
            this.id = id;
        }

        public String id() {
            return id;
        }
    }

    final String key;
    final Component component;

    DiscoveryEntity(String key, Component component) {
        this.key = key;
        this.component = component;
    }

    /** Suffix of the entity's unique id and discovery topic */
    public String key() {
        return key;
    }

    public Component component() {
        return component;
    }
}
