package com.amcrest2mqtt.device;

import static com.google.common.base.Preconditions.checkNotNull;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One event from the device stream. {@code payload} holds every field the device sent
 * ({@code Code}, {@code action}, {@code index}, {@code data}).
 */
public final class DeviceEvent {
    final String code;
    final ObjectNode payload;

    public DeviceEvent(String code, ObjectNode payload) {
        this.code = checkNotNull(code);
        this.payload = checkNotNull(payload);
    }

    public String code() {
        return code;
    }

    public ObjectNode payload() {
        return payload;
    }

    /** {@code action} field, empty when absent */
    public String action() {
        return payload.path("action").asText("");
    }

    @Override
    public String toString() {
        return String.format("%s %s", code, payload);
    }
}
