package com.amcrest2mqtt.topics;

/** State channels under {@code amcrest2mqtt/<serial>/}. */
public enum Channel {
    STATUS("status"),
    CONFIG("config"),
    EVENT("event"),
    MOTION("motion"),
    DOORBELL("doorbell"),
    HUMAN("human"),
    STORAGE_USED("storage/used"),
    STORAGE_USED_PERCENT("storage/used_percent"),
    STORAGE_TOTAL("storage/total");

    final String path;

    Channel(String path) {
        this.path = path;
    }

    public String path() {
        return path;
    }
}
