package com.amcrest2mqtt.core;

@FunctionalInterface
public interface ShutdownAction {
    void run() throws Exception;
}
