package com.amcrest2mqtt.core;

public class SystemProcessTerminator implements ProcessTerminator {
    @Override
    public void exit(int status) {
        System.exit(status);
    }

    @Override
    public void halt(int status) {
        Runtime.getRuntime().halt(status);
    }
}
