package com.amcrest2mqtt.core;

import static com.amcrest2mqtt.core.DatedFileBridgeEventNotifier.getEventMessageStr;

import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LogBridgeEventNotifier implements BridgeEventNotifier {
    final static Logger LOGGER = LoggerFactory.getLogger(LogBridgeEventNotifier.class);

    @Override
    public void notifyEvent(Long eventTimeMs, String eventReporter, BridgeEventType eventType,
                            @Nullable String deviceName, String eventTitle, @Nullable String eventDetails) {
        LOGGER.warn("!!!EVENT!!! {}",
                getEventMessageStr(eventTimeMs, eventReporter, eventType, deviceName, eventTitle, eventDetails));
    }
}
