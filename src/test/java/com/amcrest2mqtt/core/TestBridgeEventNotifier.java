package com.amcrest2mqtt.core;

import static com.amcrest2mqtt.core.DatedFileBridgeEventNotifier.getEventMessageStr;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs events and remembers their types. */
public class TestBridgeEventNotifier implements BridgeEventNotifier {
    final static Logger LOGGER = LoggerFactory.getLogger(TestBridgeEventNotifier.class);

    public final List<BridgeEventType> eventTypes = new CopyOnWriteArrayList<>();

    @Override
    public void notifyEvent(Long eventTimeMs, String eventReporter, BridgeEventType eventType,
                            @Nullable String deviceName, String eventTitle, @Nullable String eventDetails) {
        eventTypes.add(eventType);
        LOGGER.warn("!!!EVENT!!! {}",
                getEventMessageStr(eventTimeMs, eventReporter, eventType, deviceName, eventTitle, eventDetails));
    }
}
