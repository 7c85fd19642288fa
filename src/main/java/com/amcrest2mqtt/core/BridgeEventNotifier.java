package com.amcrest2mqtt.core;

import javax.annotation.Nullable;

public interface BridgeEventNotifier {
  default void notifyEvent(
      String eventReporter,
      BridgeEventType eventType,
      @Nullable String deviceName,
      String eventTitle,
      @Nullable String eventDetails) {
    notifyEvent(System.currentTimeMillis(), eventReporter, eventType, deviceName, eventTitle, eventDetails);
  }

  void notifyEvent(
      Long eventTimeMs,
      String eventReporter,
      BridgeEventType eventType,
      @Nullable String deviceName,
      String eventTitle,
      @Nullable String eventDetails);
}
