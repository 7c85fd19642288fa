package com.amcrest2mqtt.core;

public enum BridgeEventType {
  /** Bridge process lifecycle (start, shut down) */
  BRIDGE_PROCESS,
  /** Device identity resolved */
  DEVICE_RESOLVED,
  /** Device type not in the known model table, generic camera behavior assumed */
  UNSUPPORTED_MODEL,
  /** Connected to the MQTT broker and announced online */
  MQTT_CONNECTED,
  /** Broker connection dropped without a local disconnect */
  MQTT_CONNECTION_LOST,
  /** Publish was not acknowledged */
  MQTT_PUBLISH_FAILED,
  /** Storage sensors could not be fetched; tick skipped */
  STORAGE_POLL_FAILED,
  /** Device host did not answer the liveness probe */
  DEVICE_UNREACHABLE,
  /** Device event stream gave up after its retry budget */
  EVENT_STREAM_FAILED,
  /** Graceful shutdown requested (signal or fatal error) */
  SHUTDOWN_REQUESTED
}
