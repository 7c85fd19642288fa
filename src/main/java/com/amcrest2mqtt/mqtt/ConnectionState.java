package com.amcrest2mqtt.mqtt;

/**
 * <pre>
 * DISCONNECTED -> CONNECTING -> CONNECTED -> CLOSING -> DISCONNECTED (terminal)
 *                                   \-> DISCONNECTED (connection lost, fatal)
 * </pre>
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    CLOSING
}
