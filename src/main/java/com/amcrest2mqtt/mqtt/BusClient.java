package com.amcrest2mqtt.mqtt;

/**
 * Publish/subscribe client used by {@link MqttTransport}. Network I/O runs on the implementation's own
 * threads; {@link #publish} blocks until the broker acknowledged delivery.
 */
public interface BusClient {
    @FunctionalInterface
    interface DisconnectListener {
        /** Called from the client's thread when the connection drops without a local disconnect */
        void onConnectionLost(int reasonCode, Throwable cause);
    }

    /** Must be called before {@link #connect()} */
    void setLastWill(String topic, byte[] payload, int qos, boolean retain);

    void setDisconnectListener(DisconnectListener listener);

    void connect() throws BusException;

    void publish(String topic, byte[] payload, int qos, boolean retain) throws BusException;

    boolean isConnected();

    /** Stops background activity and disconnects; no disconnect notification is delivered */
    void disconnect() throws BusException;
}
