package com.amcrest2mqtt.mqtt;

/** Bus operation failed. {@link #getReasonCode()} carries the client library's error code. */
public class BusException extends Exception {
    final int reasonCode;

    public BusException(int reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public BusException(int reasonCode, String message, Throwable cause) {
        super(message, cause);
        this.reasonCode = reasonCode;
    }

    public int getReasonCode() {
        return reasonCode;
    }
}
