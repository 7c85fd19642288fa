package com.amcrest2mqtt.device;

/** Device request failed: I/O, authentication, unexpected response, or event stream retries exhausted. */
public class AmcrestException extends Exception {
    public AmcrestException(String message) {
        super(message);
    }

    public AmcrestException(String message, Throwable cause) {
        super(message, cause);
    }
}
