package com.amcrest2mqtt.device;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Probes the device by opening a TCP connection to its HTTP port. */
public class SocketHostProbe implements HostProbe {
    final static Logger LOGGER = LoggerFactory.getLogger(SocketHostProbe.class);

    final String host;
    final int port;
    final Duration timeout;

    public SocketHostProbe(String host, int port, Duration timeout) {
        this.host = host;
        this.port = port;
        this.timeout = timeout;
    }

    @Override
    public boolean isReachable() {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
            return true;
        } catch (IOException e) {
            LOGGER.warn("Device {}:{} not reachable: {}", host, port, e.getMessage());
            return false;
        }
    }
}
