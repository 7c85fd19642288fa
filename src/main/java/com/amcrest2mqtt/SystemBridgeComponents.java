package com.amcrest2mqtt;

import com.amcrest2mqtt.config.Config;
import com.amcrest2mqtt.core.ProcessTerminator;
import com.amcrest2mqtt.core.ShutdownCoordinator;
import com.amcrest2mqtt.core.SignalHandlers;
import com.amcrest2mqtt.core.SystemProcessTerminator;
import com.amcrest2mqtt.device.AmcrestDevice;
import com.amcrest2mqtt.device.AmcrestHttpCamera;
import com.amcrest2mqtt.device.HostProbe;
import com.amcrest2mqtt.device.SocketHostProbe;
import com.amcrest2mqtt.mqtt.BusClient;
import com.amcrest2mqtt.mqtt.PahoBusClient;
import com.amcrest2mqtt.telemetry.MonotonicClock;
import com.amcrest2mqtt.telemetry.ScheduledExecutorTaskScheduler;
import com.amcrest2mqtt.telemetry.SystemMonotonicClock;
import com.amcrest2mqtt.telemetry.TaskScheduler;
import java.time.Duration;

/** Real camera over HTTP, Paho, OS signals and {@link System#exit}. */
final class SystemBridgeComponents implements BridgeComponents {
    static final int TELEMETRY_THREADS = 2;

    @Override
    public ProcessTerminator terminator() {
        return new SystemProcessTerminator();
    }

    @Override
    public void installSignalHandlers(ShutdownCoordinator coordinator) {
        SignalHandlers.install(coordinator);
    }

    @Override
    public AmcrestDevice camera(Config.Amcrest amcrest, Duration requestTimeout) {
        return new AmcrestHttpCamera(amcrest.host(), amcrest.port(), amcrest.username(), amcrest.password(),
                requestTimeout);
    }

    @Override
    public HostProbe hostProbe(Config.Amcrest amcrest, Duration timeout) {
        return new SocketHostProbe(amcrest.host(), amcrest.port(), timeout);
    }

    @Override
    public BusClient busClient(Config.Mqtt mqtt, String clientId) {
        return new PahoBusClient(mqtt, clientId);
    }

    @Override
    public TaskScheduler telemetryScheduler() {
        return new ScheduledExecutorTaskScheduler(TELEMETRY_THREADS);
    }

    @Override
    public MonotonicClock clock() {
        return new SystemMonotonicClock();
    }
}
