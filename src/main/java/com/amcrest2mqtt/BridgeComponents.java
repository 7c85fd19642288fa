package com.amcrest2mqtt;

import com.amcrest2mqtt.config.Config;
import com.amcrest2mqtt.core.ProcessTerminator;
import com.amcrest2mqtt.core.ShutdownCoordinator;
import com.amcrest2mqtt.device.AmcrestDevice;
import com.amcrest2mqtt.device.HostProbe;
import com.amcrest2mqtt.mqtt.BusClient;
import com.amcrest2mqtt.telemetry.MonotonicClock;
import com.amcrest2mqtt.telemetry.TaskScheduler;
import java.time.Duration;

/** Process-level resources {@link BridgeService} wires together; tests swap in fakes. */
interface BridgeComponents {
    ProcessTerminator terminator();

    void installSignalHandlers(ShutdownCoordinator coordinator);

    AmcrestDevice camera(Config.Amcrest amcrest, Duration requestTimeout);

    HostProbe hostProbe(Config.Amcrest amcrest, Duration timeout);

    BusClient busClient(Config.Mqtt mqtt, String clientId);

    TaskScheduler telemetryScheduler();

    MonotonicClock clock();
}
