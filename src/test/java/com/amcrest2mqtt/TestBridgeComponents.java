package com.amcrest2mqtt;

import com.amcrest2mqtt.config.Config;
import com.amcrest2mqtt.core.ProcessTerminator;
import com.amcrest2mqtt.core.RecordingProcessTerminator;
import com.amcrest2mqtt.core.ShutdownCoordinator;
import com.amcrest2mqtt.device.AmcrestDevice;
import com.amcrest2mqtt.device.FakeAmcrestDevice;
import com.amcrest2mqtt.device.HostProbe;
import com.amcrest2mqtt.mqtt.BusClient;
import com.amcrest2mqtt.mqtt.FakeBusClient;
import com.amcrest2mqtt.telemetry.DeterministicTaskScheduler;
import com.amcrest2mqtt.telemetry.ManualMonotonicClock;
import com.amcrest2mqtt.telemetry.MonotonicClock;
import com.amcrest2mqtt.telemetry.TaskScheduler;
import java.time.Duration;
import javax.annotation.Nullable;

/** Wires the bridge to in-memory fakes; the coordinator is captured where signal handlers would be installed. */
public class TestBridgeComponents implements BridgeComponents {
    public final RecordingProcessTerminator terminator = new RecordingProcessTerminator();
    public final FakeBusClient busClient = new FakeBusClient();
    public final ManualMonotonicClock clock = new ManualMonotonicClock();
    public final DeterministicTaskScheduler scheduler = new DeterministicTaskScheduler(clock);
    public FakeAmcrestDevice camera = new FakeAmcrestDevice();
    public boolean hostReachable = true;

    @Nullable public ShutdownCoordinator coordinator;
    @Nullable public String clientId;

    @Override
    public ProcessTerminator terminator() {
        return terminator;
    }

    @Override
    public void installSignalHandlers(ShutdownCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public AmcrestDevice camera(Config.Amcrest amcrest, Duration requestTimeout) {
        return camera;
    }

    @Override
    public HostProbe hostProbe(Config.Amcrest amcrest, Duration timeout) {
        return () -> hostReachable;
    }

    @Override
    public BusClient busClient(Config.Mqtt mqtt, String clientId) {
        this.clientId = clientId;
        return busClient;
    }

    @Override
    public TaskScheduler telemetryScheduler() {
        return scheduler;
    }

    @Override
    public MonotonicClock clock() {
        return clock;
    }

    /** Same as an interrupt from the terminal */
    public void sendSigint() {
        if (coordinator != null) {
            coordinator.requestShutdown(0, "SIGINT");
        }
    }
}
