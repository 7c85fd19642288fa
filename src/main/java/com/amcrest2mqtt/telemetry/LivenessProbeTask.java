package com.amcrest2mqtt.telemetry;

import static com.google.common.base.Preconditions.checkNotNull;

import com.amcrest2mqtt.core.BridgeEventNotifier;
import com.amcrest2mqtt.core.BridgeEventType;
import com.amcrest2mqtt.core.FatalErrorHandler;
import com.amcrest2mqtt.device.HostProbe;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that the device host still answers. The event stream can stall without an error when the device
 * goes away, so an unreachable device is fatal.
 */
public class LivenessProbeTask extends TelemetryTask {
    final static Logger LOGGER = LoggerFactory.getLogger(LivenessProbeTask.class);
    static final String LIVENESS_PROBE = "LivenessProbe";
    static final int UNREACHABLE_EXIT_CODE = 1;

    final HostProbe probe;
    final FatalErrorHandler fatalErrorHandler;
    final BridgeEventNotifier eventNotifier;
    final String deviceName;
    final String host;

    public LivenessProbeTask(Duration interval, HostProbe probe, FatalErrorHandler fatalErrorHandler,
                             BridgeEventNotifier eventNotifier, String deviceName, String host) {
        super(LIVENESS_PROBE, interval, false);
        this.probe = checkNotNull(probe);
        this.fatalErrorHandler = checkNotNull(fatalErrorHandler);
        this.eventNotifier = checkNotNull(eventNotifier);
        this.deviceName = checkNotNull(deviceName);
        this.host = checkNotNull(host);
    }

    @Override
    protected TaskOutcome tick() {
        if (probe.isReachable()) {
            LOGGER.debug("Device {} is reachable", host);
            return TaskOutcome.SUCCESS;
        }

        eventNotifier.notifyEvent(LIVENESS_PROBE, BridgeEventType.DEVICE_UNREACHABLE, deviceName,
                "Device unreachable", String.format("Host %s did not answer", host));
        fatalErrorHandler.fatal(UNREACHABLE_EXIT_CODE, String.format("Device %s is unreachable", host));
        return TaskOutcome.FAILURE;
    }
}
