package com.amcrest2mqtt.telemetry;

import static com.google.common.base.Preconditions.checkNotNull;

import com.amcrest2mqtt.core.BridgeEventNotifier;
import com.amcrest2mqtt.core.BridgeEventType;
import com.amcrest2mqtt.device.AmcrestDevice;
import com.amcrest2mqtt.device.AmcrestException;
import com.amcrest2mqtt.device.StorageStats;
import com.amcrest2mqtt.mqtt.MqttTransport;
import com.amcrest2mqtt.topics.Channel;
import com.amcrest2mqtt.topics.Topics;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Polls storage capacity and publishes used percent, used GB and total GB. Device errors skip the tick. */
public class StorageSensorsTask extends TelemetryTask {
    final static Logger LOGGER = LoggerFactory.getLogger(StorageSensorsTask.class);
    static final String STORAGE_SENSORS = "StorageSensors";

    final AmcrestDevice device;
    final MqttTransport transport;
    final Topics topics;
    final BridgeEventNotifier eventNotifier;
    final String deviceName;

    public StorageSensorsTask(Duration interval, AmcrestDevice device, MqttTransport transport, Topics topics,
                              BridgeEventNotifier eventNotifier, String deviceName) {
        super(STORAGE_SENSORS, interval, true);
        this.device = checkNotNull(device);
        this.transport = checkNotNull(transport);
        this.topics = checkNotNull(topics);
        this.eventNotifier = checkNotNull(eventNotifier);
        this.deviceName = checkNotNull(deviceName);
    }

    @Override
    protected TaskOutcome tick() {
        LOGGER.info("Fetching storage sensors...");
        StorageStats stats;
        try {
            stats = device.getStorageStats();
        } catch (AmcrestException e) {
            LOGGER.warn("Error fetching storage information: {}", e.getMessage());
            eventNotifier.notifyEvent(STORAGE_SENSORS, BridgeEventType.STORAGE_POLL_FAILED, deviceName,
                    "Storage poll failed", e.getMessage());
            return TaskOutcome.FAILURE;
        }

        boolean published = transport.publish(topics.channel(Channel.STORAGE_USED_PERCENT),
                        StorageUnits.percent(stats.usedPercent()))
                && transport.publish(topics.channel(Channel.STORAGE_USED), StorageUnits.toGigabytes(stats.usedBytes()))
                && transport.publish(topics.channel(Channel.STORAGE_TOTAL), StorageUnits.toGigabytes(stats.totalBytes()));
        return published ? TaskOutcome.SUCCESS : TaskOutcome.FAILURE;
    }
}
