package com.amcrest2mqtt.discovery;

import static com.google.common.base.Preconditions.checkNotNull;

import com.amcrest2mqtt.mqtt.MqttTransport;
import com.amcrest2mqtt.topics.DiscoveryEntity;
import com.amcrest2mqtt.topics.Topics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes Home Assistant discovery config. For every exposed entity the descriptor under the old name-based
 * topic is deleted (empty retained message) and the descriptor under the serial-number topic is published.
 * Running it again republishes identical payloads.
 */
public class DiscoveryPublisher {
    final static Logger LOGGER = LoggerFactory.getLogger(DiscoveryPublisher.class);
    static final String EMPTY = "";

    final DiscoveryDescriptors descriptors;
    final Topics topics;
    final MqttTransport transport;

    public DiscoveryPublisher(DiscoveryDescriptors descriptors, Topics topics, MqttTransport transport) {
        this.descriptors = checkNotNull(descriptors);
        this.topics = checkNotNull(topics);
        this.transport = checkNotNull(transport);
    }

    /** @return false if a publish failed; the remaining entities are skipped */
    public boolean publish() {
        LOGGER.info("Writing Home Assistant discovery config...");
        for (DiscoveryEntity entity : descriptors.entities()) {
            if (!transport.publish(topics.legacyDiscovery(entity), EMPTY)) {
                return false;
            }
            if (!transport.publishJson(topics.discovery(entity), descriptors.descriptor(entity))) {
                return false;
            }
            LOGGER.debug("Published discovery config of {}", entity.key());
        }
        return true;
    }
}
