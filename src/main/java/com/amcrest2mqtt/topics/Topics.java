package com.amcrest2mqtt.topics;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/** Every topic used for one device. Immutable, safe to share between threads. */
public final class Topics {
    final ImmutableMap<Channel, String> channels;
    final ImmutableMap<DiscoveryEntity, String> discovery;
    final ImmutableMap<DiscoveryEntity, String> legacyDiscovery;

    Topics(ImmutableMap<Channel, String> channels,
           ImmutableMap<DiscoveryEntity, String> discovery,
           ImmutableMap<DiscoveryEntity, String> legacyDiscovery) {
        this.channels = channels;
        this.discovery = discovery;
        this.legacyDiscovery = legacyDiscovery;
    }

    public String channel(Channel channel) {
        String topic = channels.get(channel);
        checkArgument(topic != null, "No topic for channel %s", channel);
        return topic;
    }

    public String status() {
        return channel(Channel.STATUS);
    }

    public String config() {
        return channel(Channel.CONFIG);
    }

    /** Discovery topic keyed by serial number only */
    public String discovery(DiscoveryEntity entity) {
        String topic = discovery.get(entity);
        checkArgument(topic != null, "No discovery topic for %s", entity);
        return topic;
    }

    /** Discovery topic keyed by serial number and name slug; only ever retracted */
    public String legacyDiscovery(DiscoveryEntity entity) {
        String topic = legacyDiscovery.get(entity);
        checkArgument(topic != null, "No legacy discovery topic for %s", entity);
        return topic;
    }

    public ImmutableSet<String> all() {
        return ImmutableSet.<String>builder()
                .addAll(channels.values())
                .addAll(discovery.values())
                .addAll(legacyDiscovery.values())
                .build();
    }

    @Override
    public String toString() {
        return channels.toString();
    }
}
