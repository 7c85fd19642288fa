package com.amcrest2mqtt.topics;

import static com.google.common.base.Preconditions.checkArgument;

import com.amcrest2mqtt.device.DeviceIdentity;
import com.google.common.collect.ImmutableMap;

/**
 * Derives the topic namespace of a device.
 * <pre>
 * amcrest2mqtt/{serial}/{channel}
 * {prefix}/{component}/amcrest2mqtt-{serial}/{entity}/config          current discovery
 * {prefix}/{component}/amcrest2mqtt-{serial}/{slug}_{entity}/config   legacy discovery
 * </pre>
 */
public final class TopicNamespace {
    public static final String ROOT = "amcrest2mqtt";

    static final String CHANNEL_PATTERN = "%s/%s/%s";
    static final String DISCOVERY_PATTERN = "%s/%s/%s-%s/%s/config";
    static final String LEGACY_DISCOVERY_PATTERN = "%s/%s/%s-%s/%s_%s/config";

    private TopicNamespace() {}

    public static Topics forDevice(DeviceIdentity identity, String discoveryPrefix) {
        checkArgument(!discoveryPrefix.isBlank(), "Discovery prefix must not be empty");

        String serialNumber = identity.serialNumber();
        String slug = Slugs.slugify(identity.displayName(), '_');

        ImmutableMap.Builder<Channel, String> channels = ImmutableMap.builder();
        for (Channel channel : Channel.values()) {
            channels.put(channel, String.format(CHANNEL_PATTERN, ROOT, serialNumber, channel.path()));
        }

        ImmutableMap.Builder<DiscoveryEntity, String> discovery = ImmutableMap.builder();
        ImmutableMap.Builder<DiscoveryEntity, String> legacyDiscovery = ImmutableMap.builder();
        for (DiscoveryEntity entity : DiscoveryEntity.values()) {
            String component = entity.component().id();
            discovery.put(entity, String.format(DISCOVERY_PATTERN,
                    discoveryPrefix, component, ROOT, serialNumber, entity.key()));
            legacyDiscovery.put(entity, String.format(LEGACY_DISCOVERY_PATTERN,
                    discoveryPrefix, component, ROOT, serialNumber, slug, entity.key()));
        }

        return new Topics(channels.build(), discovery.build(), legacyDiscovery.build());
    }
}
