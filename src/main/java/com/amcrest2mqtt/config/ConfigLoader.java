package com.amcrest2mqtt.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.google.common.base.Charsets;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Resources;
import java.io.File;
import java.io.IOException;
import java.util.Map;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link Config} from an optional YAML file with environment variables layered on top.
 * Environment variables win over the file; blank variables count as unset.
 */
public class ConfigLoader {
    final static Logger LOGGER = LoggerFactory.getLogger(ConfigLoader.class);

    enum ValueKind { STRING, INT, BOOLEAN }

    static final class EnvBinding {
        final String[] path;
        final ValueKind kind;

        EnvBinding(ValueKind kind, String... path) {
            this.path = path;
            this.kind = kind;
        }
    }

    /** Env var name -> config tree path */
    static final ImmutableMap<String, EnvBinding> ENV_BINDINGS = ImmutableMap.<String, EnvBinding>builder()
            .put("AMCREST_HOST", new EnvBinding(ValueKind.STRING, "amcrest", "host"))
            .put("AMCREST_PORT", new EnvBinding(ValueKind.INT, "amcrest", "port"))
            .put("AMCREST_USERNAME", new EnvBinding(ValueKind.STRING, "amcrest", "username"))
            .put("AMCREST_PASSWORD", new EnvBinding(ValueKind.STRING, "amcrest", "password"))
            .put("DEVICE_NAME", new EnvBinding(ValueKind.STRING, "amcrest", "deviceName"))
            .put("MQTT_HOST", new EnvBinding(ValueKind.STRING, "mqtt", "host"))
            .put("MQTT_PORT", new EnvBinding(ValueKind.INT, "mqtt", "port"))
            .put("MQTT_USERNAME", new EnvBinding(ValueKind.STRING, "mqtt", "username"))
            .put("MQTT_PASSWORD", new EnvBinding(ValueKind.STRING, "mqtt", "password"))
            .put("MQTT_QOS", new EnvBinding(ValueKind.INT, "mqtt", "qos"))
            .put("MQTT_CLIENT_ID", new EnvBinding(ValueKind.STRING, "mqtt", "clientId"))
            .put("MQTT_TLS_ENABLED", new EnvBinding(ValueKind.BOOLEAN, "mqtt", "tls", "enabled"))
            .put("MQTT_TLS_TRUSTSTORE", new EnvBinding(ValueKind.STRING, "mqtt", "tls", "truststore"))
            .put("MQTT_TLS_TRUSTSTORE_PASSWORD", new EnvBinding(ValueKind.STRING, "mqtt", "tls", "truststorePassword"))
            .put("MQTT_TLS_KEYSTORE", new EnvBinding(ValueKind.STRING, "mqtt", "tls", "keystore"))
            .put("MQTT_TLS_KEYSTORE_PASSWORD", new EnvBinding(ValueKind.STRING, "mqtt", "tls", "keystorePassword"))
            .put("HOME_ASSISTANT", new EnvBinding(ValueKind.BOOLEAN, "homeAssistant", "enabled"))
            .put("HOME_ASSISTANT_PREFIX", new EnvBinding(ValueKind.STRING, "homeAssistant", "prefix"))
            .put("STORAGE_POLL_INTERVAL", new EnvBinding(ValueKind.INT, "storagePollIntervalSeconds"))
            .put("LIVENESS_PROBE_INTERVAL", new EnvBinding(ValueKind.INT, "livenessProbeIntervalSeconds"))
            .put("LOG4J_FOLDER", new EnvBinding(ValueKind.STRING, "log4jFolder"))
            .put("EVENT_LOG_FOLDER", new EnvBinding(ValueKind.STRING, "eventLogFolder"))
            .build();

    final ObjectMapper mapper;
    final Map<String, String> environment;

    public ConfigLoader(Map<String, String> environment) {
        this.environment = environment;
        this.mapper = new ObjectMapper(new YAMLFactory())
                .registerModule(new GuavaModule());
    }

    public static ConfigLoader fromSystemEnvironment() {
        return new ConfigLoader(System.getenv());
    }

    /**
     * @param configName file path or classpath resource name; {@code null} to rely on the environment only
     */
    public Config load(@Nullable String configName) throws ConfigurationException {
        ObjectNode tree = readTree(configName);
        applyEnvironment(tree);

        Config config;
        try {
            config = mapper.treeToValue(tree, Config.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration: " + rootMessage(e), e);
        }

        requireNotBlank(config.amcrest().host(), "amcrest.host (AMCREST_HOST)");
        requireNotBlank(config.amcrest().password(), "amcrest.password (AMCREST_PASSWORD)");
        requireNotBlank(config.mqtt().username(), "mqtt.username (MQTT_USERNAME)");
        return config;
    }

    ObjectNode readTree(@Nullable String configName) throws ConfigurationException {
        if (Strings.isNullOrEmpty(configName)) {
            return JsonNodeFactory.instance.objectNode();
        }

        try {
            JsonNode node;
            File configFile = new File(configName);
            if (configFile.exists()) {
                LOGGER.info("Reading config file {}", configFile.getAbsolutePath());
                node = mapper.readTree(configFile);
            } else {
                LOGGER.info("Reading config resource {}", configName);
                String resourceStr = Resources.toString(Resources.getResource(configName), Charsets.UTF_8);
                node = mapper.readTree(resourceStr);
            }

            if (node == null || node.isMissingNode() || node.isNull()) {
                return JsonNodeFactory.instance.objectNode();
            }
            if (!node.isObject()) {
                throw new ConfigurationException(String.format("Config [%s] must be a mapping", configName));
            }
            return (ObjectNode) node;
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(String.format("Config [%s] not found", configName), e);
        } catch (IOException e) {
            throw new ConfigurationException(String.format("Can't read config [%s]: %s", configName, e.getMessage()), e);
        }
    }

    void applyEnvironment(ObjectNode tree) throws ConfigurationException {
        for (Map.Entry<String, EnvBinding> entry : ENV_BINDINGS.entrySet()) {
            String value = environment.get(entry.getKey());
            if (Strings.isNullOrEmpty(value)) {
                continue;
            }

            EnvBinding binding = entry.getValue();
            ObjectNode parent = tree;
            for (int i = 0; i < binding.path.length - 1; i++) {
                JsonNode child = parent.get(binding.path[i]);
                parent = child instanceof ObjectNode ? (ObjectNode) child : parent.putObject(binding.path[i]);
            }
            String field = binding.path[binding.path.length - 1];

            switch (binding.kind) {
                case INT:
                    try {
                        parent.put(field, Long.parseLong(value.trim()));
                    } catch (NumberFormatException e) {
                        throw new ConfigurationException(
                                String.format("Environment variable %s must be a number, got [%s]", entry.getKey(), value), e);
                    }
                    break;
                case BOOLEAN:
                    parent.set(field, BooleanNode.valueOf("true".equalsIgnoreCase(value.trim())));
                    break;
                default:
                    parent.put(field, value);
            }
        }
    }

    static void requireNotBlank(@Nullable String value, String name) throws ConfigurationException {
        if (Strings.isNullOrEmpty(value) || value.isBlank()) {
            throw new ConfigurationException(String.format("Please set %s", name));
        }
    }

    static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
