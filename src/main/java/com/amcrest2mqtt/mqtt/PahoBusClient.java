package com.amcrest2mqtt.mqtt;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.amcrest2mqtt.config.Config;
import com.google.common.base.Strings;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.util.Locale;
import javax.annotation.Nullable;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManagerFactory;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallback;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link BusClient} backed by the Eclipse Paho MQTT v3 synchronous client. */
public class PahoBusClient implements BusClient {
    final static Logger LOGGER = LoggerFactory.getLogger(PahoBusClient.class);

    static final int KEEP_ALIVE_SECONDS = 60;
    static final long PUBLISH_TIMEOUT_MS = 30_000L;
    static final long DISCONNECT_QUIESCE_MS = 1_000L;

    final Config.Mqtt settings;
    final String clientId;
    final MqttConnectOptions options;
    @Nullable MqttClient client;
    @Nullable volatile DisconnectListener disconnectListener;

    public PahoBusClient(Config.Mqtt settings, String clientId) {
        this.settings = checkNotNull(settings);
        this.clientId = checkNotNull(clientId);
        this.options = new MqttConnectOptions();
        options.setCleanSession(false);
        options.setAutomaticReconnect(false);
        options.setKeepAliveInterval(KEEP_ALIVE_SECONDS);
        options.setUserName(settings.username());
        if (settings.password() != null) {
            options.setPassword(settings.password().toCharArray());
        }
    }

    String serverUri() {
        String scheme = settings.tls().enabled() ? "ssl" : "tcp";
        return String.format("%s://%s:%d", scheme, settings.host(), settings.port());
    }

    @Override
    public void setLastWill(String topic, byte[] payload, int qos, boolean retain) {
        options.setWill(topic, payload, qos, retain);
    }

    @Override
    public void setDisconnectListener(DisconnectListener listener) {
        this.disconnectListener = listener;
    }

    @Override
    public void connect() throws BusException {
        try {
            if (settings.tls().enabled()) {
                options.setSocketFactory(sslSocketFactory(settings.tls()));
            }

            MqttClient newClient = new MqttClient(serverUri(), clientId, new MemoryPersistence());
            newClient.setTimeToWait(PUBLISH_TIMEOUT_MS);
            newClient.setCallback(new MqttCallback() {
                @Override
                public void connectionLost(Throwable cause) {
                    DisconnectListener listener = disconnectListener;
                    int reasonCode = cause instanceof MqttException ? ((MqttException) cause).getReasonCode() : 1;
                    if (listener != null) {
                        listener.onConnectionLost(reasonCode, cause);
                    } else {
                        LOGGER.error("MQTT connection lost", cause);
                    }
                }

                @Override
                public void messageArrived(String topic, MqttMessage message) {
                    // publish only
                }

                @Override
                public void deliveryComplete(IMqttDeliveryToken token) {
                    LOGGER.trace("Delivered message {}", token.getMessageId());
                }
            });

            LOGGER.info("Connecting to MQTT broker {} as {}", serverUri(), clientId);
            newClient.connect(options);
            client = newClient;
        } catch (MqttException e) {
            throw new BusException(e.getReasonCode(),
                    String.format("Could not connect to MQTT server %s: %s", serverUri(), e.getMessage()), e);
        } catch (GeneralSecurityException | IOException e) {
            throw new BusException(1, String.format("Can't set up TLS for %s: %s", serverUri(), e.getMessage()), e);
        }
    }

    @Override
    public void publish(String topic, byte[] payload, int qos, boolean retain) throws BusException {
        MqttClient current = client;
        checkState(current != null, "Not connected");
        try {
            current.publish(topic, payload, qos, retain);
        } catch (MqttException e) {
            throw new BusException(e.getReasonCode(),
                    String.format("Error publishing MQTT message to %s: %s", topic, e.getMessage()), e);
        }
    }

    @Override
    public boolean isConnected() {
        MqttClient current = client;
        return current != null && current.isConnected();
    }

    @Override
    public void disconnect() throws BusException {
        MqttClient current = client;
        if (current == null) {
            return;
        }
        try {
            if (current.isConnected()) {
                current.disconnect(DISCONNECT_QUIESCE_MS);
            }
        } catch (MqttException e) {
            LOGGER.warn("Clean MQTT disconnect failed ({}), forcing", e.getMessage());
            try {
                current.disconnectForcibly(0L, DISCONNECT_QUIESCE_MS);
            } catch (MqttException forced) {
                throw new BusException(forced.getReasonCode(), "MQTT disconnect failed: " + forced.getMessage(), forced);
            }
        } finally {
            try {
                current.close();
            } catch (MqttException e) {
                LOGGER.debug("Error closing MQTT client", e);
            }
        }
    }

    static SSLSocketFactory sslSocketFactory(Config.Tls tls) throws GeneralSecurityException, IOException {
        TrustManagerFactory trustManagerFactory = null;
        if (!Strings.isNullOrEmpty(tls.truststore())) {
            KeyStore trustStore = loadKeyStore(tls.truststore(), tls.truststorePassword());
            trustManagerFactory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            trustManagerFactory.init(trustStore);
        }

        KeyManagerFactory keyManagerFactory = null;
        if (!Strings.isNullOrEmpty(tls.keystore())) {
            KeyStore keyStore = loadKeyStore(tls.keystore(), tls.keystorePassword());
            keyManagerFactory = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            keyManagerFactory.init(keyStore, passwordChars(tls.keystorePassword()));
        }

        SSLContext sslContext = SSLContext.getInstance("TLS");
        sslContext.init(
                keyManagerFactory == null ? null : keyManagerFactory.getKeyManagers(),
                trustManagerFactory == null ? null : trustManagerFactory.getTrustManagers(),
                null);
        return sslContext.getSocketFactory();
    }

    static KeyStore loadKeyStore(String path, @Nullable String password) throws GeneralSecurityException, IOException {
        String lower = path.toLowerCase(Locale.ROOT);
        String type = lower.endsWith(".p12") || lower.endsWith(".pfx") ? "PKCS12" : "JKS";
        KeyStore keyStore = KeyStore.getInstance(type);
        try (InputStream in = new FileInputStream(path)) {
            keyStore.load(in, passwordChars(password));
        }
        return keyStore;
    }

    static @Nullable char[] passwordChars(@Nullable String password) {
        return password == null ? null : password.toCharArray();
    }
}
