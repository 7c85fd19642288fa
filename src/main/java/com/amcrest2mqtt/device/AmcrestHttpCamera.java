package com.amcrest2mqtt.device;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link AmcrestDevice} over the camera's HTTP CGI API. */
public class AmcrestHttpCamera implements AmcrestDevice {
    final static Logger LOGGER = LoggerFactory.getLogger(AmcrestHttpCamera.class);

    static final String DEVICE_TYPE_PATH = "/cgi-bin/magicBox.cgi?action=getDeviceType";
    static final String SERIAL_NUMBER_PATH = "/cgi-bin/magicBox.cgi?action=getSerialNo";
    static final String SOFTWARE_VERSION_PATH = "/cgi-bin/magicBox.cgi?action=getSoftwareVersion";
    static final String MACHINE_NAME_PATH = "/cgi-bin/magicBox.cgi?action=getMachineName";
    static final String STORAGE_PATH = "/cgi-bin/storageDevice.cgi?action=getDeviceAllInfo";
    static final String EVENT_STREAM_PATH_PATTERN = "/cgi-bin/eventManager.cgi?action=attach&codes=%%5B%s%%5D&heartbeat=%d";
    static final int HEARTBEAT_SECONDS = 5;
    static final Duration RETRY_BASE_DELAY = Duration.ofMillis(500);

    final String host;
    final int port;
    final Duration requestTimeout;
    final HttpClient httpClient;
    final DigestAuthenticator authenticator;

    public AmcrestHttpCamera(String host, int port, String username, String password, Duration requestTimeout) {
        this.host = checkNotNull(host);
        this.port = port;
        this.requestTimeout = requestTimeout;
        this.authenticator = new DigestAuthenticator(username, password);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .build();
    }

    @Override
    public String getDeviceType() throws AmcrestException {
        return AmcrestResponses.value(getText(DEVICE_TYPE_PATH), "type");
    }

    @Override
    public String getSerialNumber() throws AmcrestException {
        return AmcrestResponses.value(getText(SERIAL_NUMBER_PATH), "sn");
    }

    @Override
    public String getSoftwareVersion() throws AmcrestException {
        return AmcrestResponses.softwareVersion(getText(SOFTWARE_VERSION_PATH));
    }

    @Override
    public String getDisplayName() throws AmcrestException {
        return AmcrestResponses.value(getText(MACHINE_NAME_PATH), "name");
    }

    @Override
    public String getHost() {
        return host;
    }

    @Override
    public StorageStats getStorageStats() throws AmcrestException {
        return AmcrestResponses.storageStats(getText(STORAGE_PATH));
    }

    @Override
    public DeviceEventStream streamEvents(String channel, int retries, Duration timeout) {
        String path = String.format(EVENT_STREAM_PATH_PATTERN, channel, HEARTBEAT_SECONDS);
        return new AmcrestEventStream(
                () -> send(path, HttpResponse.BodyHandlers.ofInputStream(), timeout).body(),
                retries, RETRY_BASE_DELAY);
    }

    String getText(String pathAndQuery) throws AmcrestException {
        return send(pathAndQuery, HttpResponse.BodyHandlers.ofString(), requestTimeout).body();
    }

    /** GET with one retry after an authentication challenge. */
    <T> HttpResponse<T> send(String pathAndQuery, HttpResponse.BodyHandler<T> bodyHandler, Duration timeout)
            throws AmcrestException {
        URI uri = URI.create(String.format("http://%s:%d%s", host, port, pathAndQuery));

        try {
            for (int attempt = 0; ; attempt++) {
                HttpRequest.Builder request = HttpRequest.newBuilder(uri)
                        .timeout(timeout)
                        .GET();
                String authorization = authenticator.authorization("GET", pathAndQuery);
                if (authorization != null) {
                    request.header("Authorization", authorization);
                }

                HttpResponse<T> response = httpClient.send(request.build(), bodyHandler);
                int status = response.statusCode();

                if (status == 401 && attempt == 0) {
                    discard(response);
                    if (!authenticator.onChallenge(response.headers().allValues("WWW-Authenticate"))) {
                        throw new AmcrestException(String.format("Unsupported authentication scheme for %s", uri));
                    }
                    continue;
                }

                if (status < 200 || status >= 300) {
                    discard(response);
                    throw new AmcrestException(String.format("HTTP %d from %s", status, uri));
                }
                LOGGER.debug("GET {} -> {}", uri, status);
                return response;
            }
        } catch (IOException e) {
            throw new AmcrestException(String.format("Request to %s failed: %s", uri, e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AmcrestException(String.format("Interrupted while requesting %s", uri), e);
        }
    }

    static void discard(HttpResponse<?> response) {
        if (response.body() instanceof InputStream) {
            try {
                ((InputStream) response.body()).close();
            } catch (IOException e) {
                LOGGER.debug("Error discarding response body", e);
            }
        }
    }
}
