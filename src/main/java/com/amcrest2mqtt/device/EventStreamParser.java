package com.amcrest2mqtt.device;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Charsets;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the multipart body of {@code eventManager.cgi?action=attach}.
 * <pre>
 * --myboundary
 * Content-Type: text/plain
 * Content-Length: 39
 *
 * Code=VideoMotion;action=Start;index=0
 * </pre>
 * Parts are read by Content-Length so an event is delivered as soon as its part is complete, without
 * waiting for the next boundary.
 */
public class EventStreamParser {
    final static Logger LOGGER = LoggerFactory.getLogger(EventStreamParser.class);

    static final String CODE_PREFIX = "Code=";
    static final String DATA_SEPARATOR = ";data=";

    /** Device JSON has trailing commas */
    static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .build();

    final InputStream in;

    public EventStreamParser(InputStream in) {
        this.in = in;
    }

    /** @return next part body, trimmed; null at end of stream */
    public @Nullable String nextPart() throws IOException {
        Integer contentLength = null;
        boolean inHeaders = false;

        while (true) {
            String line = readLine();
            if (line == null) {
                return null;
            }

            if (line.isEmpty()) {
                if (inHeaders) {
                    break;
                }
                continue;
            }
            if (line.startsWith("--")) {
                contentLength = null;
                inHeaders = false;
                continue;
            }

            int colon = line.indexOf(':');
            if (!line.startsWith(CODE_PREFIX) && colon > 0) {
                inHeaders = true;
                if ("Content-Length".equalsIgnoreCase(line.substring(0, colon).trim())) {
                    try {
                        contentLength = Integer.parseInt(line.substring(colon + 1).trim());
                    } catch (NumberFormatException e) {
                        LOGGER.debug("Ignoring bad Content-Length [{}]", line);
                    }
                }
                continue;
            }

            // Body without part headers
            return line.trim();
        }

        if (contentLength == null) {
            return readUntilBlankLine();
        }

        byte[] body = in.readNBytes(contentLength);
        if (body.length < contentLength) {
            return null;
        }
        return new String(body, Charsets.UTF_8).trim();
    }

    /**
     * Parses {@code Code=...;action=...;index=...;data={...}}.
     *
     * @return null for heartbeats and anything that isn't an event
     */
    public static @Nullable DeviceEvent parseEvent(String part) {
        if (!part.startsWith(CODE_PREFIX)) {
            return null;
        }

        String head = part;
        String data = null;
        int dataIndex = part.indexOf(DATA_SEPARATOR);
        if (dataIndex >= 0) {
            head = part.substring(0, dataIndex);
            data = part.substring(dataIndex + DATA_SEPARATOR.length()).trim();
        }

        ObjectNode payload = LENIENT_MAPPER.createObjectNode();
        for (String pair : head.split(";")) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                payload.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
            }
        }

        if (data != null) {
            try {
                payload.set("data", LENIENT_MAPPER.readTree(data));
            } catch (JsonProcessingException e) {
                LOGGER.debug("Event data is not JSON, keeping it as text: {}", e.getOriginalMessage());
                payload.put("data", data);
            }
        }

        return new DeviceEvent(payload.path("Code").asText(), payload);
    }

    @Nullable String readUntilBlankLine() throws IOException {
        StringBuilder body = new StringBuilder();
        String line;
        while ((line = readLine()) != null && !line.isEmpty()) {
            body.append(line).append('\n');
        }
        if (line == null && body.length() == 0) {
            return null;
        }
        return body.toString().trim();
    }

    /** Reads one CRLF or LF terminated line; null at end of stream. */
    @Nullable String readLine() throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int value;
        boolean readAny = false;
        while ((value = in.read()) != -1) {
            readAny = true;
            if (value == '\n') {
                break;
            }
            buffer.write(value);
        }
        if (!readAny) {
            return null;
        }
        String line = buffer.toString(Charsets.UTF_8);
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
