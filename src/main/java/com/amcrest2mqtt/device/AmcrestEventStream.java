package com.amcrest2mqtt.device;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Event stream that reconnects on I/O errors. Gives up with an {@link AmcrestException} after more than
 * {@code retries} consecutive failed attempts; every event received resets the count.
 */
public class AmcrestEventStream implements DeviceEventStream {
    final static Logger LOGGER = LoggerFactory.getLogger(AmcrestEventStream.class);

    static final int MAX_POWER_OF_2 = 6;

    @FunctionalInterface
    public interface Opener {
        InputStream open() throws AmcrestException, IOException;
    }

    final Opener opener;
    final int retries;
    final Duration retryBaseDelay;

    @Nullable InputStream body;
    @Nullable EventStreamParser parser;
    int failedAttempts;
    volatile boolean closed;

    public AmcrestEventStream(Opener opener, int retries, Duration retryBaseDelay) {
        this.opener = opener;
        this.retries = retries;
        this.retryBaseDelay = retryBaseDelay;
    }

    @Override
    public DeviceEvent take() throws AmcrestException, InterruptedException {
        while (true) {
            if (closed) {
                throw new AmcrestException("Event stream closed");
            }

            try {
                EventStreamParser currentParser = parser;
                if (currentParser == null) {
                    body = new BufferedInputStream(opener.open());
                    currentParser = new EventStreamParser(body);
                    parser = currentParser;
                    LOGGER.info("Event stream connected");
                }

                String part = currentParser.nextPart();
                if (part == null) {
                    throw new IOException("Event stream ended");
                }

                DeviceEvent event = EventStreamParser.parseEvent(part);
                if (event != null) {
                    failedAttempts = 0;
                    return event;
                }
                LOGGER.trace("Skipping stream part [{}]", part);
            } catch (IOException | AmcrestException e) {
                closeBody();
                if (closed) {
                    throw new AmcrestException("Event stream closed", e);
                }

                failedAttempts++;
                if (failedAttempts > retries) {
                    throw new AmcrestException(
                            String.format("Event stream failed %d times in a row, giving up", failedAttempts), e);
                }

                long delayMs = retryBaseDelay.toMillis() * (1L << Math.min(failedAttempts - 1, MAX_POWER_OF_2));
                LOGGER.warn("Event stream error: {}. Reconnecting in {} ms, attempt {}/{}",
                        e.getMessage(), delayMs, failedAttempts, retries);
                Thread.sleep(delayMs);
            }
        }
    }

    void closeBody() {
        InputStream current = body;
        body = null;
        parser = null;
        if (current != null) {
            try {
                current.close();
            } catch (IOException e) {
                LOGGER.debug("Error closing event stream body", e);
            }
        }
    }

    @Override
    public void close() {
        closed = true;
        closeBody();
    }
}
