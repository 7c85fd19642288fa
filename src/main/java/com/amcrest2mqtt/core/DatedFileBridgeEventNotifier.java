package com.amcrest2mqtt.core;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs lifecycle events and appends them to a per-day journal file. */
public class DatedFileBridgeEventNotifier implements BridgeEventNotifier {
    final static Logger LOGGER = LoggerFactory.getLogger(DatedFileBridgeEventNotifier.class);
    final static DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    final static DateTimeFormatter DATE_TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    final static String EVENTS_FILENAME_SUFFIX = "-amcrest2mqtt-events.log";

    protected @Nullable BufferedWriter currentEventFileWriter;
    protected @Nullable String currentEventFileName = null;
    protected final File eventsFolder;

    public DatedFileBridgeEventNotifier(File eventsFolder) {
        this.eventsFolder = eventsFolder;
        if (!eventsFolder.exists()) {
            eventsFolder.mkdirs();
        }
    }

    public static String getEventMessageStr(Long eventTimeMs, String eventReporter, BridgeEventType eventType,
                                            @Nullable String deviceName, String eventTitle, @Nullable String eventDetails) {
        LocalDateTime eventDateTime = Instant.ofEpochMilli(eventTimeMs).atZone(ZoneId.systemDefault()).toLocalDateTime();
        return String.format("[%s]. Device [%s] Time: [%s]; Reporter: [%s]; [%s]:\n\t%s",
                eventType, deviceName, eventDateTime.format(DATE_TIME_FORMATTER), eventReporter, eventTitle, eventDetails);
    }

    protected BufferedWriter getEventFileWriter() throws IOException {
        String newDateStr = LocalDate.now().format(DATE_FORMATTER);
        String newEventFileName = String.format("%s%s", newDateStr, EVENTS_FILENAME_SUFFIX);

        if (!newEventFileName.equals(currentEventFileName)) {
            if (currentEventFileWriter != null) {
                currentEventFileWriter.close();
            }
            currentEventFileName = newEventFileName;
            File eventFile = new File(eventsFolder, currentEventFileName);
            if (!eventFile.exists()) {
                eventFile.createNewFile();
            }
            currentEventFileWriter = new BufferedWriter(new FileWriter(eventFile, true));
        }

        return checkNotNull(currentEventFileWriter);
    }

    @Override
    public synchronized void notifyEvent(Long eventTimeMs, String eventReporter, BridgeEventType eventType,
                                         @Nullable String deviceName, String eventTitle, @Nullable String eventDetails) {
        String eventMessage = getEventMessageStr(eventTimeMs, eventReporter, eventType, deviceName, eventTitle, eventDetails);
        LOGGER.warn("!!!EVENT!!! {}", eventMessage);
        try {
            String timestamp = LocalDateTime.now().format(DATE_TIME_FORMATTER);
            BufferedWriter fileWriter = getEventFileWriter();
            fileWriter.write(String.format("%s %s%n", timestamp, eventMessage));
            fileWriter.flush();
        } catch (IOException e) {
            // journal failures are never fatal
            LOGGER.error("Can't write event journal in {}", eventsFolder, e);
        }
    }
}
