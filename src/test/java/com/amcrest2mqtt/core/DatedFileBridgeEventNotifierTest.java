package com.amcrest2mqtt.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class DatedFileBridgeEventNotifierTest {
    @Test
    public void appendsEventsToTodaysJournal(@TempDir Path folder) throws Exception {
        File eventsFolder = folder.resolve("events").toFile();
        DatedFileBridgeEventNotifier notifier = new DatedFileBridgeEventNotifier(eventsFolder);

        notifier.notifyEvent("test", BridgeEventType.MQTT_CONNECTED, "Front Door", "Connected", "details");
        notifier.notifyEvent("test", BridgeEventType.SHUTDOWN_REQUESTED, null, "Shutting down", null);

        String fileName = LocalDate.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd"))
                + "-amcrest2mqtt-events.log";
        File journal = new File(eventsFolder, fileName);
        assertTrue(journal.exists());

        String content = new String(Files.readAllBytes(journal.toPath()), StandardCharsets.UTF_8);
        assertTrue(content.contains("[MQTT_CONNECTED]. Device [Front Door]"), content);
        assertTrue(content.contains("[SHUTDOWN_REQUESTED]. Device [null]"), content);
        List<String> eventLines = Files.readAllLines(journal.toPath(), StandardCharsets.UTF_8);
        assertEquals(4, eventLines.size());
    }

    @Test
    public void eventMessageFormat() {
        String message = DatedFileBridgeEventNotifier.getEventMessageStr(0L, "reporter",
                BridgeEventType.DEVICE_UNREACHABLE, "cam", "title", "details");

        assertTrue(message.startsWith("[DEVICE_UNREACHABLE]. Device [cam] Time: ["), message);
        assertTrue(message.endsWith("Reporter: [reporter]; [title]:\n\tdetails"), message);
    }
}
