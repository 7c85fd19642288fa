package com.amcrest2mqtt.device;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class AmcrestResponsesTest {
    @Test
    public void value() {
        assertEquals("AD410", AmcrestResponses.value("type=AD410\r\n", "type"));
        assertEquals("Front Door", AmcrestResponses.value("name=Front Door\r\n", "name"));
        assertEquals("raw", AmcrestResponses.value(" raw \r\n", "sn"));
    }

    @Test
    public void softwareVersion() {
        assertEquals("2.800.0000000.8.R",
                AmcrestResponses.softwareVersion("version=2.800.0000000.8.R,build:2020-05-20\r\n"));
        assertEquals("1.0.0", AmcrestResponses.softwareVersion("version=1.0.0\r\n"));
    }

    @Test
    public void storageStatsAreSummedOverVolumes() throws AmcrestException {
        String body = "list.info[0].Detail[0].IsError=false\r\n"
                + "list.info[0].Detail[0].TotalBytes=32000000000.000000\r\n"
                + "list.info[0].Detail[0].UsedBytes=8000000000.000000\r\n"
                + "list.info[1].Detail[0].TotalBytes=8000000000.000000\r\n"
                + "list.info[1].Detail[0].UsedBytes=2000000000.000000\r\n";

        StorageStats stats = AmcrestResponses.storageStats(body);

        assertEquals(40000000000L, stats.totalBytes());
        assertEquals(10000000000L, stats.usedBytes());
        assertEquals(25.0, stats.usedPercent());
    }

    @Test
    public void emptyStorageHasZeroPercent() throws AmcrestException {
        StorageStats stats = AmcrestResponses.storageStats(
                "list.info[0].Detail[0].TotalBytes=0\r\nlist.info[0].Detail[0].UsedBytes=0\r\n");

        assertEquals(0.0, stats.usedPercent());
    }

    @Test
    public void storageWithoutCapacityLinesFails() {
        assertThrows(AmcrestException.class, () -> AmcrestResponses.storageStats("Error\r\nBad Request!\r\n"));
    }
}
