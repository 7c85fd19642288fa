package com.amcrest2mqtt.device;

import com.google.common.base.Splitter;
import java.math.BigDecimal;
import java.math.RoundingMode;

/** Parsers for the plain-text {@code key=value} bodies returned by the CGI API. */
final class AmcrestResponses {
    static final Splitter LINE_SPLITTER = Splitter.onPattern("\r?\n").trimResults().omitEmptyStrings();
    static final String BUILD_SEPARATOR = ",build:";
    static final String TOTAL_BYTES_SUFFIX = ".TotalBytes";
    static final String USED_BYTES_SUFFIX = ".UsedBytes";

    private AmcrestResponses() {}

    /** Value of {@code key=...}; a body without any {@code key=} line is returned as is */
    static String value(String body, String key) {
        String prefix = key + "=";
        for (String line : LINE_SPLITTER.split(body)) {
            if (line.startsWith(prefix)) {
                return line.substring(prefix.length()).trim();
            }
        }
        return body.trim();
    }

    /** {@code version=2.800.0000000.8.R,build:2020-05-20} -> {@code 2.800.0000000.8.R} */
    static String softwareVersion(String body) {
        String version = value(body, "version");
        int build = version.indexOf(BUILD_SEPARATOR);
        return build >= 0 ? version.substring(0, build).trim() : version;
    }

    /**
     * Sums {@code list.info[n].Detail[m].TotalBytes / UsedBytes} over every volume.
     *
     * @throws AmcrestException if the body has no capacity lines
     */
    static StorageStats storageStats(String body) throws AmcrestException {
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal used = BigDecimal.ZERO;
        boolean found = false;

        for (String line : LINE_SPLITTER.split(body)) {
            int eq = line.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = line.substring(0, eq);
            String value = line.substring(eq + 1).trim();
            try {
                if (key.endsWith(TOTAL_BYTES_SUFFIX)) {
                    total = total.add(new BigDecimal(value));
                    found = true;
                } else if (key.endsWith(USED_BYTES_SUFFIX)) {
                    used = used.add(new BigDecimal(value));
                    found = true;
                }
            } catch (NumberFormatException e) {
                throw new AmcrestException(String.format("Bad storage value [%s]", line), e);
            }
        }

        if (!found) {
            throw new AmcrestException("No storage information in device response");
        }

        double usedPercent = total.signum() == 0
                ? 0.0
                : used.multiply(BigDecimal.valueOf(100)).divide(total, 2, RoundingMode.HALF_UP).doubleValue();

        return ImmutableStorageStats.builder()
                .usedBytes(used.setScale(0, RoundingMode.HALF_UP).longValueExact())
                .totalBytes(total.setScale(0, RoundingMode.HALF_UP).longValueExact())
                .usedPercent(usedPercent)
                .build();
    }
}
