package com.amcrest2mqtt.telemetry;

import static com.google.common.base.Preconditions.checkArgument;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class StorageUnits {
    static final BigDecimal BYTES_PER_GIGABYTE = BigDecimal.valueOf(1L << 30);

    private StorageUnits() {}

    /** Bytes to binary gigabytes, at most two decimals, e.g. {@code 1610612736 -> "1.5"}, {@code 0 -> "0.0"} */
    public static String toGigabytes(long bytes) {
        checkArgument(bytes >= 0, "Negative byte count %s", bytes);
        return format(BigDecimal.valueOf(bytes).divide(BYTES_PER_GIGABYTE, 2, RoundingMode.HALF_EVEN));
    }

    public static String percent(double usedPercent) {
        return format(BigDecimal.valueOf(usedPercent).setScale(2, RoundingMode.HALF_EVEN));
    }

    /** Trailing zeros dropped, but always one decimal: {@code 50.00 -> "50.0"} */
    static String format(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.setScale(Math.max(1, stripped.scale())).toPlainString();
    }
}
