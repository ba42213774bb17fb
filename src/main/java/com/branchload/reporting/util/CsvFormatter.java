package com.branchload.reporting.util;

import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAccessor;

/**
 * CSV Formatter Utility - rows for PostgreSQL COPY FROM (FORMAT CSV)
 *
 * Empty unquoted fields load as NULL; everything else goes through its canonical text form.
 */
@UtilityClass
public class CsvFormatter {

    /**
     * Escape one field
     */
    public String escape(Object value) {
        if (value == null) return "";
        if (value instanceof Boolean b) return b ? "t" : "f";
        if (value instanceof Double d) return formatDouble(d);
        if (value instanceof Instant i) return i.atOffset(ZoneOffset.UTC).toString();
        if (value instanceof TemporalAccessor) return value.toString();
        if (value instanceof Enum<?> e) return e.name();

        String str = value.toString();
        if (str.isEmpty()) return "\"\"";
        if (str.contains(",") || str.contains("\"") || str.contains("\n") || str.contains("\r")) {
            return "\"" + str.replace("\"", "\"\"") + "\"";
        }
        return str;
    }

    /**
     * Plain notation, NaN and infinities as NULL
     */
    public String formatDouble(Double value) {
        if (value == null || value.isNaN() || value.isInfinite()) return "";
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    public String joinCsvRow(Object... values) {
        StringBuilder row = new StringBuilder();
        for (int i = 0; i < values.length; i++) {
            if (i > 0) row.append(',');
            row.append(escape(values[i]));
        }
        return row.toString();
    }
}
