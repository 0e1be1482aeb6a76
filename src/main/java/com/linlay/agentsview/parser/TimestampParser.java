package com.linlay.agentsview.parser;

import org.springframework.util.StringUtils;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

/**
 * Parses the timestamp strings found in agent logs. Layouts are tried in order and the
 * first match wins; the result is always UTC.
 */
public final class TimestampParser {

    private static final DateTimeFormatter SPACE_SEPARATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final List<Function<String, Instant>> LAYOUTS = List.of(
            raw -> OffsetDateTime.parse(raw, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant(),
            raw -> Instant.from(DateTimeFormatter.ISO_INSTANT.parse(raw)),
            raw -> LocalDateTime.parse(raw, SPACE_SEPARATED).toInstant(ZoneOffset.UTC)
    );

    private TimestampParser() {
    }

    /**
     * @return the parsed instant, or {@code null} when the value is blank or matches no layout
     */
    public static Instant parse(String raw) {
        if (!StringUtils.hasText(raw)) {
            return null;
        }
        String value = raw.trim();
        for (Function<String, Instant> layout : LAYOUTS) {
            try {
                return layout.apply(value);
            } catch (DateTimeParseException ex) {
                // try the next layout
            }
        }
        return null;
    }

    /**
     * Storage form: RFC3339 in UTC, or an empty string for a missing time.
     */
    public static String format(Instant instant) {
        return instant == null ? "" : DateTimeFormatter.ISO_INSTANT.format(instant);
    }
}
