package com.mailrag.ingest;

import java.text.ParsePosition;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Optional;

public final class MessageDates {
    private static final DateTimeFormatter RFC_2822_NO_ZONE = DateTimeFormatter.ofPattern("[EEE, ]d MMM yyyy HH:mm[:ss]", Locale.ENGLISH);

    private MessageDates() {
    }

    public static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("date value is blank");
        }
        String text = value.trim().replaceAll("\\s*\\([^)]*\\)\\s*$", "").replaceAll("\\s+", " ");
        try {
            Optional<TemporalAccessor> zoned = tryParse(DateTimeFormatter.RFC_1123_DATE_TIME, text)
                    .or(() -> tryParse(DateTimeFormatter.ISO_OFFSET_DATE_TIME, text));
            if (zoned.isPresent()) {
                return OffsetDateTime.from(zoned.get()).toInstant();
            }
            Optional<TemporalAccessor> local = tryParse(DateTimeFormatter.ISO_LOCAL_DATE_TIME, text)
                    .or(() -> tryParse(RFC_2822_NO_ZONE, text));
            if (local.isPresent()) {
                return LocalDateTime.from(local.get()).toInstant(ZoneOffset.UTC);
            }
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid date: " + value, e);
        }
        throw new IllegalArgumentException("Unrecognized date: " + value);
    }

    private static Optional<TemporalAccessor> tryParse(DateTimeFormatter formatter, String text) {
        ParsePosition position = new ParsePosition(0);
        TemporalAccessor unresolved = formatter.parseUnresolved(text, position);
        if (unresolved == null || position.getErrorIndex() >= 0 || position.getIndex() != text.length()) {
            return Optional.empty();
        }
        return Optional.of(formatter.parse(text));
    }
}
