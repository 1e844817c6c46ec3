package com.mailrag.ingest;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

public class FetchWindowPolicy {
    private final WindowMode mode;
    private final int trailingDays;

    public FetchWindowPolicy(WindowMode mode, int trailingDays) {
        if (mode == WindowMode.TRAILING_DAYS && trailingDays <= 0) {
            throw new IllegalArgumentException("trailingDays must be > 0");
        }
        this.mode = mode;
        this.trailingDays = trailingDays;
    }

    public TimeWindow windowAt(Instant now) {
        Instant start = switch (mode) {
            case MONTH_TO_DATE -> ZonedDateTime.ofInstant(now, ZoneOffset.UTC)
                    .withDayOfMonth(1)
                    .truncatedTo(ChronoUnit.DAYS)
                    .toInstant();
            case TRAILING_DAYS -> now.minus(Duration.ofDays(trailingDays));
        };
        return new TimeWindow(start, now);
    }
}
