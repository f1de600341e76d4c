package com.lynkvertx.vzev.model;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * One 15-minute measurement interval, identified by its physical start instant.
 * The local civil start is kept for day grouping and display; on a fall-back day two
 * slots share the same local start.
 */
@Value
public class Slot implements Comparable<Slot> {

    Instant start;
    LocalDateTime localStart;

    public static Slot of(Instant start, ZoneId zone) {
        return new Slot(start, LocalDateTime.ofInstant(start, zone));
    }

    @Override
    public int compareTo(Slot other) {
        return start.compareTo(other.start);
    }
}
