package com.rvctrl.generator.signal;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.Objects;

/**
 * Time-based record identifiers and timestamps.
 */
public class SignalIdGenerator {

    public static final DateTimeFormatter CREATED_AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /** Microsecond resolution keeps ids of signals created in the same second apart. */
    public static final DateTimeFormatter SIGNAL_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSSSSS");

    public static final DateTimeFormatter FILE_STAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Clock clock;

    public SignalIdGenerator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    public String fileStamp() {
        return FILE_STAMP_FORMAT.format(now());
    }

    /**
     * Appends {@code _1}, {@code _2}, ... until the id is not in {@code existingIds}.
     */
    public static String makeUnique(String id, Collection<String> existingIds) {
        if (!existingIds.contains(id)) {
            return id;
        }
        int suffix = 1;
        while (existingIds.contains(id + "_" + suffix)) {
            suffix++;
        }
        return id + "_" + suffix;
    }
}
