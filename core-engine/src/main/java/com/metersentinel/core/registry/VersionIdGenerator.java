package com.metersentinel.core.registry;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Issues timestamp-derived version ids of the form {@code vyyyyMMdd_HHmmss}.
 *
 * <p>
 * Ids are strictly increasing even when the clock has not advanced (or went
 * backwards) since the previous id; such ids get a {@code _n} suffix.
 * </p>
 *
 * @since 1.0.0
 */
public class VersionIdGenerator {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("'v'yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private String last;

    /**
     * @param clock  source of the timestamp
     * @param seedId highest id already issued, or {@code null}
     */
    public VersionIdGenerator(Clock clock, String seedId) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.last = seedId;
    }

    public synchronized String next() {
        String base = FORMAT.format(clock.instant());
        String candidate = base;
        int suffix = 1;
        while (last != null && compare(candidate, last) <= 0) {
            String lastBase = baseOf(last);
            if (compare(base, lastBase) < 0) {
                base = lastBase;
            }
            candidate = base + "_" + suffix++;
        }
        last = candidate;
        return candidate;
    }

    /**
     * Order ids by timestamp, then numerically by suffix.
     */
    static int compare(String a, String b) {
        int byBase = baseOf(a).compareTo(baseOf(b));
        if (byBase != 0) {
            return byBase;
        }
        return Integer.compare(suffixOf(a), suffixOf(b));
    }

    private static String baseOf(String id) {
        return id.length() > 16 ? id.substring(0, 16) : id;
    }

    private static int suffixOf(String id) {
        return id.length() > 17 ? Integer.parseInt(id.substring(17)) : 0;
    }
}
