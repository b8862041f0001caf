package com.cmdiag.patterns.model;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Pattern ids are derived from the first analyzed sample so the same input
 * always yields the same ids.
 */
public final class PatternIds {

    private static final DateTimeFormatter SUFFIX_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private PatternIds() {}

    public static String of(String prefix, LocalDateTime firstTimestamp) {
        return prefix + "-" + suffix(firstTimestamp);
    }

    public static String suffix(LocalDateTime firstTimestamp) {
        return firstTimestamp != null ? firstTimestamp.format(SUFFIX_FORMAT) : "empty";
    }

    /**
     * Id that stays the same across scans of one system, however the scanned
     * window moves: {@code auto-<systemId>-<slug of name>}.
     */
    public static String scoped(String systemId, String name) {
        String slug = name == null ? "unnamed" : name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-|-$)", "");
        return "auto-" + systemId + "-" + slug;
    }
}
