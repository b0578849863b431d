package com.flagship.bookstore.web;

/**
 * Maps stream versions to HTTP entity tags and back.
 *
 * Tags are strong and carry the decimal version: version 2 is {@code "2"}. A representation
 * that also serves statistics folded from other streams appends their document version,
 * {@code "2.5"}, so a statistics change alone still changes the tag. The leading part is
 * always the entity's stream version and is what {@code If-Match} is checked against.
 */
public final class ETags {

    private ETags() {
    }

    public static String generate(long version) {
        if (version < 0) {
            throw new IllegalArgumentException("Version cannot be negative: " + version);
        }
        return "\"" + version + "\"";
    }

    /**
     * Tag for an entity served together with its statistics document.
     *
     * @param statisticsVersion version of the statistics document, 0 if there is none
     */
    public static String generate(long version, long statisticsVersion) {
        if (statisticsVersion < 0) {
            throw new IllegalArgumentException("Statistics version cannot be negative: " + statisticsVersion);
        }
        String plain = generate(version);
        if (statisticsVersion == 0) {
            return plain;
        }
        return plain.substring(0, plain.length() - 1) + "." + statisticsVersion + "\"";
    }

    /**
     * Parses {@code "v"}, {@code "v.s"}, their weak forms or a bare value.
     *
     * @return the stream version, or null if the value is missing, malformed or negative
     */
    public static Long parse(String etag) {
        long[] parts = parts(etag);
        return parts == null ? null : parts[0];
    }

    /**
     * Whether an {@code If-None-Match} style header matches the current tag.
     * Accepts a comma-separated list and {@code *}; weak and strong forms compare equal.
     */
    public static boolean matches(String header, String currentETag) {
        if (header == null || header.isBlank()) {
            return false;
        }
        long[] current = parts(currentETag);
        for (String candidate : header.split(",")) {
            String trimmed = candidate.trim();
            if ("*".equals(trimmed)) {
                return true;
            }
            long[] parts = parts(trimmed);
            if (parts != null && current != null && parts[0] == current[0] && parts[1] == current[1]) {
                return true;
            }
        }
        return false;
    }

    /**
     * Stream version and statistics version of a tag; the latter is 0 when absent.
     */
    private static long[] parts(String etag) {
        if (etag == null) {
            return null;
        }
        String value = etag.trim();
        if (value.startsWith("W/")) {
            value = value.substring(2);
        }
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            value = value.substring(1, value.length() - 1);
        }
        int dot = value.indexOf('.');
        Long version = number(dot < 0 ? value : value.substring(0, dot));
        Long statisticsVersion = dot < 0 ? Long.valueOf(0) : number(value.substring(dot + 1));
        if (version == null || statisticsVersion == null) {
            return null;
        }
        return new long[]{version, statisticsVersion};
    }

    private static Long number(String value) {
        if (value.isEmpty() || !value.chars().allMatch(Character::isDigit)) {
            return null;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
