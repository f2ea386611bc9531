package org.foxesworld.viewbridge.engine.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Typed system property readers with defaults. Malformed values fall back to the default.
 */
public final class Props {

    private static final Logger log = LogManager.getLogger(Props.class);

    private Props() {}

    public static int i32(String key, int def) {
        String raw = System.getProperty(key);
        if (raw == null || raw.isBlank()) return def;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("[vb/config] {}='{}' is not an integer, using {}", key, raw, def);
            return def;
        }
    }

    public static long i64(String key, long def) {
        String raw = System.getProperty(key);
        if (raw == null || raw.isBlank()) return def;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("[vb/config] {}='{}' is not a number, using {}", key, raw, def);
            return def;
        }
    }

    public static boolean bool(String key, boolean def) {
        String raw = System.getProperty(key);
        if (raw == null || raw.isBlank()) return def;
        return Boolean.parseBoolean(raw.trim());
    }

    public static String str(String key, String def) {
        String raw = System.getProperty(key);
        return (raw == null || raw.isBlank()) ? def : raw.trim();
    }

    /** Comma-separated set; blank items are skipped, an empty result yields {@code def}. */
    public static Set<String> csv(String key, Set<String> def) {
        return splitCsv(System.getProperty(key), def);
    }

    static Set<String> splitCsv(String raw, Set<String> def) {
        if (raw == null || raw.isBlank()) return def;
        Set<String> out = new LinkedHashSet<>();
        for (String item : raw.split(",")) {
            String v = item.trim();
            if (!v.isEmpty()) out.add(v);
        }
        return out.isEmpty() ? def : Set.copyOf(out);
    }
}
