// FILE: PathNorm.java
package org.foxesworld.viewbridge.engine.vfs;

// Author: Calista Verner

import java.util.Locale;

/**
 * Resource path normalization shared by overlay registration and engine lookups.
 */
public final class PathNorm {
    private PathNorm() {}

    private static final String FILE_SCHEME = "file:///";

    /**
     * Case-preserving normal form: separators become '/', a {@code file:///} prefix,
     * query and fragment are dropped, leading "./" and "/" are stripped, runs of '/' collapse.
     */
    public static String normalize(String path) {
        if (path == null) return "";
        String p = path.trim().replace('\\', '/');

        if (p.regionMatches(true, 0, FILE_SCHEME, 0, FILE_SCHEME.length())) {
            p = p.substring(FILE_SCHEME.length());
        }

        int q = p.indexOf('?');
        if (q >= 0) p = p.substring(0, q);
        int h = p.indexOf('#');
        if (h >= 0) p = p.substring(0, h);

        while (p.startsWith("./")) p = p.substring(2);
        while (p.startsWith("/")) p = p.substring(1);

        return p.replaceAll("/{2,}", "/");
    }

    /** Overlay key: {@link #normalize(String)} lower-cased. */
    public static String key(String path) {
        return normalize(path).toLowerCase(Locale.ROOT);
    }

    /** Lower-cased extension of the last segment without the dot, or "" */
    public static String extensionOf(String path) {
        String p = normalize(path);
        int slash = p.lastIndexOf('/');
        int dot = p.lastIndexOf('.');
        if (dot <= slash || dot == p.length() - 1) return "";
        return p.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /** Join two segments with a single '/'. */
    public static String join(String a, String b) {
        String aa = (a == null) ? "" : a.replace('\\', '/');
        String bb = (b == null) ? "" : b.replace('\\', '/');

        if (aa.endsWith("/")) aa = aa.substring(0, aa.length() - 1);
        while (bb.startsWith("/")) bb = bb.substring(1);

        String out = aa.isEmpty() ? bb : (aa + "/" + bb);
        return out.replaceAll("/{2,}", "/");
    }
}
