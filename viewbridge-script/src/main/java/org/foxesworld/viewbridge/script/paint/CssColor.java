package org.foxesworld.viewbridge.script.paint;

import java.util.Locale;
import java.util.Map;

/**
 * CSS color values as packed ARGB: {@code #rgb}, {@code #rrggbb}, {@code #rrggbbaa},
 * {@code rgb()}, {@code rgba()} and a few names.
 */
public final class CssColor {

    public static final int TRANSPARENT = 0x00000000;
    public static final int WHITE = 0xFFFFFFFF;

    private static final Map<String, Integer> NAMED = Map.of(
            "transparent", TRANSPARENT,
            "white", WHITE,
            "black", 0xFF000000,
            "red", 0xFFFF0000,
            "green", 0xFF008000,
            "lime", 0xFF00FF00,
            "blue", 0xFF0000FF,
            "gray", 0xFF808080,
            "grey", 0xFF808080,
            "yellow", 0xFFFFFF00
    );

    private CssColor() {}

    /** @return ARGB, or null when the value is not a color this parser knows */
    public static Integer parse(String v) {
        if (v == null) return null;
        String s = v.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) return null;
        // "background: #123456 url(...)" -> first token
        if (!s.startsWith("rgb")) {
            int sp = s.indexOf(' ');
            if (sp > 0) s = s.substring(0, sp);
        }
        try {
            if (s.startsWith("#")) return parseHex(s.substring(1));
            if (s.startsWith("rgb")) return parseFunction(s);
        } catch (NumberFormatException e) {
            return null;
        }
        return NAMED.get(s);
    }

    private static Integer parseHex(String hex) {
        switch (hex.length()) {
            case 3 -> {
                int r = Integer.parseInt(hex.substring(0, 1), 16) * 0x11;
                int g = Integer.parseInt(hex.substring(1, 2), 16) * 0x11;
                int b = Integer.parseInt(hex.substring(2, 3), 16) * 0x11;
                return argb(0xFF, r, g, b);
            }
            case 6 -> {
                return 0xFF000000 | Integer.parseInt(hex, 16);
            }
            case 8 -> {
                long rgba = Long.parseLong(hex, 16);
                return argb((int) (rgba & 0xFF), (int) ((rgba >> 24) & 0xFF), (int) ((rgba >> 16) & 0xFF), (int) ((rgba >> 8) & 0xFF));
            }
            default -> {
                return null;
            }
        }
    }

    private static Integer parseFunction(String s) {
        int l = s.indexOf('(');
        int r = s.indexOf(')');
        if (l < 0 || r < l) return null;
        String[] xs = s.substring(l + 1, r).split(",");
        if (xs.length < 3) return null;
        int rr = channel(xs[0]);
        int gg = channel(xs[1]);
        int bb = channel(xs[2]);
        int aa = xs.length >= 4 ? clamp(Math.round(Float.parseFloat(xs[3].trim()) * 255f)) : 0xFF;
        return argb(aa, rr, gg, bb);
    }

    private static int channel(String x) {
        return clamp(Math.round(Float.parseFloat(x.trim())));
    }

    private static int clamp(int v) {
        return Math.max(0, Math.min(255, v));
    }

    public static int argb(int a, int r, int g, int b) {
        return (a << 24) | (r << 16) | (g << 8) | b;
    }
}
