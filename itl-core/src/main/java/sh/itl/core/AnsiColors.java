// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core;

/**
 * ANSI palette for terminal output with TTY detection.
 *
 * <p>
 * Colors are empty strings when no console is attached, unless
 * {@code FORCE_COLOR=true} is set, so the constants are always safe to
 * concatenate.
 *
 * <ul>
 * <li><b>TEAL</b> accepted documents and passed stages</li>
 * <li><b>CORAL</b> rejections and problems</li>
 * <li><b>INDIGO</b> stage headers</li>
 * <li><b>AMBER</b> problem codes</li>
 * <li><b>SLATE</b> metadata such as paths and durations</li>
 * </ul>
 *
 * @see LogFormatter
 */
public final class AnsiColors {

    static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    /** ANSI reset code - clears all formatting */
    public static final String RESET = ansi("0");

    public static final String TEAL = ansi("38;5;44");

    public static final String CORAL = ansi("38;5;204");

    public static final String INDIGO = ansi("38;5;99");

    public static final String AMBER = ansi("38;5;214");

    public static final String SLATE = ansi("38;5;247");

    public static final String BOLD = ansi("1");

    private AnsiColors() {
    }

    private static String ansi(final String code) {
        return IS_TTY ? "\u001B[" + code + "m" : "";
    }

    /**
     * Formats a duration in microseconds as a human-readable string.
     *
     * @param micros duration in microseconds
     * @return formatted duration (e.g., "850μs", "1.5ms" or "2.30s")
     */
    public static String duration(final long micros) {
        if (micros < 1000)
            return micros + "μs";
        if (micros < 1_000_000)
            return String.format("%.1fms", micros / 1000.0);
        return String.format("%.2fs", micros / 1_000_000.0);
    }

    /**
     * Formats a key-value pair with colored key.
     *
     * @param key   the key name
     * @param value the value
     * @return formatted "{@code key value}" with colored key
     */
    public static String kv(final String key, final String value) {
        return SLATE + key + RESET + " " + value;
    }

    public static String success(final String message) {
        return TEAL + "✓" + RESET + " " + message;
    }

    public static String error(final String message) {
        return CORAL + "✗" + RESET + " " + message;
    }
}
