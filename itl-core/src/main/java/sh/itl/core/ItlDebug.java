// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core;

/**
 * Global toggle for verbose compiler logging.
 *
 * <p>Stage logging reports each pipeline stage with its duration; problem
 * logging additionally prints every problem of a rejected document. The fields
 * are volatile; the compound check in {@link #isEnabled()} is not atomic, which
 * only matters for a log line or two while the flags change.
 */
public final class ItlDebug {

    private static volatile boolean stageLogging = false;
    private static volatile boolean problemLogging = false;

    private ItlDebug() {
    }

    public static boolean isEnabled() {
        return stageLogging || problemLogging;
    }

    public static void setEnabled(final boolean enabled) {
        stageLogging = enabled;
        problemLogging = enabled;
    }

    public static void setStageLogging(final boolean enabled) {
        stageLogging = enabled;
    }

    public static boolean isStageLoggingEnabled() {
        return stageLogging;
    }

    public static void setProblemLogging(final boolean enabled) {
        problemLogging = enabled;
    }

    public static boolean isProblemLoggingEnabled() {
        return problemLogging;
    }
}
