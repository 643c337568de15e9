// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for compiler stages, gated by {@link ItlDebug}.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.itl.debug");

    private DebugLogger() {
    }

    public static void logStage(final String message) {
        if (!ItlDebug.isStageLoggingEnabled()) {
            return;
        }
        logDirect(message);
    }

    public static void logProblem(final String message) {
        if (!ItlDebug.isProblemLoggingEnabled()) {
            return;
        }
        logDirect(message);
    }

    /**
     * Colored lines go straight to stdout on a TTY; everything else goes
     * through SLF4J.
     */
    private static void logDirect(final String message) {
        if (AnsiColors.IS_TTY) {
            System.out.println(message);
        } else {
            LOG.info(message);
        }
    }
}
