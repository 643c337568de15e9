// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core;

import static sh.itl.core.AnsiColors.*;

import sh.itl.core.error.SchemaProblem;
import sh.itl.core.error.Stage;

/**
 * Log line formatter for compiler stages, colored with {@link AnsiColors}.
 *
 * <p>
 * Every line starts with a bracketed tag; status symbols (✓ ✗) mark the
 * outcome.
 *
 * <table border="1">
 * <tr>
 * <th>Method</th>
 * <th>Format</th>
 * <th>Color</th>
 * </tr>
 * <tr>
 * <td>formatParse</td>
 * <td>✓ [PARSE]</td>
 * <td>Teal</td>
 * </tr>
 * <tr>
 * <td>formatBuild</td>
 * <td>✓ [BUILD]</td>
 * <td>Teal</td>
 * </tr>
 * <tr>
 * <td>formatValidate</td>
 * <td>✓ [VALIDATE]</td>
 * <td>Teal</td>
 * </tr>
 * <tr>
 * <td>formatRejected</td>
 * <td>✗ [REJECTED]</td>
 * <td>Coral</td>
 * </tr>
 * <tr>
 * <td>formatProblem</td>
 * <td>[CODE] path</td>
 * <td>Amber</td>
 * </tr>
 * </table>
 *
 * <pre>{@code
 * DebugLogger.logStage(LogFormatter.formatParse(bytes.length, micros));
 * // Output: ✓ [PARSE] bytes=412 duration=310μs
 * }</pre>
 *
 * @see DebugLogger
 */
public final class LogFormatter {

    private LogFormatter() {
    }

    /**
     * Format: ✓ [PARSE] bytes=412 duration=310μs
     */
    public static String formatParse(long bytes, long durationMicros) {
        return String.format(
                "%s✓%s %s[PARSE]%s bytes=%d %s",
                TEAL, RESET,
                INDIGO, RESET,
                bytes,
                duration(durationMicros));
    }

    /**
     * Format: ✓ [BUILD] declarations=3 registered=4 duration=120μs
     */
    public static String formatBuild(int declarations, int registered, long durationMicros) {
        return String.format(
                "%s✓%s %s[BUILD]%s declarations=%d registered=%d %s",
                TEAL, RESET,
                INDIGO, RESET,
                declarations,
                registered,
                duration(durationMicros));
    }

    /**
     * Format: ✓ [VALIDATE] named=2 duration=80μs
     */
    public static String formatValidate(int namedTypes, long durationMicros) {
        return String.format(
                "%s✓%s %s[VALIDATE]%s named=%d %s",
                TEAL, RESET,
                INDIGO, RESET,
                namedTypes,
                duration(durationMicros));
    }

    /**
     * Format: ✗ [REJECTED] stage=VALIDATE problems=2 duration=1.2ms
     */
    public static String formatRejected(Stage stage, int problems, long durationMicros) {
        return String.format(
                "%s✗%s %s[REJECTED]%s stage=%s problems=%d %s",
                CORAL, RESET,
                CORAL, RESET,
                stage,
                problems,
                duration(durationMicros));
    }

    /**
     * Format: [OVERLAPPING_LABELS] types[1].fields[1].labels label 1 of 'b' already selects 'a'
     */
    public static String formatProblem(SchemaProblem problem) {
        return String.format(
                "%s[%s]%s %s%s%s %s",
                AMBER, problem.code(), RESET,
                SLATE, problem.path(), RESET,
                problem.detail());
    }

    private static String duration(long micros) {
        return SLATE + "duration=" + AnsiColors.duration(micros) + RESET;
    }
}
