// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.error;

import sh.itl.core.model.NodePath;

/**
 * One reason a document was rejected.
 *
 * <p>
 * Problems are plain data: the compiler returns them instead of logging or
 * throwing, and callers decide how to render them. The three variants never
 * mix stages.
 *
 * <pre>
 * SchemaProblem
 * ├── {@link ParseError}      - malformed JSON (stage PARSE)
 * ├── {@link StructuralError} - grammar shape or unknown name (stage BUILD)
 * └── {@link ValidationError} - semantic rule violation (stage VALIDATE)
 * </pre>
 */
public sealed interface SchemaProblem permits ParseError, StructuralError, ValidationError {

    Stage stage();

    /**
     * Location of the offending node; the root path for parse errors.
     *
     * @return the node path
     */
    NodePath path();

    /**
     * Stable machine-readable identifier of the problem kind.
     *
     * @return e.g. {@code UNKNOWN_TYPE_REFERENCE} or {@code OVERLAPPING_LABELS}
     */
    String code();

    String detail();

    /**
     * Renders the problem on one line: {@code STAGE CODE at path: detail}.
     *
     * @return the rendered problem
     */
    default String render() {
        return stage() + " " + code() + " at " + path() + ": " + detail();
    }
}
