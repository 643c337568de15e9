// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.error;

import java.util.Objects;

import sh.itl.core.model.NodePath;

/**
 * Well-formed JSON that does not match the ITL grammar at {@code path}, or an
 * unresolvable type name.
 *
 * @param errorCode the failure kind
 * @param path      the offending node
 * @param detail    human-readable explanation
 */
public record StructuralError(StructuralErrorCode errorCode, NodePath path, String detail) implements SchemaProblem {

    public StructuralError {
        Objects.requireNonNull(errorCode, "errorCode");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(detail, "detail");
    }

    // ═══════════════════════════════════════════════════════════════
    // Factory methods for specific error conditions
    // ═══════════════════════════════════════════════════════════════

    public static StructuralError missingKey(final NodePath path, final String key) {
        return new StructuralError(StructuralErrorCode.MISSING_KEY, path.key(key),
                "required key '%s' is missing".formatted(key));
    }

    public static StructuralError wrongValueKind(final NodePath path, final String expected, final String actual) {
        return new StructuralError(StructuralErrorCode.WRONG_VALUE_KIND, path,
                "expected %s but found %s".formatted(expected, actual));
    }

    public static StructuralError unknownTypeReference(final NodePath path, final String name) {
        return new StructuralError(StructuralErrorCode.UNKNOWN_TYPE_REFERENCE, path,
                "no type named '%s' is declared in this document".formatted(name));
    }

    public static StructuralError duplicateTypeName(final NodePath path, final String name, final NodePath first) {
        return new StructuralError(StructuralErrorCode.DUPLICATE_TYPE_NAME, path,
                "type name '%s' is already declared at %s".formatted(name, first));
    }

    @Override
    public Stage stage() {
        return Stage.BUILD;
    }

    @Override
    public String code() {
        return errorCode.name();
    }
}
