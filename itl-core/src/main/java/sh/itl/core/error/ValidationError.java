// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.error;

import java.util.List;
import java.util.Objects;

import sh.itl.core.model.NodePath;

/**
 * A semantic rule violated at {@code path}.
 *
 * @param rule    the violated rule
 * @param path    the offending node
 * @param detail  human-readable explanation
 * @param related other nodes taking part in the violation, e.g. the first of two
 *                fields sharing a name
 */
public record ValidationError(ValidationRule rule, NodePath path, String detail, List<NodePath> related)
        implements SchemaProblem {

    public ValidationError {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(detail, "detail");
        Objects.requireNonNull(related, "related");
        related = List.copyOf(related);
    }

    public ValidationError(final ValidationRule rule, final NodePath path, final String detail) {
        this(rule, path, detail, List.of());
    }

    @Override
    public Stage stage() {
        return Stage.VALIDATE;
    }

    @Override
    public String code() {
        return rule.name();
    }
}
