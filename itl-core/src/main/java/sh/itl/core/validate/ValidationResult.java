// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.validate;

import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.itl.core.error.ValidationError;

/**
 * Outcome of validation: the accepted graph or every violated rule, never both.
 *
 * @param graph  the accepted graph, or {@code null} when {@code errors} is non-empty
 * @param errors all violations in check order
 */
public record ValidationResult(@Nullable ValidatedGraph graph, List<ValidationError> errors) {

    public ValidationResult {
        Objects.requireNonNull(errors, "errors");
        errors = List.copyOf(errors);
        if ((graph == null) == errors.isEmpty()) {
            throw new IllegalArgumentException("exactly one of graph or errors must be present");
        }
    }

    public boolean isValid() {
        return graph != null;
    }
}
