// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.build;

import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.itl.core.error.StructuralError;

/**
 * Output of {@link TypeGraphBuilder}: a linked graph when the document matched
 * the grammar, otherwise every structural error the builder could reach.
 *
 * @param graph  the linked graph, {@code null} whenever {@code errors} is non-empty
 * @param errors structural errors in discovery order
 */
public record BuildResult(@Nullable TypeGraph graph, List<StructuralError> errors) {

    public BuildResult {
        Objects.requireNonNull(errors, "errors");
        errors = List.copyOf(errors);
        if (graph != null && !errors.isEmpty()) {
            throw new IllegalArgumentException("a graph with structural errors must not be exposed");
        }
        if (graph == null && errors.isEmpty()) {
            throw new IllegalArgumentException("a failed build must report at least one error");
        }
    }

    public static BuildResult success(final TypeGraph graph) {
        return new BuildResult(Objects.requireNonNull(graph, "graph"), List.of());
    }

    public static BuildResult failure(final List<StructuralError> errors) {
        return new BuildResult(null, errors);
    }

    public boolean isSuccess() {
        return graph != null;
    }
}
