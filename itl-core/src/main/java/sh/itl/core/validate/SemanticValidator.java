// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.validate;

import java.util.List;
import java.util.Objects;

import sh.itl.core.build.TypeGraph;
import sh.itl.core.model.TypeWalker;

/**
 * Runs every semantic rule over a linked graph and aggregates the violations.
 *
 * <p>
 * Local rules run on each definition node reached from {@code Root.types},
 * inline ones included; the recursion rule runs once over the registry. No
 * rule short-circuits another, so a rejected document lists all of its
 * problems.
 *
 * <p>
 * The validator is stateless and thread-safe.
 */
public final class SemanticValidator {

    private final List<NodeCheck> checks = List.of(
            new NameUniquenessCheck(),
            new ExtentCheck(),
            new NumericCheck(),
            new UnionCheck(),
            new LegacyValueCheck());

    private final RecursionCheck recursion = new RecursionCheck();

    public ValidationResult validate(final TypeGraph graph) {
        Objects.requireNonNull(graph, "graph");
        final CheckContext context = new CheckContext(graph.registry());
        for (TypeGraph.Declaration declaration : graph.declarations()) {
            TypeWalker.walk(declaration.definition(), declaration.path(), (path, node) -> {
                for (NodeCheck check : checks) {
                    check.check(path, node, context);
                }
            });
        }
        recursion.check(context);

        if (!context.errors().isEmpty()) {
            return new ValidationResult(null, context.errors());
        }
        return new ValidationResult(new ValidatedGraph(graph), List.of());
    }
}
