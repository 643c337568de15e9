// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core;

import java.util.List;
import java.util.Objects;

import sh.itl.core.error.SchemaProblem;
import sh.itl.core.error.SchemaRejectedException;
import sh.itl.core.error.Stage;
import sh.itl.core.validate.ValidatedGraph;

/**
 * Outcome of compiling one ITL document.
 *
 * <p>
 * Exactly one of the two variants is produced: an {@link Accepted} graph, or
 * the {@link Rejected} problems of the first stage that failed. Later stages
 * never run on a rejected input, so problems of different stages never mix.
 *
 * <pre>{@code
 * SchemaResult result = ItlSchema.parseAndValidate(bytes);
 * if (result instanceof SchemaResult.Rejected rejected) {
 *     rejected.problems().forEach(p -> System.err.println(p.render()));
 * }
 * }</pre>
 */
public sealed interface SchemaResult permits SchemaResult.Accepted, SchemaResult.Rejected {

    boolean isAccepted();

    /**
     * Returns the problems that rejected the document.
     *
     * @return the problems, empty for an accepted document
     */
    List<SchemaProblem> problems();

    /**
     * Returns the validated graph.
     *
     * @return the graph
     * @throws SchemaRejectedException if the document was rejected
     */
    ValidatedGraph graphOrThrow();

    record Accepted(ValidatedGraph graph) implements SchemaResult {
        public Accepted {
            Objects.requireNonNull(graph, "graph");
        }

        @Override
        public boolean isAccepted() {
            return true;
        }

        @Override
        public List<SchemaProblem> problems() {
            return List.of();
        }

        @Override
        public ValidatedGraph graphOrThrow() {
            return graph;
        }
    }

    /**
     * A rejected document.
     *
     * @param stage    the stage that failed
     * @param problems every problem that stage found, never empty
     */
    record Rejected(Stage stage, List<SchemaProblem> problems) implements SchemaResult {
        public Rejected {
            Objects.requireNonNull(stage, "stage");
            Objects.requireNonNull(problems, "problems");
            problems = List.copyOf(problems);
            if (problems.isEmpty()) {
                throw new IllegalArgumentException("a rejection must carry at least one problem");
            }
            for (SchemaProblem problem : problems) {
                if (problem.stage() != stage) {
                    throw new IllegalArgumentException(
                            "problem of stage " + problem.stage() + " in a " + stage + " rejection");
                }
            }
        }

        @Override
        public boolean isAccepted() {
            return false;
        }

        @Override
        public ValidatedGraph graphOrThrow() {
            throw new SchemaRejectedException(stage, problems);
        }
    }
}
