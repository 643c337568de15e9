// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.error;

import java.util.List;
import java.util.Objects;

/**
 * Thrown when a caller demands a validated graph from a rejected document.
 *
 * <pre>{@code
 * try {
 *     ValidatedGraph graph = ItlSchema.compileOrThrow(json);
 * } catch (SchemaRejectedException e) {
 *     System.err.println("Rejected at " + e.stage());
 *     e.problems().forEach(p -> System.err.println(p.render()));
 * }
 * }</pre>
 */
public final class SchemaRejectedException extends ItlException {

    private final Stage stage;
    private final List<SchemaProblem> problems;

    public SchemaRejectedException(final Stage stage, final List<? extends SchemaProblem> problems) {
        super(messageFor(stage, problems));
        this.stage = Objects.requireNonNull(stage, "stage");
        this.problems = List.copyOf(problems);
    }

    private static String messageFor(final Stage stage, final List<? extends SchemaProblem> problems) {
        StringBuilder sb = new StringBuilder("ITL document rejected at ")
                .append(stage)
                .append(" with ")
                .append(problems.size())
                .append(problems.size() == 1 ? " problem" : " problems");
        for (SchemaProblem problem : problems) {
            sb.append(System.lineSeparator()).append("  ").append(problem.render());
        }
        return sb.toString();
    }

    public Stage stage() {
        return stage;
    }

    public List<SchemaProblem> problems() {
        return problems;
    }
}
