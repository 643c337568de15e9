// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.model;

import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Depth-first walk over a definition and the inline definitions it owns.
 *
 * <p>
 * Named references are links, not children, and are never followed: each named
 * definition is visited where it is declared. Walking every top-level
 * declaration therefore visits every node of a document exactly once, even when
 * the graph is cyclic.
 */
public final class TypeWalker {

    private TypeWalker() {
    }

    /**
     * Visits {@code root} and then each inline definition below it, parents first.
     *
     * @param root    the definition to start from
     * @param path    the path of {@code root}
     * @param visitor receives each node with its path
     */
    public static void walk(final TypeDef root, final NodePath path, final BiConsumer<NodePath, TypeDef> visitor) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(visitor, "visitor");
        visit(root, path, visitor);
    }

    private static void visit(final TypeDef node, final NodePath path, final BiConsumer<NodePath, TypeDef> visitor) {
        visitor.accept(path, node);
        if (node instanceof TypeDef.SequenceType sequence) {
            child(sequence.type(), path.key("type"), visitor);
        } else if (node instanceof TypeDef.RecordType record) {
            final List<Field> fields = record.fields();
            for (int i = 0; i < fields.size(); i++) {
                child(fields.get(i).type(), path.key("fields").index(i).key("type"), visitor);
            }
        } else if (node instanceof TypeDef.UnionType union) {
            child(union.discriminator(), path.key("discriminator"), visitor);
            final List<UnionField> fields = union.fields();
            for (int i = 0; i < fields.size(); i++) {
                child(fields.get(i).type(), path.key("fields").index(i).key("type"), visitor);
            }
        }
    }

    private static void child(final TypeRef ref, final NodePath path, final BiConsumer<NodePath, TypeDef> visitor) {
        if (ref instanceof TypeRef.Inline inline) {
            visit(inline.definition(), path, visitor);
        }
    }
}
