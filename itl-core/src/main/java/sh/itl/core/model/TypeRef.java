// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.model;

import java.util.Objects;

/**
 * A Type position of the grammar: either a link to a named definition or an
 * inline definition owned by the containing node.
 *
 * <p>Named links never embed the referenced node. They carry the registry
 * identifier, so self and mutual references form a graph without ownership
 * cycles. Resolve them through the graph that produced them.
 */
public sealed interface TypeRef permits TypeRef.Named, TypeRef.Inline, TypeRef.Unresolved {

    /**
     * Renders the reference as a short label for messages.
     *
     * @return the referenced name, or a signature for inline definitions
     */
    String describe();

    /**
     * Non-owning link to a named definition held by the registry.
     *
     * @param name the referenced name as spelled in the document
     * @param id   the registry slot of the definition
     */
    record Named(String name, TypeId id) implements TypeRef {
        public Named {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(id, "id");
        }

        @Override
        public String describe() {
            return name;
        }
    }

    /**
     * Anonymous (or locally named) definition owned by the containing node.
     *
     * @param definition the owned definition
     */
    record Inline(TypeDef definition) implements TypeRef {
        public Inline {
            Objects.requireNonNull(definition, "definition");
        }

        @Override
        public String describe() {
            return TypeNames.describe(definition);
        }
    }

    /**
     * Marker for a name with no matching definition. Only ever produced while a
     * document is being built; a graph containing one is never accepted.
     *
     * @param name the unknown name
     */
    record Unresolved(String name) implements TypeRef {
        public Unresolved {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String describe() {
            return "?" + name;
        }
    }
}
