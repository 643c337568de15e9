// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.build;

import java.util.List;
import java.util.Objects;

import sh.itl.core.model.NodePath;
import sh.itl.core.model.Note;
import sh.itl.core.model.TypeDef;

/**
 * A document after the builder stage: every definition built, every name
 * linked, not yet validated.
 *
 * @param registry     the frozen arena of named definitions
 * @param declarations the elements of {@code Root.types} in document order
 * @param note         the root note
 */
public record TypeGraph(TypeRegistry registry, List<Declaration> declarations, Note note) {

    /**
     * One element of {@code Root.types}.
     *
     * @param path       {@code types[i]}
     * @param definition the built definition
     */
    public record Declaration(NodePath path, TypeDef definition) {
        public Declaration {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(definition, "definition");
        }
    }

    public TypeGraph {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(declarations, "declarations");
        Objects.requireNonNull(note, "note");
        declarations = List.copyOf(declarations);
    }
}
