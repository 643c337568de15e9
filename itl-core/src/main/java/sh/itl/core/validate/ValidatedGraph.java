// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import sh.itl.core.build.TypeGraph;
import sh.itl.core.build.TypeRegistry;
import sh.itl.core.error.UnresolvedReferenceException;
import sh.itl.core.model.Note;
import sh.itl.core.model.TypeDef;
import sh.itl.core.model.TypeRef;

/**
 * A type graph that passed every semantic rule.
 *
 * <p>
 * Only {@link SemanticValidator} creates instances, so holding a
 * {@code ValidatedGraph} proves the document was accepted. The graph is
 * deeply immutable and may be shared between threads without locking.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * ValidatedGraph graph = ItlSchema.compileOrThrow(bytes);
 * TypeDef.UnionType msg = (TypeDef.UnionType) graph.require("Msg");
 * TypeDef flag = graph.resolve(msg.discriminator());
 * }</pre>
 */
public final class ValidatedGraph {

    private final TypeRegistry registry;
    private final List<TypeDef> declarations;
    private final List<TypeDef> namedTypes;
    private final Note note;

    ValidatedGraph(final TypeGraph graph) {
        Objects.requireNonNull(graph, "graph");
        this.registry = graph.registry();
        this.note = graph.note();
        final List<TypeDef> all = new ArrayList<>(graph.declarations().size());
        final List<TypeDef> named = new ArrayList<>();
        for (TypeGraph.Declaration declaration : graph.declarations()) {
            all.add(declaration.definition());
            if (declaration.definition().isNamed()) {
                named.add(declaration.definition());
            }
        }
        this.declarations = Collections.unmodifiableList(all);
        this.namedTypes = Collections.unmodifiableList(named);
    }

    /**
     * Returns the named top-level definitions in declaration order.
     *
     * @return immutable list
     */
    public List<TypeDef> namedTypes() {
        return namedTypes;
    }

    /**
     * Returns every element of {@code Root.types}, named or anonymous, in
     * declaration order.
     *
     * @return immutable list
     */
    public List<TypeDef> declarations() {
        return declarations;
    }

    /**
     * Looks up a named definition, top-level or inline.
     *
     * @param name the type name
     * @return the definition, or empty when the document declares no such name
     */
    public Optional<TypeDef> lookup(final String name) {
        Objects.requireNonNull(name, "name");
        return registry.lookup(name);
    }

    /**
     * Like {@link #lookup(String)} but for names the caller knows are declared.
     *
     * @throws UnresolvedReferenceException if no definition has that name
     */
    public TypeDef require(final String name) {
        return lookup(name).orElseThrow(() -> UnresolvedReferenceException.unknownName(name));
    }

    public TypeDef resolve(final TypeRef ref) {
        return registry.resolve(ref);
    }

    public Note note() {
        return note;
    }

    public TypeRegistry registry() {
        return registry;
    }
}
