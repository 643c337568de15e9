// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.build;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

import sh.itl.core.error.UnresolvedReferenceException;
import sh.itl.core.model.NodePath;
import sh.itl.core.model.TypeDef;
import sh.itl.core.model.TypeId;
import sh.itl.core.model.TypeRef;

/**
 * Arena owning every named definition of one document.
 *
 * <p>
 * Slots are addressed by {@link TypeId} in registration order. Named
 * {@link TypeRef}s store the identifier, never the node, so cycles between
 * named types need no ownership cycle.
 *
 * <p>
 * A registry is immutable. It is assembled through {@link Builder}, which the
 * graph builder fills in two passes (names first, definitions second) and then
 * freezes with {@link Builder#build()}. Frozen registries may be read from any
 * number of threads.
 */
public final class TypeRegistry {

    /**
     * One registered definition.
     *
     * @param id         the arena slot
     * @param name       the registered name
     * @param path       where the definition is declared
     * @param definition the owned node
     */
    public record Entry(TypeId id, String name, NodePath path, TypeDef definition) {
        public Entry {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(definition, "definition");
        }
    }

    private final List<Entry> entries;
    private final Map<String, TypeId> idsByName;

    private TypeRegistry(final List<Entry> entries) {
        this.entries = List.copyOf(entries);
        final Map<String, TypeId> ids = new HashMap<>();
        for (Entry entry : entries) {
            ids.put(entry.name(), entry.id());
        }
        this.idsByName = Collections.unmodifiableMap(ids);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Returns every registered definition in registration order: top-level
     * definitions and locally named inline ones.
     *
     * @return immutable list of entries
     */
    public List<Entry> entries() {
        return entries;
    }

    public Optional<TypeId> idOf(final String name) {
        return Optional.ofNullable(idsByName.get(name));
    }

    public Optional<TypeDef> lookup(final String name) {
        final TypeId id = idsByName.get(name);
        return id == null ? Optional.empty() : Optional.of(entries.get(id.index()).definition());
    }

    public Optional<Entry> entry(final String name) {
        final TypeId id = idsByName.get(name);
        return id == null ? Optional.empty() : Optional.of(entries.get(id.index()));
    }

    /**
     * Follows a type position to its definition.
     *
     * @param ref a reference produced for this registry's document
     * @return the referenced or inline definition
     * @throws UnresolvedReferenceException if the link does not belong to this
     *                                      registry or is an unresolved marker
     */
    public TypeDef resolve(final TypeRef ref) {
        Objects.requireNonNull(ref, "ref");
        if (ref instanceof TypeRef.Inline inline) {
            return inline.definition();
        }
        if (ref instanceof TypeRef.Named named) {
            final int index = named.id().index();
            if (index >= entries.size() || !entries.get(index).name().equals(named.name())) {
                throw new UnresolvedReferenceException(
                        "Link '%s' (slot %d) does not belong to this graph".formatted(named.name(), index));
            }
            return entries.get(index).definition();
        }
        throw UnresolvedReferenceException.unknownName(((TypeRef.Unresolved) ref).name());
    }

    /**
     * Mutable assembly of a registry. Not thread-safe; confined to one build.
     */
    public static final class Builder {

        private final List<String> names = new ArrayList<>();
        private final List<NodePath> paths = new ArrayList<>();
        private final List<@Nullable TypeDef> definitions = new ArrayList<>();
        private final Map<String, TypeId> idsByName = new HashMap<>();
        private final Map<NodePath, TypeId> idsByPath = new HashMap<>();

        private Builder() {
        }

        /**
         * Reserves a slot for a name.
         *
         * @param name the type name
         * @param path where the named definition is declared
         * @return the new identifier
         * @throws IllegalStateException if the name is already registered
         */
        public TypeId register(final String name, final NodePath path) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(path, "path");
            if (idsByName.containsKey(name)) {
                throw new IllegalStateException("Type name already registered: " + name);
            }
            final TypeId id = new TypeId(names.size());
            names.add(name);
            paths.add(path);
            definitions.add(null);
            idsByName.put(name, id);
            idsByPath.put(path, id);
            return id;
        }

        public boolean contains(final String name) {
            return idsByName.containsKey(name);
        }

        public Optional<TypeId> idOf(final String name) {
            return Optional.ofNullable(idsByName.get(name));
        }

        /**
         * Returns where a registered name was declared.
         *
         * @param name a registered name
         * @return the declaration path, or {@code null} if the name is unknown
         */
        @Nullable
        public NodePath pathOf(final String name) {
            final TypeId id = idsByName.get(name);
            return id == null ? null : paths.get(id.index());
        }

        /**
         * Returns the slot reserved for the definition declared at {@code path}.
         *
         * @param path a declaration path
         * @return the slot, empty when that declaration was not registered (anonymous or
         *         a duplicate name)
         */
        public Optional<TypeId> slotAt(final NodePath path) {
            return Optional.ofNullable(idsByPath.get(path));
        }

        public void define(final TypeId id, final TypeDef definition) {
            Objects.requireNonNull(definition, "definition");
            if (definitions.get(id.index()) != null) {
                throw new IllegalStateException("Slot already defined: " + names.get(id.index()));
            }
            definitions.set(id.index(), definition);
        }

        /**
         * Freezes the registry.
         *
         * @return the immutable registry
         * @throws IllegalStateException if a reserved slot was never defined
         */
        public TypeRegistry build() {
            final List<Entry> entries = new ArrayList<>(names.size());
            for (int i = 0; i < names.size(); i++) {
                final TypeDef definition = definitions.get(i);
                if (definition == null) {
                    throw new IllegalStateException("Type '" + names.get(i) + "' was registered but never defined");
                }
                entries.add(new Entry(new TypeId(i), names.get(i), paths.get(i), definition));
            }
            return new TypeRegistry(entries);
        }
    }
}
