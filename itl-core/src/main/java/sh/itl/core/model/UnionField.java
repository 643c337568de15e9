// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * An alternative of a {@code union}.
 *
 * @param name   the alternative name, unique within the owning union
 * @param type   the payload type of the alternative
 * @param labels discriminator values selecting this alternative, in declaration
 *               order; empty for the default alternative
 * @param note   opaque annotations
 */
public record UnionField(String name, TypeRef type, Set<Label> labels, Note note) {

    public UnionField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(labels, "labels");
        Objects.requireNonNull(note, "note");
        labels = labels.isEmpty() ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(labels));
    }

    /**
     * The default alternative is the one selected when no label matches.
     *
     * @return true when this field declares no labels
     */
    public boolean isDefault() {
        return labels.isEmpty();
    }
}
