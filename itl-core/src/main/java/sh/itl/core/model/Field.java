// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.model;

import java.util.Objects;

/**
 * A field of a {@code record}.
 *
 * @param name     the field name, unique within the owning record
 * @param type     the field type
 * @param optional whether a value may omit the field
 * @param note     opaque annotations
 */
public record Field(String name, TypeRef type, boolean optional, Note note) {

    public Field {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(note, "note");
    }

    public static Field of(final String name, final TypeRef type) {
        return new Field(name, type, false, Note.EMPTY);
    }
}
