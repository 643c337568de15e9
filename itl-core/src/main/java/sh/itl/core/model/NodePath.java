// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.model;

import java.util.Objects;

/**
 * Location of a node inside an ITL document, rendered the way a reader would
 * navigate the JSON: {@code types[3].fields[1].type}.
 *
 * <p>Paths are immutable; {@link #key(String)} and {@link #index(int)} return
 * new instances.
 *
 * @param value the rendered path, empty for the document root
 */
public record NodePath(String value) {

    private static final NodePath ROOT = new NodePath("");

    public NodePath {
        Objects.requireNonNull(value, "value");
    }

    public static NodePath root() {
        return ROOT;
    }

    public static NodePath of(final String value) {
        return value.isEmpty() ? ROOT : new NodePath(value);
    }

    public NodePath key(final String key) {
        Objects.requireNonNull(key, "key");
        return new NodePath(value.isEmpty() ? key : value + "." + key);
    }

    public NodePath index(final int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative, got: " + index);
        }
        return new NodePath(value + "[" + index + "]");
    }

    public boolean isRoot() {
        return value.isEmpty();
    }

    @Override
    public String toString() {
        return value.isEmpty() ? "<root>" : value;
    }
}
