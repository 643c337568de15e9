// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Opaque annotation tree attached to a node through the {@code "note"} key.
 *
 * <p>The core never interprets notes. Values are kept as an immutable JSON-like
 * tree: {@code Map<String, Object>} for objects, {@code List<Object>} for
 * arrays, and {@link String}, {@link java.math.BigInteger},
 * {@link java.math.BigDecimal}, {@link Boolean} or {@code null} for scalars.
 * Key order follows the source document.
 *
 * @param entries the top-level entries of the note object
 */
public record Note(Map<String, Object> entries) {

    /** Note of a node that declares none. */
    public static final Note EMPTY = new Note(Map.of());

    public Note {
        Objects.requireNonNull(entries, "entries");
        entries = entries.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Optional<Object> get(final String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean containsKey(final String key) {
        return entries.containsKey(key);
    }
}
