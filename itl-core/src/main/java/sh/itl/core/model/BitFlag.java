// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.model;

import java.util.Objects;

/**
 * A named bit of a legacy {@code bitset}.
 *
 * @param name the flag name
 * @param bit  the bit position, counted from the least significant bit
 * @param note opaque annotations
 */
public record BitFlag(String name, long bit, Note note) {

    public BitFlag {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(note, "note");
    }
}
