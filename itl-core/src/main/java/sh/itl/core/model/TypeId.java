// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.model;

/**
 * Stable identifier of a named type inside one document's registry arena.
 *
 * @param index the arena slot, assigned in registration order
 */
public record TypeId(int index) {

    public TypeId {
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative, got: " + index);
        }
    }
}
