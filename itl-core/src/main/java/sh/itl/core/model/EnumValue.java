// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A named value of a legacy {@code enum}.
 *
 * @param name  the value name
 * @param value the integer the name stands for
 * @param note  opaque annotations
 */
public record EnumValue(String name, BigInteger value, Note note) {

    public EnumValue {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(note, "note");
    }
}
