// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A discriminator value bound to a union field.
 *
 * <p>Labels keep the JSON spelling they were declared with. Whether a label is
 * legal for a particular discriminator is decided during validation.
 */
public sealed interface Label permits Label.IntLabel, Label.TextLabel, Label.BoolLabel {

    /**
     * Renders the label as it appears in JSON.
     *
     * @return the JSON spelling, e.g. {@code 42}, {@code "ping"}, {@code true}
     */
    String render();

    static Label of(final long value) {
        return new IntLabel(BigInteger.valueOf(value));
    }

    static Label of(final String value) {
        return new TextLabel(value);
    }

    static Label of(final boolean value) {
        return new BoolLabel(value);
    }

    record IntLabel(BigInteger value) implements Label {
        public IntLabel {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String render() {
            return value.toString();
        }
    }

    record TextLabel(String value) implements Label {
        public TextLabel {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String render() {
            return "\"" + value + "\"";
        }
    }

    record BoolLabel(boolean value) implements Label {
        @Override
        public String render() {
            return Boolean.toString(value);
        }
    }
}
