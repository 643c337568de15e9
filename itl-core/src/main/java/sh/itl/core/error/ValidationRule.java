// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.error;

/**
 * Semantic rules checked over a linked type graph.
 */
public enum ValidationRule {
    DUPLICATE_FIELD_NAME,
    DUPLICATE_VALUE_NAME,
    DUPLICATE_VALUE,
    SIZE_EXCEEDS_CAPACITY,
    NEGATIVE_EXTENT,
    INVALID_DIMENSION,
    INVALID_FIXED_BASE,
    INVALID_FIXED_DIGITS,
    INVALID_FIXED_SCALE,
    INVALID_INT_BITS,
    EMPTY_UNION,
    AMBIGUOUS_DEFAULT,
    OVERLAPPING_LABELS,
    LABEL_OUT_OF_DOMAIN,
    INVALID_DISCRIMINATOR,
    BIT_OUT_OF_RANGE,
    UNBOUNDED_RECURSION
}
