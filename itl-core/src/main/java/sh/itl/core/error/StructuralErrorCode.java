// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.error;

/**
 * Kinds of grammar-shape and resolution failures reported by the builder.
 */
public enum StructuralErrorCode {
    /** The document root is not an object with a {@code types} array. */
    MALFORMED_ROOT,
    /** A type definition has no {@code kind} string. */
    MISSING_KIND,
    /** The {@code kind} string names no known kind. */
    UNKNOWN_KIND,
    /** A required key is absent. */
    MISSING_KEY,
    /** A key holds the wrong JSON value kind (e.g. a string where an integer is required). */
    WRONG_VALUE_KIND,
    /** A number does not fit the range the grammar allows for its key. */
    VALUE_OUT_OF_RANGE,
    /** A key the grammar does not define, reported only when unknown keys are rejected. */
    UNKNOWN_KEY,
    /** A {@code float} model outside the supported set. */
    UNKNOWN_FLOAT_MODEL,
    /** A name is empty. */
    INVALID_NAME,
    /** Two definitions share a name. */
    DUPLICATE_TYPE_NAME,
    /** A type reference names no definition of the document. */
    UNKNOWN_TYPE_REFERENCE,
    /** A legacy kind or key appears while legacy kinds are disabled. */
    LEGACY_DISABLED
}
