// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.model;

import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * A single ITL type declaration, named or inline.
 *
 * <p>
 * {@code TypeDef} is closed: there is exactly one record per {@link Kind}.
 * Consumers that need to handle every kind implement {@link TypeVisitor}, so a
 * kind added to the grammar breaks every consumer at compile time instead of
 * being silently skipped.
 *
 * <p>
 * All records are immutable. Nested positions hold {@link TypeRef}s: inline
 * definitions are owned, named ones are links resolved through the graph.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * // {"name":"Flag","kind":"int","bits":8,"unsigned":true}
 * TypeDef flag = new TypeDef.IntType("Flag", 8, true, null, Note.EMPTY);
 * String sig = TypeNames.describe(flag); // "int(bits=8, unsigned)"
 * }</pre>
 *
 * @see TypeVisitor
 * @see TypeRef
 */
public sealed interface TypeDef permits
        TypeDef.ByteType,
        TypeDef.BoolType,
        TypeDef.IntType,
        TypeDef.FloatType,
        TypeDef.FixedType,
        TypeDef.SequenceType,
        TypeDef.StringType,
        TypeDef.RecordType,
        TypeDef.UnionType,
        TypeDef.RuneType,
        TypeDef.EnumType,
        TypeDef.BitsetType {

    /**
     * Returns the declared name.
     *
     * @return the name, or {@code null} for anonymous definitions
     */
    @Nullable
    String name();

    /**
     * Returns the annotation tree of this node.
     *
     * @return the note, {@link Note#EMPTY} when none was declared
     */
    Note note();

    Kind kind();

    <R> R accept(TypeVisitor<R> visitor);

    default boolean isNamed() {
        return name() != null;
    }

    record ByteType(@Nullable String name, Note note) implements TypeDef {
        public ByteType {
            Objects.requireNonNull(note, "note");
        }

        @Override
        public Kind kind() {
            return Kind.BYTE;
        }

        @Override
        public <R> R accept(TypeVisitor<R> visitor) {
            return visitor.visitByte(this);
        }
    }

    record BoolType(@Nullable String name, Note note) implements TypeDef {
        public BoolType {
            Objects.requireNonNull(note, "note");
        }

        @Override
        public Kind kind() {
            return Kind.BOOL;
        }

        @Override
        public <R> R accept(TypeVisitor<R> visitor) {
            return visitor.visitBool(this);
        }
    }

    /**
     * Integer type.
     *
     * @param name     the declared name
     * @param bits     the bit width, or {@code null} for arbitrary precision
     * @param unsigned whether negative values are excluded
     * @param encoding legacy encoding hint, kept verbatim
     * @param note     opaque annotations
     */
    record IntType(@Nullable String name, @Nullable Integer bits, boolean unsigned, @Nullable String encoding,
            Note note) implements TypeDef {
        public IntType {
            Objects.requireNonNull(note, "note");
        }

        @Override
        public Kind kind() {
            return Kind.INT;
        }

        @Override
        public <R> R accept(TypeVisitor<R> visitor) {
            return visitor.visitInt(this);
        }
    }

    /**
     * Floating-point type.
     *
     * @param name     the declared name
     * @param model    advisory representation, or {@code null}
     * @param encoding legacy encoding hint, kept verbatim
     * @param note     opaque annotations
     */
    record FloatType(@Nullable String name, @Nullable FloatModel model, @Nullable String encoding, Note note)
            implements TypeDef {
        public FloatType {
            Objects.requireNonNull(note, "note");
        }

        @Override
        public Kind kind() {
            return Kind.FLOAT;
        }

        @Override
        public <R> R accept(TypeVisitor<R> visitor) {
            return visitor.visitFloat(this);
        }
    }

    /**
     * Fixed-point type: {@code digits} significant digits in radix {@code base},
     * {@code scale} of them after the radix point.
     */
    record FixedType(@Nullable String name, long base, long digits, long scale, @Nullable String encoding,
            Note note) implements TypeDef {
        public FixedType {
            Objects.requireNonNull(note, "note");
        }

        @Override
        public Kind kind() {
            return Kind.FIXED;
        }

        @Override
        public <R> R accept(TypeVisitor<R> visitor) {
            return visitor.visitFixed(this);
        }
    }

    /**
     * Homogeneous sequence.
     *
     * @param name     the declared name
     * @param type     the element type
     * @param size     the element count or dimensions; {@code null} for variable length
     * @param capacity advisory upper bound on the element count, or {@code null}
     * @param note     opaque annotations
     */
    record SequenceType(@Nullable String name, TypeRef type, @Nullable SequenceSize size, @Nullable Long capacity,
            Note note) implements TypeDef {
        public SequenceType {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(note, "note");
        }

        @Override
        public Kind kind() {
            return Kind.SEQUENCE;
        }

        @Override
        public <R> R accept(TypeVisitor<R> visitor) {
            return visitor.visitSequence(this);
        }
    }

    /**
     * Character string.
     *
     * @param name     the declared name
     * @param size     exact length, or {@code null}
     * @param capacity maximum length, or {@code null}
     * @param encoding legacy encoding hint, kept verbatim
     * @param note     opaque annotations
     */
    record StringType(@Nullable String name, @Nullable Long size, @Nullable Long capacity,
            @Nullable String encoding, Note note) implements TypeDef {
        public StringType {
            Objects.requireNonNull(note, "note");
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }

        @Override
        public <R> R accept(TypeVisitor<R> visitor) {
            return visitor.visitString(this);
        }
    }

    record RecordType(@Nullable String name, List<Field> fields, Note note) implements TypeDef {
        public RecordType {
            Objects.requireNonNull(fields, "fields");
            Objects.requireNonNull(note, "note");
            fields = List.copyOf(fields);
        }

        @Override
        public Kind kind() {
            return Kind.RECORD;
        }

        @Override
        public <R> R accept(TypeVisitor<R> visitor) {
            return visitor.visitRecord(this);
        }
    }

    /**
     * Discriminated union.
     *
     * @param name          the declared name
     * @param discriminator the type whose values select an alternative
     * @param fields        the alternatives in declaration order
     * @param note          opaque annotations
     */
    record UnionType(@Nullable String name, TypeRef discriminator, List<UnionField> fields, Note note)
            implements TypeDef {
        public UnionType {
            Objects.requireNonNull(discriminator, "discriminator");
            Objects.requireNonNull(fields, "fields");
            Objects.requireNonNull(note, "note");
            fields = List.copyOf(fields);
        }

        /**
         * Returns the alternative selected when no label matches.
         *
         * @return the first field without labels, or {@code null} when the union has no default
         */
        @Nullable
        public UnionField defaultField() {
            for (UnionField field : fields) {
                if (field.isDefault()) {
                    return field;
                }
            }
            return null;
        }

        @Override
        public Kind kind() {
            return Kind.UNION;
        }

        @Override
        public <R> R accept(TypeVisitor<R> visitor) {
            return visitor.visitUnion(this);
        }
    }

    /** Legacy single code point type. */
    record RuneType(@Nullable String name, @Nullable String encoding, Note note) implements TypeDef {
        public RuneType {
            Objects.requireNonNull(note, "note");
        }

        @Override
        public Kind kind() {
            return Kind.RUNE;
        }

        @Override
        public <R> R accept(TypeVisitor<R> visitor) {
            return visitor.visitRune(this);
        }
    }

    /** Legacy enumeration of named integers. */
    record EnumType(@Nullable String name, List<EnumValue> values, Note note) implements TypeDef {
        public EnumType {
            Objects.requireNonNull(values, "values");
            Objects.requireNonNull(note, "note");
            values = List.copyOf(values);
        }

        @Override
        public Kind kind() {
            return Kind.ENUM;
        }

        @Override
        public <R> R accept(TypeVisitor<R> visitor) {
            return visitor.visitEnum(this);
        }
    }

    /**
     * Legacy set of named bits.
     *
     * @param name   the declared name
     * @param size   number of bits, or {@code null}
     * @param values the named bits
     * @param note   opaque annotations
     */
    record BitsetType(@Nullable String name, @Nullable Long size, List<BitFlag> values, Note note)
            implements TypeDef {
        public BitsetType {
            Objects.requireNonNull(values, "values");
            Objects.requireNonNull(note, "note");
            values = List.copyOf(values);
        }

        @Override
        public Kind kind() {
            return Kind.BITSET;
        }

        @Override
        public <R> R accept(TypeVisitor<R> visitor) {
            return visitor.visitBitset(this);
        }
    }
}
