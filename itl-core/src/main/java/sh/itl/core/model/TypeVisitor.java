// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.model;

/**
 * Exhaustive dispatch over {@link TypeDef} kinds.
 *
 * <p>Implementations must handle every kind, including the legacy ones; a
 * kind can only be ignored deliberately by returning a neutral value.
 *
 * @param <R> the result type
 */
public interface TypeVisitor<R> {

    R visitByte(TypeDef.ByteType type);

    R visitBool(TypeDef.BoolType type);

    R visitInt(TypeDef.IntType type);

    R visitFloat(TypeDef.FloatType type);

    R visitFixed(TypeDef.FixedType type);

    R visitSequence(TypeDef.SequenceType type);

    R visitString(TypeDef.StringType type);

    R visitRecord(TypeDef.RecordType type);

    R visitUnion(TypeDef.UnionType type);

    R visitRune(TypeDef.RuneType type);

    R visitEnum(TypeDef.EnumType type);

    R visitBitset(TypeDef.BitsetType type);
}
