// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Compact, human-readable signatures of type definitions, used in problem
 * details and debug output.
 *
 * <p>Named references render as their name, so cyclic graphs terminate.
 *
 * <pre>{@code
 * int(bits=8, unsigned)
 * sequence<Point>[4][4]
 * record{id: int, label?: string(capacity=32)}
 * union<Flag>{ping, other}
 * }</pre>
 */
public final class TypeNames {

    private static final Renderer RENDERER = new Renderer();

    private TypeNames() {
    }

    public static String describe(final TypeDef type) {
        return type.accept(RENDERER);
    }

    private static String params(final String head, final List<String> parts) {
        return parts.isEmpty() ? head : head + "(" + String.join(", ", parts) + ")";
    }

    private static final class Renderer implements TypeVisitor<String> {

        @Override
        public String visitByte(TypeDef.ByteType type) {
            return "byte";
        }

        @Override
        public String visitBool(TypeDef.BoolType type) {
            return "bool";
        }

        @Override
        public String visitInt(TypeDef.IntType type) {
            List<String> parts = new ArrayList<>(2);
            if (type.bits() != null) {
                parts.add("bits=" + type.bits());
            }
            if (type.unsigned()) {
                parts.add("unsigned");
            }
            return params("int", parts);
        }

        @Override
        public String visitFloat(TypeDef.FloatType type) {
            return type.model() == null ? "float" : "float(" + type.model().keyword() + ")";
        }

        @Override
        public String visitFixed(TypeDef.FixedType type) {
            return "fixed(base=" + type.base() + ", digits=" + type.digits() + ", scale=" + type.scale() + ")";
        }

        @Override
        public String visitSequence(TypeDef.SequenceType type) {
            StringBuilder sb = new StringBuilder("sequence<").append(type.type().describe()).append('>');
            SequenceSize size = type.size();
            if (size instanceof SequenceSize.Scalar scalar) {
                sb.append('[').append(scalar.count()).append(']');
            } else if (size instanceof SequenceSize.Dimensions dims) {
                for (long extent : dims.extents()) {
                    sb.append('[').append(extent).append(']');
                }
            } else {
                sb.append("[]");
            }
            if (type.capacity() != null) {
                sb.append("(capacity=").append(type.capacity()).append(')');
            }
            return sb.toString();
        }

        @Override
        public String visitString(TypeDef.StringType type) {
            List<String> parts = new ArrayList<>(2);
            if (type.size() != null) {
                parts.add("size=" + type.size());
            }
            if (type.capacity() != null) {
                parts.add("capacity=" + type.capacity());
            }
            return params("string", parts);
        }

        @Override
        public String visitRecord(TypeDef.RecordType type) {
            return type.fields().stream()
                    .map(f -> f.name() + (f.optional() ? "?" : "") + ": " + f.type().describe())
                    .collect(Collectors.joining(", ", "record{", "}"));
        }

        @Override
        public String visitUnion(TypeDef.UnionType type) {
            return type.fields().stream()
                    .map(UnionField::name)
                    .collect(Collectors.joining(", ", "union<" + type.discriminator().describe() + ">{", "}"));
        }

        @Override
        public String visitRune(TypeDef.RuneType type) {
            return "rune";
        }

        @Override
        public String visitEnum(TypeDef.EnumType type) {
            return type.values().stream()
                    .map(EnumValue::name)
                    .collect(Collectors.joining(", ", "enum{", "}"));
        }

        @Override
        public String visitBitset(TypeDef.BitsetType type) {
            return type.values().stream()
                    .map(BitFlag::name)
                    .collect(Collectors.joining(", ", "bitset{", "}"));
        }
    }
}
