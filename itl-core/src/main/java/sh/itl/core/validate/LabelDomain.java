// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.validate;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.jspecify.annotations.Nullable;

import sh.itl.core.model.EnumValue;
import sh.itl.core.model.Label;
import sh.itl.core.model.TypeDef;
import sh.itl.core.model.TypeVisitor;

/**
 * The set of legal union labels for one discriminator type.
 *
 * <p>
 * {@link #canonical(Label)} maps a legal label to the single spelling used for
 * disjointness, so two spellings of the same discriminator value (an enum name
 * and its integer, a one-character rune and its code point) collide.
 */
interface LabelDomain {

    BigInteger MAX_CODE_POINT = BigInteger.valueOf(Character.MAX_CODE_POINT);

    /**
     * @param label a label as declared
     * @return the canonical label, or empty if the value is not in this domain
     */
    Optional<Label> canonical(Label label);

    /**
     * Short description of the legal values, used in problem details.
     */
    String describe();

    /**
     * Returns the label domain of a discriminator type.
     *
     * @param discriminator the resolved discriminator definition
     * @return the domain, or {@code null} when values of that kind cannot select
     *         a union alternative
     */
    @Nullable
    static LabelDomain of(final TypeDef discriminator) {
        return discriminator.accept(Factory.INSTANCE);
    }

    private static LabelDomain integers(final BigInteger min, final BigInteger max, final String description) {
        return new LabelDomain() {
            @Override
            public Optional<Label> canonical(final Label label) {
                if (label instanceof Label.IntLabel integer
                        && integer.value().compareTo(min) >= 0
                        && integer.value().compareTo(max) <= 0) {
                    return Optional.of(label);
                }
                return Optional.empty();
            }

            @Override
            public String describe() {
                return description;
            }
        };
    }

    final class Factory implements TypeVisitor<@Nullable LabelDomain> {

        static final Factory INSTANCE = new Factory();

        private Factory() {
        }

        @Override
        public LabelDomain visitByte(final TypeDef.ByteType type) {
            return integers(BigInteger.ZERO, BigInteger.valueOf(255), "an integer from 0 to 255");
        }

        @Override
        public LabelDomain visitBool(final TypeDef.BoolType type) {
            return new LabelDomain() {
                @Override
                public Optional<Label> canonical(final Label label) {
                    return label instanceof Label.BoolLabel ? Optional.of(label) : Optional.empty();
                }

                @Override
                public String describe() {
                    return "true or false";
                }
            };
        }

        @Override
        public LabelDomain visitInt(final TypeDef.IntType type) {
            final Integer bits = type.bits();
            final boolean bounded = bits != null && bits > 0;
            return new LabelDomain() {
                @Override
                public Optional<Label> canonical(final Label label) {
                    if (!(label instanceof Label.IntLabel integer)) {
                        return Optional.empty();
                    }
                    final BigInteger value = integer.value();
                    if (type.unsigned() && value.signum() < 0) {
                        return Optional.empty();
                    }
                    if (bounded) {
                        // bitLength excludes the sign, so -2^(n-1) has bitLength n-1
                        final int limit = type.unsigned() ? bits : bits - 1;
                        if (value.bitLength() > limit) {
                            return Optional.empty();
                        }
                    }
                    return Optional.of(label);
                }

                @Override
                public String describe() {
                    final String sign = type.unsigned() ? "unsigned" : "signed";
                    return bounded ? "a %s %d-bit integer".formatted(sign, bits) : "a %s integer".formatted(sign);
                }
            };
        }

        @Override
        public LabelDomain visitString(final TypeDef.StringType type) {
            final Long limit = type.size() != null ? type.size() : type.capacity();
            return new LabelDomain() {
                @Override
                public Optional<Label> canonical(final Label label) {
                    if (!(label instanceof Label.TextLabel text)) {
                        return Optional.empty();
                    }
                    final String value = text.value();
                    if (limit != null && value.codePointCount(0, value.length()) > limit) {
                        return Optional.empty();
                    }
                    return Optional.of(label);
                }

                @Override
                public String describe() {
                    return limit == null ? "a string" : "a string of at most %d characters".formatted(limit);
                }
            };
        }

        @Override
        public LabelDomain visitRune(final TypeDef.RuneType type) {
            return new LabelDomain() {
                @Override
                public Optional<Label> canonical(final Label label) {
                    if (label instanceof Label.TextLabel text) {
                        final String value = text.value();
                        if (!value.isEmpty() && value.codePointCount(0, value.length()) == 1) {
                            return Optional.of(Label.of(value.codePointAt(0)));
                        }
                        return Optional.empty();
                    }
                    if (label instanceof Label.IntLabel integer
                            && integer.value().signum() >= 0
                            && integer.value().compareTo(MAX_CODE_POINT) <= 0) {
                        return Optional.of(label);
                    }
                    return Optional.empty();
                }

                @Override
                public String describe() {
                    return "a single code point";
                }
            };
        }

        @Override
        public LabelDomain visitEnum(final TypeDef.EnumType type) {
            final Map<String, BigInteger> byName = new HashMap<>();
            final Set<BigInteger> values = new HashSet<>();
            for (EnumValue value : type.values()) {
                byName.putIfAbsent(value.name(), value.value());
                values.add(value.value());
            }
            return new LabelDomain() {
                @Override
                public Optional<Label> canonical(final Label label) {
                    if (label instanceof Label.TextLabel text && byName.containsKey(text.value())) {
                        return Optional.of(new Label.IntLabel(byName.get(text.value())));
                    }
                    if (label instanceof Label.IntLabel integer && values.contains(integer.value())) {
                        return Optional.of(label);
                    }
                    return Optional.empty();
                }

                @Override
                public String describe() {
                    return "a declared enum value name or integer";
                }
            };
        }

        @Override
        @Nullable
        public LabelDomain visitFloat(final TypeDef.FloatType type) {
            return null;
        }

        @Override
        @Nullable
        public LabelDomain visitFixed(final TypeDef.FixedType type) {
            return null;
        }

        @Override
        @Nullable
        public LabelDomain visitSequence(final TypeDef.SequenceType type) {
            return null;
        }

        @Override
        @Nullable
        public LabelDomain visitRecord(final TypeDef.RecordType type) {
            return null;
        }

        @Override
        @Nullable
        public LabelDomain visitUnion(final TypeDef.UnionType type) {
            return null;
        }

        @Override
        @Nullable
        public LabelDomain visitBitset(final TypeDef.BitsetType type) {
            return null;
        }
    }
}
