// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.validate;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import sh.itl.core.error.ValidationRule;
import sh.itl.core.model.BitFlag;
import sh.itl.core.model.EnumValue;
import sh.itl.core.model.NodePath;
import sh.itl.core.model.TypeDef;

/**
 * Values of legacy kinds: enum integers are unique; bitset bits are unique and
 * lie in {@code [0, size)}.
 */
final class LegacyValueCheck implements NodeCheck {

    @Override
    public void check(final NodePath path, final TypeDef node, final CheckContext context) {
        if (node instanceof TypeDef.EnumType enumType) {
            checkEnum(path, enumType, context);
        } else if (node instanceof TypeDef.BitsetType bitset) {
            checkBitset(path, bitset, context);
        }
    }

    private static void checkEnum(final NodePath path, final TypeDef.EnumType enumType, final CheckContext context) {
        final NodePath valuesPath = path.key("values");
        final List<EnumValue> values = enumType.values();
        final Map<BigInteger, Integer> firstIndex = new HashMap<>();
        for (int i = 0; i < values.size(); i++) {
            final EnumValue value = values.get(i);
            final Integer first = firstIndex.putIfAbsent(value.value(), i);
            if (first != null) {
                context.report(ValidationRule.DUPLICATE_VALUE, valuesPath.index(i),
                        "'%s' reuses value %s of '%s'".formatted(value.name(), value.value(), values.get(first).name()),
                        valuesPath.index(first));
            }
        }
    }

    private static void checkBitset(final NodePath path, final TypeDef.BitsetType bitset, final CheckContext context) {
        final NodePath valuesPath = path.key("values");
        final List<BitFlag> flags = bitset.values();
        final Long size = bitset.size();
        final Map<Long, Integer> firstIndex = new HashMap<>();
        for (int i = 0; i < flags.size(); i++) {
            final BitFlag flag = flags.get(i);
            final NodePath bitPath = valuesPath.index(i).key("bit");
            if (flag.bit() < 0) {
                context.report(ValidationRule.BIT_OUT_OF_RANGE, bitPath,
                        "bit of '%s' must not be negative, got %d".formatted(flag.name(), flag.bit()));
            } else if (size != null && size >= 0 && flag.bit() >= size) {
                context.report(ValidationRule.BIT_OUT_OF_RANGE, bitPath,
                        "bit %d of '%s' does not fit a %d-bit set".formatted(flag.bit(), flag.name(), size),
                        path.key("size"));
            }
            final Integer first = firstIndex.putIfAbsent(flag.bit(), i);
            if (first != null) {
                context.report(ValidationRule.DUPLICATE_VALUE, bitPath,
                        "'%s' reuses bit %d of '%s'".formatted(flag.name(), flag.bit(), flags.get(first).name()),
                        valuesPath.index(first).key("bit"));
            }
        }
    }
}
