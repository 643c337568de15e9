// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.validate;

import sh.itl.core.error.ValidationRule;
import sh.itl.core.model.NodePath;
import sh.itl.core.model.TypeDef;

/**
 * Parameters of numeric kinds: a present {@code int.bits} is positive; a
 * {@code fixed} has {@code base >= 2}, {@code digits > 0} and
 * {@code 0 <= scale <= digits}.
 */
final class NumericCheck implements NodeCheck {

    @Override
    public void check(final NodePath path, final TypeDef node, final CheckContext context) {
        if (node instanceof TypeDef.IntType integer) {
            final Integer bits = integer.bits();
            if (bits != null && bits <= 0) {
                context.report(ValidationRule.INVALID_INT_BITS, path.key("bits"),
                        "bit width must be positive, got %d".formatted(bits));
            }
        } else if (node instanceof TypeDef.FixedType fixed) {
            checkFixed(path, fixed, context);
        }
    }

    private static void checkFixed(final NodePath path, final TypeDef.FixedType fixed, final CheckContext context) {
        if (fixed.base() < 2) {
            context.report(ValidationRule.INVALID_FIXED_BASE, path.key("base"),
                    "radix must be at least 2, got %d".formatted(fixed.base()));
        }
        if (fixed.digits() <= 0) {
            context.report(ValidationRule.INVALID_FIXED_DIGITS, path.key("digits"),
                    "digit count must be positive, got %d".formatted(fixed.digits()));
        }
        if (fixed.scale() < 0) {
            context.report(ValidationRule.INVALID_FIXED_SCALE, path.key("scale"),
                    "scale must not be negative, got %d".formatted(fixed.scale()));
        } else if (fixed.scale() > fixed.digits()) {
            context.report(ValidationRule.INVALID_FIXED_SCALE, path.key("scale"),
                    "scale %d exceeds digit count %d".formatted(fixed.scale(), fixed.digits()),
                    path.key("digits"));
        }
    }
}
