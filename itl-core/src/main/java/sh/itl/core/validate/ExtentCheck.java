// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.validate;

import java.util.List;

import org.jspecify.annotations.Nullable;

import sh.itl.core.error.ValidationRule;
import sh.itl.core.model.NodePath;
import sh.itl.core.model.SequenceSize;
import sh.itl.core.model.TypeDef;

/**
 * Sizes and capacities of strings, sequences and bitsets.
 *
 * <p>
 * Scalar sizes and capacities are non-negative and a scalar size never exceeds
 * the capacity. Multi-dimension sizes are exempt from the ordering, but the list
 * is non-empty and every extent is positive.
 */
final class ExtentCheck implements NodeCheck {

    @Override
    public void check(final NodePath path, final TypeDef node, final CheckContext context) {
        if (node instanceof TypeDef.StringType string) {
            checkScalar(path, string.size(), string.capacity(), context);
        } else if (node instanceof TypeDef.SequenceType sequence) {
            checkSequence(path, sequence, context);
        } else if (node instanceof TypeDef.BitsetType bitset) {
            nonNegative(path.key("size"), bitset.size(), "size", context);
        }
    }

    private static void checkSequence(final NodePath path, final TypeDef.SequenceType sequence,
            final CheckContext context) {
        final SequenceSize size = sequence.size();
        if (size instanceof SequenceSize.Dimensions dimensions) {
            nonNegative(path.key("capacity"), sequence.capacity(), "capacity", context);
            final List<Long> extents = dimensions.extents();
            if (extents.isEmpty()) {
                context.report(ValidationRule.INVALID_DIMENSION, path.key("size"),
                        "dimension list must name at least one extent");
            }
            for (int i = 0; i < extents.size(); i++) {
                if (extents.get(i) <= 0) {
                    context.report(ValidationRule.INVALID_DIMENSION, path.key("size").index(i),
                            "dimension extent must be positive, got %d".formatted(extents.get(i)));
                }
            }
            return;
        }
        final Long count = size instanceof SequenceSize.Scalar scalar ? scalar.count() : null;
        checkScalar(path, count, sequence.capacity(), context);
    }

    private static void checkScalar(final NodePath path, @Nullable final Long size, @Nullable final Long capacity,
            final CheckContext context) {
        final boolean sizeOk = nonNegative(path.key("size"), size, "size", context);
        final boolean capacityOk = nonNegative(path.key("capacity"), capacity, "capacity", context);
        if (size != null && capacity != null && sizeOk && capacityOk && size > capacity) {
            context.report(ValidationRule.SIZE_EXCEEDS_CAPACITY, path.key("size"),
                    "size %d exceeds capacity %d".formatted(size, capacity),
                    path.key("capacity"));
        }
    }

    private static boolean nonNegative(final NodePath path, @Nullable final Long value, final String what,
            final CheckContext context) {
        if (value != null && value < 0) {
            context.report(ValidationRule.NEGATIVE_EXTENT, path,
                    "%s must not be negative, got %d".formatted(what, value));
            return false;
        }
        return true;
    }
}
