// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.model;

import java.util.List;
import java.util.Objects;

/**
 * The {@code size} of a {@code sequence}: one element count, or one count per
 * dimension.
 */
public sealed interface SequenceSize permits SequenceSize.Scalar, SequenceSize.Dimensions {

    /**
     * Total number of elements the size allocates.
     *
     * @return the product of all dimensions, saturated at {@link Long#MAX_VALUE}
     */
    long elementCount();

    record Scalar(long count) implements SequenceSize {
        @Override
        public long elementCount() {
            return count;
        }
    }

    record Dimensions(List<Long> extents) implements SequenceSize {
        public Dimensions {
            Objects.requireNonNull(extents, "extents");
            extents = List.copyOf(extents);
        }

        @Override
        public long elementCount() {
            long product = 1;
            for (long extent : extents) {
                if (extent == 0) {
                    return 0;
                }
                if (product > Long.MAX_VALUE / Math.abs(extent)) {
                    return Long.MAX_VALUE;
                }
                product *= extent;
            }
            return product;
        }
    }
}
