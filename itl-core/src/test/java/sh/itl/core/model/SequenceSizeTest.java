// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

class SequenceSizeTest {

    @Test
    void scalar_countsItself() {
        assertEquals(7, new SequenceSize.Scalar(7).elementCount());
    }

    @Test
    void dimensions_multiply() {
        assertEquals(24, new SequenceSize.Dimensions(List.of(2L, 3L, 4L)).elementCount());
        assertEquals(1, new SequenceSize.Dimensions(List.of()).elementCount());
    }

    @Test
    void dimensions_zeroExtentIsEmpty() {
        assertEquals(0, new SequenceSize.Dimensions(List.of(Long.MAX_VALUE, 0L)).elementCount());
    }

    @Test
    void dimensions_saturateOnOverflow() {
        assertEquals(Long.MAX_VALUE,
                new SequenceSize.Dimensions(List.of(1L << 40, 1L << 40)).elementCount());
    }

    @Test
    void dimensions_copyExtents() {
        List<Long> extents = new ArrayList<>(List.of(2L, 2L));
        SequenceSize.Dimensions dims = new SequenceSize.Dimensions(extents);
        extents.add(9L);

        assertEquals(List.of(2L, 2L), dims.extents());
        assertThrows(UnsupportedOperationException.class, () -> dims.extents().add(1L));
    }
}
