// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SchemaOptionsTest {

    @Test
    void defaults_areLenient() {
        SchemaOptions options = SchemaOptions.defaults();

        assertFalse(options.legacyKinds());
        assertFalse(options.rejectUnknownKeys());
        assertEquals(256, options.maxNestingDepth());
    }

    @Test
    void builder_setsEveryOption() {
        SchemaOptions options = SchemaOptions.builder()
                .legacyKinds(true)
                .rejectUnknownKeys(true)
                .maxNestingDepth(64)
                .build();

        assertTrue(options.legacyKinds());
        assertTrue(options.rejectUnknownKeys());
        assertEquals(64, options.maxNestingDepth());
    }

    @Test
    void zeroDepth_selectsDefault() {
        assertEquals(256, new SchemaOptions(false, false, 0).maxNestingDepth());
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 1_001, 10_000, Integer.MAX_VALUE})
    void invalidDepth_throws(int depth) {
        assertThrows(IllegalArgumentException.class, () -> SchemaOptions.builder().maxNestingDepth(depth).build());
    }

    @Test
    void maximumDepth_accepted() {
        assertEquals(1_000, SchemaOptions.builder().maxNestingDepth(1_000).build().maxNestingDepth());
    }

    @Test
    void toBuilder_copiesAndOverrides() {
        SchemaOptions strict = SchemaOptions.builder().rejectUnknownKeys(true).maxNestingDepth(32).build();

        SchemaOptions legacy = strict.toBuilder().legacyKinds(true).build();

        assertEquals(new SchemaOptions(true, true, 32), legacy);
        assertFalse(strict.legacyKinds());
    }

    @Test
    void compiler_keepsItsOptions() {
        SchemaOptions options = SchemaOptions.builder().legacyKinds(true).build();

        assertSame(options, SchemaCompiler.create(options).options());
        assertEquals(SchemaOptions.defaults(), SchemaCompiler.create().options());
    }
}
