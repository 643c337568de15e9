// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core;

/**
 * Configuration for {@link SchemaCompiler}.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * SchemaOptions options = SchemaOptions.builder()
 *         .legacyKinds(true)
 *         .rejectUnknownKeys(true)
 *         .maxNestingDepth(64)
 *         .build();
 *
 * SchemaCompiler compiler = SchemaCompiler.create(options);
 * }</pre>
 *
 * @param legacyKinds       accept the encoding-centric grammar: {@code rune},
 *                          {@code enum}, {@code bitset} and the {@code encoding}
 *                          key. Default: false.
 * @param rejectUnknownKeys report keys the grammar does not define as
 *                          {@code UNKNOWN_KEY} instead of ignoring them.
 *                          Default: false.
 * @param maxNestingDepth   deepest JSON nesting the parser accepts; zero selects
 *                          the default of 256. Maximum: 1000, a depth every
 *                          stage handles on a default thread stack.
 */
public record SchemaOptions(boolean legacyKinds, boolean rejectUnknownKeys, int maxNestingDepth) {

    // Defaults
    private static final int DEFAULT_MAX_NESTING_DEPTH = 256;
    private static final int MAX_NESTING_DEPTH_LIMIT = 1_000;

    private static final SchemaOptions DEFAULTS = new SchemaOptions(false, false, 0);

    public SchemaOptions {
        if (maxNestingDepth == 0)
            maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;

        if (maxNestingDepth < 0) {
            throw new IllegalArgumentException("maxNestingDepth must not be negative, got: " + maxNestingDepth);
        }
        if (maxNestingDepth > MAX_NESTING_DEPTH_LIMIT) {
            throw new IllegalArgumentException(
                    "maxNestingDepth (" + maxNestingDepth + ") exceeds maximum allowed (" + MAX_NESTING_DEPTH_LIMIT + ")");
        }
    }

    public static SchemaOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .legacyKinds(legacyKinds)
                .rejectUnknownKeys(rejectUnknownKeys)
                .maxNestingDepth(maxNestingDepth);
    }

    public static final class Builder {
        private boolean legacyKinds = false;
        private boolean rejectUnknownKeys = false;
        private int maxNestingDepth = 0;

        private Builder() {
        }

        public Builder legacyKinds(boolean legacyKinds) {
            this.legacyKinds = legacyKinds;
            return this;
        }

        public Builder rejectUnknownKeys(boolean rejectUnknownKeys) {
            this.rejectUnknownKeys = rejectUnknownKeys;
            return this;
        }

        public Builder maxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public SchemaOptions build() {
            return new SchemaOptions(legacyKinds, rejectUnknownKeys, maxNestingDepth);
        }
    }
}
