// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.model;

import java.util.Optional;

import org.jspecify.annotations.Nullable;

/**
 * The fixed set of ITL type kinds, keyed by the {@code "kind"} string of the
 * document.
 */
public enum Kind {
    BYTE("byte", false),
    BOOL("bool", false),
    INT("int", false),
    FLOAT("float", false),
    FIXED("fixed", false),
    SEQUENCE("sequence", false),
    STRING("string", false),
    RECORD("record", false),
    UNION("union", false),
    RUNE("rune", true),
    ENUM("enum", true),
    BITSET("bitset", true);

    private final String keyword;
    private final boolean legacy;

    Kind(final String keyword, final boolean legacy) {
        this.keyword = keyword;
        this.legacy = legacy;
    }

    /**
     * Returns the spelling of this kind in an ITL document.
     *
     * @return the keyword, e.g. {@code "sequence"}
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Whether this kind belongs to the encoding-centric grammar generation and is
     * only accepted when legacy kinds are enabled.
     *
     * @return true for {@code rune}, {@code enum} and {@code bitset}
     */
    public boolean isLegacy() {
        return legacy;
    }

    public static Optional<Kind> fromKeyword(@Nullable final String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        for (Kind kind : values()) {
            if (kind.keyword.equals(keyword)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return keyword;
    }
}
