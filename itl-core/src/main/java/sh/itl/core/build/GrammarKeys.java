// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.build;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import sh.itl.core.model.Kind;

/**
 * Keys the grammar defines for each JSON object shape. Used to report unknown
 * keys when the compiler runs with {@code rejectUnknownKeys}.
 */
final class GrammarKeys {

    static final Set<String> ROOT = Set.of("types", "note");
    static final Set<String> FIELD = Set.of("name", "type", "optional", "note");
    static final Set<String> UNION_FIELD = Set.of("name", "type", "labels", "note");
    static final Set<String> ENUM_VALUE = Set.of("name", "value", "note");
    static final Set<String> BIT_FLAG = Set.of("name", "bit", "note");

    private static final Set<String> COMMON = Set.of("kind", "name", "note");
    private static final Map<Kind, Set<String>> BY_KIND = new EnumMap<>(Kind.class);

    static {
        BY_KIND.put(Kind.BYTE, Set.of());
        BY_KIND.put(Kind.BOOL, Set.of());
        BY_KIND.put(Kind.INT, Set.of("bits", "unsigned", "encoding"));
        BY_KIND.put(Kind.FLOAT, Set.of("model", "encoding"));
        BY_KIND.put(Kind.FIXED, Set.of("base", "digits", "scale", "encoding"));
        BY_KIND.put(Kind.SEQUENCE, Set.of("type", "size", "capacity"));
        BY_KIND.put(Kind.STRING, Set.of("size", "capacity", "encoding"));
        BY_KIND.put(Kind.RECORD, Set.of("fields"));
        BY_KIND.put(Kind.UNION, Set.of("discriminator", "fields"));
        BY_KIND.put(Kind.RUNE, Set.of("encoding"));
        BY_KIND.put(Kind.ENUM, Set.of("values"));
        BY_KIND.put(Kind.BITSET, Set.of("size", "values"));
    }

    private GrammarKeys() {
    }

    static boolean allowed(final Kind kind, final String key) {
        return COMMON.contains(key) || BY_KIND.get(kind).contains(key);
    }
}
