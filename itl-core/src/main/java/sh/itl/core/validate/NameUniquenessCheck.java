// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.validate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import sh.itl.core.error.ValidationRule;
import sh.itl.core.model.BitFlag;
import sh.itl.core.model.EnumValue;
import sh.itl.core.model.Field;
import sh.itl.core.model.NodePath;
import sh.itl.core.model.TypeDef;
import sh.itl.core.model.UnionField;

/**
 * Member names are unique within their owner: record fields, union fields and
 * the values of legacy enums and bitsets. Every repeat is reported at its own
 * position and cites the first one.
 */
final class NameUniquenessCheck implements NodeCheck {

    @Override
    public void check(final NodePath path, final TypeDef node, final CheckContext context) {
        if (node instanceof TypeDef.RecordType record) {
            checkNames(record.fields(), Field::name, path.key("fields"),
                    ValidationRule.DUPLICATE_FIELD_NAME, "field", context);
        } else if (node instanceof TypeDef.UnionType union) {
            checkNames(union.fields(), UnionField::name, path.key("fields"),
                    ValidationRule.DUPLICATE_FIELD_NAME, "union field", context);
        } else if (node instanceof TypeDef.EnumType enumType) {
            checkNames(enumType.values(), EnumValue::name, path.key("values"),
                    ValidationRule.DUPLICATE_VALUE_NAME, "enum value", context);
        } else if (node instanceof TypeDef.BitsetType bitset) {
            checkNames(bitset.values(), BitFlag::name, path.key("values"),
                    ValidationRule.DUPLICATE_VALUE_NAME, "bit flag", context);
        }
    }

    private static <T> void checkNames(final List<T> members, final Function<T, String> nameOf,
            final NodePath listPath, final ValidationRule rule, final String what, final CheckContext context) {
        final Map<String, Integer> firstIndex = new HashMap<>();
        for (int i = 0; i < members.size(); i++) {
            final String name = nameOf.apply(members.get(i));
            final Integer first = firstIndex.putIfAbsent(name, i);
            if (first != null) {
                final NodePath firstPath = listPath.index(first).key("name");
                context.report(rule, listPath.index(i).key("name"),
                        "%s name '%s' is already used at %s".formatted(what, name, firstPath),
                        firstPath);
            }
        }
    }
}
