// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.validate;

import java.util.BitSet;
import java.util.List;

import sh.itl.core.build.TypeRegistry;
import sh.itl.core.error.ValidationRule;
import sh.itl.core.model.Field;
import sh.itl.core.model.SequenceSize;
import sh.itl.core.model.TypeDef;
import sh.itl.core.model.TypeRef;
import sh.itl.core.model.UnionField;

/**
 * Rejects named types that have no finite value.
 *
 * <p>
 * Finiteness is the least fixpoint of:
 * <ul>
 * <li>scalar and legacy kinds are finite;</li>
 * <li>a sequence is finite when it may be empty (no size, or zero elements) or
 * its element type is finite;</li>
 * <li>a record is finite when every required field is finite;</li>
 * <li>a union is finite when some alternative is finite.</li>
 * </ul>
 * Starting from "nothing named is finite", named types are promoted until no
 * more change. Whatever remains is self-contained without indirection, e.g. a
 * record whose required field is the record itself.
 */
final class RecursionCheck {

    void check(final CheckContext context) {
        final List<TypeRegistry.Entry> entries = context.registry().entries();
        final BitSet finite = new BitSet(entries.size());
        boolean changed = true;
        while (changed) {
            changed = false;
            for (TypeRegistry.Entry entry : entries) {
                final int index = entry.id().index();
                if (!finite.get(index) && isFinite(entry.definition(), finite)) {
                    finite.set(index);
                    changed = true;
                }
            }
        }

        for (TypeRegistry.Entry entry : entries) {
            if (!finite.get(entry.id().index())) {
                context.report(ValidationRule.UNBOUNDED_RECURSION, entry.path(),
                        "type '%s' has no finite value; break the cycle with an optional field,"
                                .formatted(entry.name())
                                + " a variable-length sequence or a non-recursive union alternative");
            }
        }
    }

    private static boolean isFinite(final TypeDef node, final BitSet finite) {
        if (node instanceof TypeDef.SequenceType sequence) {
            final SequenceSize size = sequence.size();
            return size == null || size.elementCount() <= 0 || isFinite(sequence.type(), finite);
        }
        if (node instanceof TypeDef.RecordType record) {
            for (Field field : record.fields()) {
                if (!field.optional() && !isFinite(field.type(), finite)) {
                    return false;
                }
            }
            return true;
        }
        if (node instanceof TypeDef.UnionType union) {
            // an empty union is reported on its own
            if (union.fields().isEmpty()) {
                return true;
            }
            for (UnionField field : union.fields()) {
                if (isFinite(field.type(), finite)) {
                    return true;
                }
            }
            return false;
        }
        return true;
    }

    private static boolean isFinite(final TypeRef ref, final BitSet finite) {
        if (ref instanceof TypeRef.Named named) {
            return finite.get(named.id().index());
        }
        if (ref instanceof TypeRef.Inline inline) {
            return isFinite(inline.definition(), finite);
        }
        return false;
    }
}
