// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.validate;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import sh.itl.core.error.ValidationRule;
import sh.itl.core.model.Label;
import sh.itl.core.model.NodePath;
import sh.itl.core.model.TypeDef;
import sh.itl.core.model.TypeNames;
import sh.itl.core.model.UnionField;

/**
 * Union well-formedness.
 *
 * <ul>
 * <li>at least one alternative;</li>
 * <li>at most one default (label-less) alternative;</li>
 * <li>a discriminator whose values can be labels;</li>
 * <li>every label legal for the discriminator;</li>
 * <li>label sets pairwise disjoint, compared by canonical value.</li>
 * </ul>
 */
final class UnionCheck implements NodeCheck {

    @Override
    public void check(final NodePath path, final TypeDef node, final CheckContext context) {
        if (!(node instanceof TypeDef.UnionType union)) {
            return;
        }
        final NodePath fieldsPath = path.key("fields");
        final List<UnionField> fields = union.fields();
        if (fields.isEmpty()) {
            context.report(ValidationRule.EMPTY_UNION, fieldsPath, "union declares no alternatives");
            return;
        }

        Integer firstDefault = null;
        for (int i = 0; i < fields.size(); i++) {
            if (!fields.get(i).isDefault()) {
                continue;
            }
            if (firstDefault == null) {
                firstDefault = i;
            } else {
                final NodePath firstPath = fieldsPath.index(firstDefault).key("labels");
                context.report(ValidationRule.AMBIGUOUS_DEFAULT, fieldsPath.index(i).key("labels"),
                        "'%s' is a second default alternative; '%s' already is one"
                                .formatted(fields.get(i).name(), fields.get(firstDefault).name()),
                        firstPath);
            }
        }

        final TypeDef discriminator = context.resolve(union.discriminator());
        final LabelDomain domain = LabelDomain.of(discriminator);
        if (domain == null) {
            context.report(ValidationRule.INVALID_DISCRIMINATOR, path.key("discriminator"),
                    "values of %s cannot select an alternative".formatted(TypeNames.describe(discriminator)));
        }

        final Map<Label, Integer> owners = new HashMap<>();
        for (int i = 0; i < fields.size(); i++) {
            final UnionField field = fields.get(i);
            final NodePath labelsPath = fieldsPath.index(i).key("labels");
            final Set<Label> seenInField = new HashSet<>();
            for (Label label : field.labels()) {
                final Label canonical;
                if (domain == null) {
                    canonical = label;
                } else {
                    final Optional<Label> inDomain = domain.canonical(label);
                    if (inDomain.isEmpty()) {
                        context.report(ValidationRule.LABEL_OUT_OF_DOMAIN, labelsPath,
                                "label %s of '%s' is not %s".formatted(label.render(), field.name(),
                                        domain.describe()));
                        continue;
                    }
                    canonical = inDomain.get();
                }
                if (!seenInField.add(canonical)) {
                    continue;
                }
                final Integer owner = owners.putIfAbsent(canonical, i);
                if (owner != null) {
                    context.report(ValidationRule.OVERLAPPING_LABELS, labelsPath,
                            "label %s of '%s' already selects '%s'"
                                    .formatted(label.render(), field.name(), fields.get(owner).name()),
                            fieldsPath.index(owner).key("labels"));
                }
            }
        }
    }
}
