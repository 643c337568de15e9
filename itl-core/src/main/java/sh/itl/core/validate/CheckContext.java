// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.itl.core.validate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.itl.core.build.TypeRegistry;
import sh.itl.core.error.ValidationError;
import sh.itl.core.error.ValidationRule;
import sh.itl.core.model.NodePath;
import sh.itl.core.model.TypeDef;
import sh.itl.core.model.TypeRef;

/**
 * Per-run state shared by the checks of one validation: the frozen registry
 * and the error sink. Confined to the validating thread.
 */
final class CheckContext {

    private final TypeRegistry registry;
    private final List<ValidationError> errors = new ArrayList<>();

    CheckContext(final TypeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    TypeRegistry registry() {
        return registry;
    }

    TypeDef resolve(final TypeRef ref) {
        return registry.resolve(ref);
    }

    void report(final ValidationRule rule, final NodePath path, final String detail) {
        errors.add(new ValidationError(rule, path, detail));
    }

    void report(final ValidationRule rule, final NodePath path, final String detail, final NodePath related) {
        errors.add(new ValidationError(rule, path, detail, List.of(related)));
    }

    List<ValidationError> errors() {
        return errors;
    }
}
