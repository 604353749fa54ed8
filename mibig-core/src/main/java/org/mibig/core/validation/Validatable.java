package org.mibig.core.validation;

import org.mibig.core.error.ValidationErrorInfo;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * An entity that can check its own invariants.
 *
 * <p>Implementations collect every violation of their own fields and of all nested entities.
 * They never throw for invariant violations; {@link ValidationContext#check(Validatable)} turns
 * a non-empty result into a {@link org.mibig.core.error.ValidationException}.
 */
public interface Validatable {

    /**
     * Validates this entity and its subtree.
     *
     * @param context quality tier and optional sequence record
     * @return all violations, empty when valid
     */
    List<ValidationErrorInfo> validate(ValidationContext context);

    /**
     * Validates every item of a collection and concatenates the violations.
     *
     * @param items entities to validate
     * @param context validation context
     * @return all violations
     */
    static List<ValidationErrorInfo> validateAll(Collection<? extends Validatable> items, ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        for (Validatable item : items) {
            errors.addAll(item.validate(context));
        }
        return errors;
    }
}
