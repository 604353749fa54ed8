package org.mibig.core.error;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when an entity fails validation.
 *
 * <p>Always carries every violation found in the validated subtree, never just the first one.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * try {
 *     Citation.parse("pubmed:abc");
 * } catch (ValidationException e) {
 *     e.getErrors().forEach(error -> System.err.println(error));
 * }
 * }</pre>
 */
public class ValidationException extends MibigException {

    private final List<ValidationErrorInfo> errors;

    public ValidationException(List<ValidationErrorInfo> errors) {
        super(describe(errors));
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("ValidationException requires at least one error");
        }
        this.errors = List.copyOf(errors);
    }

    /**
     * Creates an exception carrying a single violation.
     *
     * @param field offending field
     * @param message violation description
     * @return new exception
     */
    public static ValidationException of(String field, String message) {
        return new ValidationException(List.of(new ValidationErrorInfo(field, message)));
    }

    public List<ValidationErrorInfo> getErrors() {
        return errors;
    }

    private static String describe(List<ValidationErrorInfo> errors) {
        if (errors == null) {
            return "validation failed";
        }
        return "validation failed with " + errors.size() + " error(s): "
            + errors.stream().map(ValidationErrorInfo::toString).collect(Collectors.joining("; "));
    }
}
