package asdl.java21;

import java.util.List;

/// Result of [AsdlValidator#check].
///
/// Validation stops at the first violation, so a failed result holds exactly one error.
public record ValidationResult(boolean isValid, List<ValidationError> errors) {

    private static final ValidationResult SUCCESS = new ValidationResult(true, List.of());

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public static ValidationResult success() {
        return SUCCESS;
    }

    public static ValidationResult failure(ValidationError error) {
        return new ValidationResult(false, List.of(error));
    }
}
