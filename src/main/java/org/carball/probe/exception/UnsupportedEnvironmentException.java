package org.carball.probe.exception;

import org.carball.probe.model.ValidationResult;

/**
 * Thrown when precondition validation rejects the target instance.
 */
public class UnsupportedEnvironmentException extends QueryAnalysisException {

    private final ValidationResult validationResult;

    public UnsupportedEnvironmentException(ValidationResult validationResult) {
        super("SQL Server instance does not meet query analysis preconditions: " + validationResult.describeFailures());
        this.validationResult = validationResult;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }
}
