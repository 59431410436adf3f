package com.company.watchdog.exception;

import com.company.watchdog.domain.enums.ValidationFailure;

public class RequirementValidationException extends ConfigParseException {

    private final ValidationFailure failure;

    public RequirementValidationException(ValidationFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public ValidationFailure getFailure() {
        return failure;
    }
}
