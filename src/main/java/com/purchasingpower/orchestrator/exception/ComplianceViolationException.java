package com.purchasingpower.orchestrator.exception;

import com.purchasingpower.orchestrator.model.compliance.ComplianceValidationResult;
import lombok.Getter;

/**
 * Thrown when an agent response carries actions without validation metadata.
 * The response must not reach the caller.
 */
@Getter
public class ComplianceViolationException extends RuntimeException {

    private final transient ComplianceValidationResult result;

    public ComplianceViolationException(String message, ComplianceValidationResult result) {
        super(message);
        this.result = result;
    }
}
