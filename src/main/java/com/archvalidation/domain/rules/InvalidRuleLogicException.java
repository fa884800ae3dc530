package com.archvalidation.domain.rules;

/**
 * Thrown when a rule's logic document cannot be interpreted.
 */
public class InvalidRuleLogicException extends RuntimeException {

    public InvalidRuleLogicException(String message) {
        super(message);
    }

    public InvalidRuleLogicException(String message, Throwable cause) {
        super(message, cause);
    }
}
