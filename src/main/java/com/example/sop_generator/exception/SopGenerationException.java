package com.example.sop_generator.exception;

/**
 * Raised when a BPMN document cannot be turned into SOP steps.
 * No partial step list is ever returned together with this exception.
 */
public class SopGenerationException extends RuntimeException {

    public SopGenerationException(String message) {
        super(message);
    }

    public SopGenerationException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getCode() {
        return "GENERATION_FAILED";
    }
}
