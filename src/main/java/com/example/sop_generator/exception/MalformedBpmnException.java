package com.example.sop_generator.exception;

/**
 * The input is empty, not well-formed XML, or not a valid BPMN 2.0 document.
 */
public class MalformedBpmnException extends SopGenerationException {

    public MalformedBpmnException(String message) {
        super(message);
    }

    public MalformedBpmnException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "MALFORMED_BPMN";
    }
}
