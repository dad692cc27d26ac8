package com.semanticdiff.core.io;

import java.util.List;

/**
 * Thrown when a model fails validation at the model-source boundary. Holds
 * every problem found, not just the first.
 */
public class ModelValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public ModelValidationException(List<String> errors) {
        super(String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
