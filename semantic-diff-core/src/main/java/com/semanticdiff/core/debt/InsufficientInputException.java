package com.semanticdiff.core.debt;

/**
 * Thrown when a cross-model analysis receives fewer than two models.
 */
public class InsufficientInputException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int modelCount;

    public InsufficientInputException(int modelCount) {
        super("At least 2 models are required for cross-model analysis, got " + modelCount);
        this.modelCount = modelCount;
    }

    public int getModelCount() {
        return modelCount;
    }
}
