package com.semanticdiff.core.io;

/**
 * What to do with two elements sharing a name within one scope of a model.
 */
public enum DuplicateNamePolicy {
    /** Accept the model; the later element wins in every identity-keyed comparison */
    LAST_WINS,

    /** Reject the model with a {@link ModelValidationException} */
    REJECT
}
