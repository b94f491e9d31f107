package org.verispec.compiler.api;

/**
 * Defines unique, testable error codes for all failures that can occur while typing specifications.
 * This decouples the test logic from the exact wording of the messages.
 */
public enum SpecErrorCode {
    // region Environment
    /** A composite expression key was not registered by the producer of the structural tree. */
    UNRESOLVED_EXPRESSION,
    /** The same composite expression key was registered twice with different bindings. */
    DUPLICATE_EXPRESSION_KEY,
    // endregion

    // region Quantifiers
    /** The host compiler has no body for the element that declares the quantified variables. */
    MISSING_ELEMENT_BODY,
    /** An argument of the quantifier body has no local declaration. */
    MISSING_ARGUMENT_DECLARATION,
    /** The body argument count minus the closure argument differs from the declared arity. */
    QUANTIFIER_ARITY_MISMATCH,
    /** The number of collected variable pairs differs from the declared arity. */
    QUANTIFIER_VARIABLE_COUNT_MISMATCH,
    // endregion

    // region Output maps
    /** Two top-level assertions were registered under the same specification id. */
    DUPLICATE_SPECIFICATION,
    /** Two extern specifications were registered for the same target procedure. */
    DUPLICATE_EXTERN_SPECIFICATION
    // endregion
}
