package org.verispec.compiler.api;

/**
 * Thrown when the structural specification tree and the typed expression environment
 * disagree with each other.
 * <p>
 * This is not a user-facing error: the structural tree and the environment are produced by the
 * same upstream stage, which guarantees that every expression key is registered and that every
 * quantifier arity matches its body. A violation is a defect in that producer. There is no local
 * recovery, so the exception is unchecked and aborts typing of the whole compilation unit.
 */
public class SpecificationConsistencyException extends RuntimeException {

    private final SpecErrorCode code;

    /**
     * Creates an exception with the given error code and message.
     *
     * @param code    The error code identifying the violated invariant.
     * @param message Description of the inconsistency.
     */
    public SpecificationConsistencyException(SpecErrorCode code, String message) {
        super(String.format("[%s] %s", code, message));
        this.code = code;
    }

    /**
     * @return The error code identifying the violated invariant.
     */
    public SpecErrorCode code() {
        return code;
    }
}
