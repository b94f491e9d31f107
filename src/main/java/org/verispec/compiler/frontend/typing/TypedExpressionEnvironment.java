package org.verispec.compiler.frontend.typing;

import org.verispec.compiler.api.SpecErrorCode;
import org.verispec.compiler.api.SpecificationConsistencyException;
import org.verispec.compiler.program.ProgramElementRef;
import org.verispec.compiler.specs.common.ExpressionId;
import org.verispec.compiler.specs.common.SpecificationId;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps the composite key {@code "{spec_id}_{expr_id}"} of every specification expression to the
 * program element that implements the expression's body.
 * <p>
 * Built once from the compiled program before typing starts and read-only afterwards, so it can
 * be shared between typing passes without synchronization. The key only exists at this boundary:
 * typed nodes carry the resolved {@link ProgramElementRef} and never the string.
 */
public final class TypedExpressionEnvironment {

    private final Map<String, ProgramElementRef> bindings;

    private TypedExpressionEnvironment(Map<String, ProgramElementRef> bindings) {
        this.bindings = Map.copyOf(bindings);
    }

    /**
     * Forms the composite key of an expression.
     * @param specId The owning specification.
     * @param exprId The expression.
     * @return The key, e.g. {@code 7f1c...-...e2_3}.
     */
    public static String key(SpecificationId specId, ExpressionId exprId) {
        return specId + "_" + exprId;
    }

    /**
     * Resolves an expression to the program element implementing it.
     *
     * @param specId The owning specification.
     * @param exprId The expression.
     * @return The resolved element, never null.
     * @throws SpecificationConsistencyException if the key was never registered.
     */
    public ProgramElementRef resolve(SpecificationId specId, ExpressionId exprId) {
        String key = key(specId, exprId);
        ProgramElementRef ref = bindings.get(key);
        if (ref == null) {
            throw new SpecificationConsistencyException(SpecErrorCode.UNRESOLVED_EXPRESSION,
                    "No program element registered for expression key '" + key + "'");
        }
        return ref;
    }

    public boolean contains(SpecificationId specId, ExpressionId exprId) {
        return bindings.containsKey(key(specId, exprId));
    }

    public int size() {
        return bindings.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects bindings while the program is compiled.
     */
    public static final class Builder {

        private final Map<String, ProgramElementRef> bindings = new HashMap<>();

        private Builder() {}

        /**
         * Registers the element implementing an expression.
         * @param specId The owning specification.
         * @param exprId The expression.
         * @param element The implementing element.
         * @return This builder.
         */
        public Builder register(SpecificationId specId, ExpressionId exprId, ProgramElementRef element) {
            return register(key(specId, exprId), element);
        }

        /**
         * Registers the element implementing an expression under an already formed key.
         * Registering the same binding twice is allowed; rebinding a key is not.
         *
         * @param key The composite key.
         * @param element The implementing element.
         * @return This builder.
         * @throws SpecificationConsistencyException if the key is already bound to another element.
         */
        public Builder register(String key, ProgramElementRef element) {
            ProgramElementRef previous = bindings.putIfAbsent(key, element);
            if (previous != null && !previous.equals(element)) {
                throw new SpecificationConsistencyException(SpecErrorCode.DUPLICATE_EXPRESSION_KEY,
                        "Expression key '" + key + "' is bound to both " + previous + " and " + element);
            }
            return this;
        }

        public TypedExpressionEnvironment build() {
            return new TypedExpressionEnvironment(bindings);
        }
    }
}
