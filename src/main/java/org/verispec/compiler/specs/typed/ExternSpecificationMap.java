package org.verispec.compiler.specs.typed;

import org.verispec.compiler.api.SpecErrorCode;
import org.verispec.compiler.api.SpecificationConsistencyException;
import org.verispec.compiler.program.ProgramElementRef;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps target procedures to the procedures that carry their external specifications.
 */
public final class ExternSpecificationMap {

    private static final ExternSpecificationMap EMPTY = new ExternSpecificationMap(Map.of());

    private final Map<ProgramElementRef, ExternSpecification> entries;

    private ExternSpecificationMap(Map<ProgramElementRef, ExternSpecification> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static ExternSpecificationMap empty() {
        return EMPTY;
    }

    /**
     * @param target The procedure without own annotations.
     * @return Its external specification, or empty if it has none.
     */
    public Optional<ExternSpecification> get(ProgramElementRef target) {
        return Optional.ofNullable(entries.get(target));
    }

    public Map<ProgramElementRef, ExternSpecification> asMap() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects extern specifications. A target may only be specified once.
     */
    public static final class Builder {

        private final Map<ProgramElementRef, ExternSpecification> entries = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Registers an external specification.
         * @param target The procedure without own annotations.
         * @param wrapper The generated wrapper procedure, may be null.
         * @param specBearer The procedure carrying the annotations.
         * @return This builder.
         * @throws SpecificationConsistencyException if the target was already registered.
         */
        public Builder put(ProgramElementRef target, ProgramElementRef wrapper, ProgramElementRef specBearer) {
            ExternSpecification spec = new ExternSpecification(Optional.ofNullable(wrapper), specBearer);
            if (entries.putIfAbsent(target, spec) != null) {
                throw new SpecificationConsistencyException(SpecErrorCode.DUPLICATE_EXTERN_SPECIFICATION,
                        "Procedure " + target + " already has an external specification");
            }
            return this;
        }

        public ExternSpecificationMap build() {
            return new ExternSpecificationMap(entries);
        }
    }
}
