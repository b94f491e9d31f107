package org.verispec.compiler.program;

import org.verispec.compiler.api.SourceSpan;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory {@link ProgramElements} backed by two maps, filled once per compilation unit.
 */
public final class ProgramElementTable implements ProgramElements {

    private final Map<ProgramElementRef, ElementBody> bodies;
    private final Map<ProgramElementRef, SourceSpan> declarationSpans;

    private ProgramElementTable(Map<ProgramElementRef, ElementBody> bodies,
                                Map<ProgramElementRef, SourceSpan> declarationSpans) {
        this.bodies = Map.copyOf(bodies);
        this.declarationSpans = Map.copyOf(declarationSpans);
    }

    @Override
    public Optional<ElementBody> bodyOf(ProgramElementRef element) {
        return Optional.ofNullable(bodies.get(element));
    }

    @Override
    public SourceSpan declarationSpan(ProgramElementRef element) {
        return declarationSpans.getOrDefault(element, SourceSpan.UNKNOWN);
    }

    /**
     * @return The number of elements with a known declaration or body.
     */
    public int size() {
        Set<ProgramElementRef> all = new HashSet<>(declarationSpans.keySet());
        all.addAll(bodies.keySet());
        return all.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects element declarations and bodies.
     */
    public static final class Builder {

        private final Map<ProgramElementRef, ElementBody> bodies = new HashMap<>();
        private final Map<ProgramElementRef, SourceSpan> declarationSpans = new HashMap<>();

        private Builder() {}

        /**
         * Declares an element without a body.
         * @param element The element.
         * @param span The declaration span.
         * @return This builder.
         */
        public Builder declare(ProgramElementRef element, SourceSpan span) {
            declarationSpans.put(element, span);
            return this;
        }

        /**
         * Declares an element together with its body.
         * @param element The element.
         * @param span The declaration span.
         * @param body The element body.
         * @return This builder.
         */
        public Builder declare(ProgramElementRef element, SourceSpan span, ElementBody body) {
            declarationSpans.put(element, span);
            bodies.put(element, body);
            return this;
        }

        public ProgramElementTable build() {
            return new ProgramElementTable(bodies, declarationSpans);
        }
    }
}
