package org.verispec.compiler.program;

import org.verispec.compiler.api.SourceSpan;

import java.util.Optional;

/**
 * Introspection into the program elements of the compilation unit, provided by the host compiler.
 * Implementations must be read-only for the duration of a typing pass.
 */
public interface ProgramElements {

    /**
     * Returns the body of the given element.
     * @param element The element to inspect.
     * @return The body, or empty if the host compiler has no body for the element.
     */
    Optional<ElementBody> bodyOf(ProgramElementRef element);

    /**
     * Returns the declaration span of the given element.
     * @param element The element to look up.
     * @return The span of the declaration, {@link SourceSpan#UNKNOWN} if the position is not known.
     */
    SourceSpan declarationSpan(ProgramElementRef element);
}
