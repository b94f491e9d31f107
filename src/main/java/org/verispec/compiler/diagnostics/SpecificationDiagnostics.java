package org.verispec.compiler.diagnostics;

import org.verispec.compiler.api.SourceSpan;
import org.verispec.compiler.program.ElementBody;
import org.verispec.compiler.specs.common.Assertion;
import org.verispec.compiler.specs.common.Pledge;
import org.verispec.compiler.specs.typed.Expression;
import org.verispec.compiler.specs.typed.ForAllVars;
import org.verispec.compiler.specs.typed.SpanResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Reports diagnostics that point at typed specifications, e.g. an assertion the verifier
 * could not prove. The spans of the diagnostic are those of the assertion's leaves.
 */
public final class SpecificationDiagnostics {

    private static final Logger LOG = LoggerFactory.getLogger(SpecificationDiagnostics.class);

    private final DiagnosticsEngine diagnostics;
    private final SpanResolver spans;
    private final DiagnosticOptions options;

    /**
     * @param diagnostics The engine receiving the diagnostics.
     * @param spans       Resolves the spans of typed specifications.
     * @param options     Rendering options.
     */
    public SpecificationDiagnostics(DiagnosticsEngine diagnostics, SpanResolver spans, DiagnosticOptions options) {
        this.diagnostics = diagnostics;
        this.spans = spans;
        this.options = options;
    }

    /**
     * Reports an error about a typed assertion.
     *
     * @param message   The error message.
     * @param assertion The assertion the error refers to.
     * @param body      The body of the element the assertion is attached to.
     * @return The spans attached to the diagnostic.
     */
    public List<SourceSpan> reportAssertionError(String message, Assertion<Expression, ForAllVars> assertion,
                                                 ElementBody body) {
        List<SourceSpan> attached = limit(spans.getSpans(assertion, body));
        diagnostics.reportError(message, attached);
        return attached;
    }

    /**
     * Reports an error about a typed pledge.
     *
     * @param message The error message.
     * @param pledge  The pledge the error refers to.
     * @param body    The body of the procedure the pledge is attached to.
     * @return The spans attached to the diagnostic.
     */
    public List<SourceSpan> reportPledgeError(String message, Pledge<Expression, ForAllVars> pledge, ElementBody body) {
        List<SourceSpan> attached = limit(spans.getSpans(pledge, body));
        diagnostics.reportError(message, attached);
        return attached;
    }

    private List<SourceSpan> limit(List<SourceSpan> all) {
        if (all.isEmpty()) {
            LOG.debug("No source position known for reported specification");
        }
        if (options.maxSpans() == 0 || all.size() <= options.maxSpans()) {
            return all;
        }
        LOG.debug("Dropping {} of {} spans from diagnostic", all.size() - options.maxSpans(), all.size());
        return List.copyOf(all.subList(0, options.maxSpans()));
    }
}
