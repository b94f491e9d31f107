package org.verispec.compiler.diagnostics;

import org.verispec.compiler.api.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages about specifications.
 * <p>
 * This decouples error reporting from the code that detects the problem.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message The error message.
     * @param spans   The source ranges involved, primary range first.
     */
    public void reportError(String message, List<SourceSpan> spans) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, spans));
    }

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param spans   The source ranges involved, primary range first.
     */
    public void reportWarning(String message, List<SourceSpan> spans) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, spans));
    }

    /**
     * Reports an informational message.
     *
     * @param message The message.
     * @param spans   The source ranges involved.
     */
    public void reportInfo(String message, List<SourceSpan> spans) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.INFO, message, spans));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
