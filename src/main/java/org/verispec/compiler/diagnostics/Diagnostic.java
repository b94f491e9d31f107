package org.verispec.compiler.diagnostics;

import org.verispec.compiler.api.SourceSpan;

import java.util.List;

/**
 * Represents a single diagnostic message (error, warning, info) about a specification.
 *
 * @param type    The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param spans   The source ranges the message refers to, primary range first. May be empty.
 */
public record Diagnostic(
        Type type,
        String message,
        List<SourceSpan> spans
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents verification. */
        ERROR,
        /** A warning that does not prevent verification. */
        WARNING,
        /** An informational message. */
        INFO
    }

    public Diagnostic {
        spans = List.copyOf(spans);
    }

    /**
     * @return The first span, or {@link SourceSpan#UNKNOWN} if the diagnostic has none.
     */
    public SourceSpan primarySpan() {
        return spans.isEmpty() ? SourceSpan.UNKNOWN : spans.get(0);
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", type, primarySpan(), message);
    }
}
