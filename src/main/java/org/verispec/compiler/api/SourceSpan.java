package org.verispec.compiler.api;

/**
 * A pure data class representing a range in the source code.
 * It is part of the public API and only used for diagnostics, never for semantics.
 *
 * @param fileName    The file where the code is located.
 * @param startLine   The first line of the range (1-based).
 * @param startColumn The first column of the range (1-based).
 * @param endLine     The last line of the range.
 * @param endColumn   The column after the last character of the range.
 */
public record SourceSpan(String fileName, int startLine, int startColumn, int endLine, int endColumn) {

    /** Placeholder for positions the host compiler could not provide. */
    public static final SourceSpan UNKNOWN = new SourceSpan("unknown", -1, -1, -1, -1);

    /**
     * Creates a span covering a single position.
     * @param fileName The file name.
     * @param line The line number.
     * @param column The column number.
     * @return A zero-width span at the given position.
     */
    public static SourceSpan at(String fileName, int line, int column) {
        return new SourceSpan(fileName, line, column, line, column);
    }

    @Override
    public String toString() {
        return String.format("%s:%d:%d", fileName, startLine, startColumn);
    }
}
