package org.verispec.compiler.diagnostics;

import com.typesafe.config.Config;

/**
 * Options for rendering specification diagnostics.
 *
 * @param maxSpans Upper bound of spans attached to one diagnostic; 0 means unlimited.
 */
public record DiagnosticOptions(int maxSpans) {

    private static final String MAX_SPANS = "verispec.diagnostics.max-spans";

    public DiagnosticOptions {
        if (maxSpans < 0) {
            throw new IllegalArgumentException(MAX_SPANS + " must not be negative: " + maxSpans);
        }
    }

    public static DiagnosticOptions defaults() {
        return new DiagnosticOptions(0);
    }

    /**
     * Reads the options from {@code verispec.diagnostics}; missing keys keep their defaults.
     * @param config The application configuration.
     * @return The options.
     */
    public static DiagnosticOptions fromConfig(Config config) {
        return new DiagnosticOptions(config.hasPath(MAX_SPANS) ? config.getInt(MAX_SPANS) : 0);
    }
}
