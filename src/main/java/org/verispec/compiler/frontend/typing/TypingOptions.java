package org.verispec.compiler.frontend.typing;

import com.typesafe.config.Config;

/**
 * Options of the typing phase.
 *
 * @param traceResolutions Log every resolved expression binding at INFO level.
 */
public record TypingOptions(boolean traceResolutions) {

    private static final String TRACE_RESOLUTIONS = "verispec.typing.trace-resolutions";

    public static TypingOptions defaults() {
        return new TypingOptions(false);
    }

    /**
     * Reads the options from {@code verispec.typing}; missing keys keep their defaults.
     * @param config The application configuration.
     * @return The options.
     */
    public static TypingOptions fromConfig(Config config) {
        boolean trace = config.hasPath(TRACE_RESOLUTIONS) && config.getBoolean(TRACE_RESOLUTIONS);
        return new TypingOptions(trace);
    }
}
