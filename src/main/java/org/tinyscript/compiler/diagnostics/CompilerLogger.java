package org.tinyscript.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verbosity gate for the lexer, parser and compiler facade, driven by
 * {@code tinyscript.compiler.verbosity}. Verbosity 3 lets debug messages through to SLF4J,
 * 4 also trace messages; lower values keep the front end silent whatever Logback allows.
 */
public final class CompilerLogger {

    static final int DEBUG = 3;
    static final int TRACE = 4;

    private static final Logger LOGGER = LoggerFactory.getLogger("org.tinyscript.compiler");

    private static volatile int verbosity = 2;

    private CompilerLogger() {}

    public static void setVerbosity(int newVerbosity) {
        verbosity = newVerbosity;
    }

    static boolean passes(int threshold) {
        return verbosity >= threshold;
    }

    /**
     * Logs a debug message in SLF4J placeholder syntax.
     * @param format The message, with {@code {}} placeholders.
     * @param args The placeholder values.
     */
    public static void debug(String format, Object... args) {
        if (passes(DEBUG)) LOGGER.debug(format, args);
    }

    public static void trace(String format, Object... args) {
        if (passes(TRACE)) LOGGER.trace(format, args);
    }
}
