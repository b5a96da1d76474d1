package org.tinyscript.compiler.api;

import org.tinyscript.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * An exception that is thrown when source text cannot be turned into an AST.
 * <p>
 * It carries the single diagnostic that stopped the compilation (the earliest problem in
 * source order) together with every diagnostic that was recorded on the way.
 */
public class CompilationException extends Exception {

    private final Diagnostic diagnostic;
    private final List<Diagnostic> allDiagnostics;

    /**
     * Constructs a new compilation exception.
     * @param diagnostic The diagnostic that stopped the compilation.
     * @param allDiagnostics All diagnostics recorded during the compilation, in reporting order.
     */
    public CompilationException(Diagnostic diagnostic, List<Diagnostic> allDiagnostics) {
        super(diagnostic.message(), null);
        this.diagnostic = diagnostic;
        this.allDiagnostics = List.copyOf(allDiagnostics);
    }

    /**
     * @return The diagnostic that stopped the compilation.
     */
    public Diagnostic getDiagnostic() {
        return diagnostic;
    }

    /**
     * @return Every diagnostic recorded during the compilation, including lexical errors after the winning one.
     */
    public List<Diagnostic> getAllDiagnostics() {
        return allDiagnostics;
    }
}
