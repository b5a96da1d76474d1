package org.tinyscript.compiler;

import org.tinyscript.compiler.api.CompilationException;
import org.tinyscript.compiler.api.ICompiler;
import org.tinyscript.compiler.diagnostics.CompilerLogger;
import org.tinyscript.compiler.diagnostics.Diagnostic;
import org.tinyscript.compiler.diagnostics.DiagnosticsEngine;
import org.tinyscript.compiler.frontend.lexer.Lexer;
import org.tinyscript.compiler.frontend.lexer.Token;
import org.tinyscript.compiler.frontend.parser.Parser;
import org.tinyscript.compiler.frontend.parser.ast.BlockNode;

import java.util.List;

/**
 * The main compiler implementation. It runs the lexer and the parser over one source text
 * and either returns the AST or throws with the diagnostic that stopped it.
 * It is not thread-safe: the diagnostics engine is reused across calls.
 */
public class Compiler implements ICompiler {

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private int verbosity = -1;

    /**
     * {@inheritDoc}
     * <p>
     * All lexical errors are recorded, but the exception reports the earliest problem in source
     * order, whether that is an illegal character or the syntax error that stopped the parser.
     */
    @Override
    public BlockNode parse(String source, String fileName) throws CompilationException {
        if (verbosity >= 0) {
            CompilerLogger.setVerbosity(verbosity);
        }
        diagnostics.clear();

        // Phase 1: Lexical Analysis
        Lexer lexer = new Lexer(source, diagnostics, fileName);
        List<Token> tokens = lexer.scanTokens();

        // Phase 2: Parsing (builds AST)
        Parser parser = new Parser(tokens, diagnostics);
        BlockNode program = parser.parse();

        if (diagnostics.hasErrors()) {
            Diagnostic winner = diagnostics.first().orElseThrow();
            CompilerLogger.debug("Compilation of {} failed: {}", fileName, diagnostics.summary());
            throw new CompilationException(winner, diagnostics.getDiagnostics());
        }
        return program;
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }
}
