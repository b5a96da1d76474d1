package org.tinyscript.compiler.api;

import org.tinyscript.compiler.frontend.parser.ast.BlockNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public interface for turning TinyScript source text into an AST.
 */
public interface ICompiler {

    /**
     * Parses the given source code.
     *
     * @param source The complete program text.
     * @return The program as a {@link BlockNode}.
     * @throws CompilationException if a lexical or syntax error occurs.
     */
    default BlockNode parse(String source) throws CompilationException {
        return parse(source, "<memory>");
    }

    /**
     * Parses the given source code, attributing diagnostics to a logical file name.
     *
     * @param source The complete program text.
     * @param fileName The name reported in diagnostics.
     * @return The program as a {@link BlockNode}.
     * @throws CompilationException if a lexical or syntax error occurs.
     */
    BlockNode parse(String source, String fileName) throws CompilationException;

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=errors only ... 4=trace).
     */
    void setVerbosity(int level);

    /**
     * Parses the source code from a file.
     * @param programPath The path to the source file.
     * @return The program as a {@link BlockNode}.
     * @throws CompilationException if a lexical or syntax error occurs.
     * @throws IOException if the file cannot be read.
     */
    default BlockNode parseFile(Path programPath) throws CompilationException, IOException {
        return parse(Files.readString(programPath), programPath.toString());
    }
}
