package org.tinyscript.cli;

import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Picocli mixin for commands that take a program either from a file or inline via {@code -e}.
 */
public class SourceOptions {

    /** File name reported in diagnostics for inline programs. */
    public static final String INLINE_SOURCE_NAME = "<eval>";

    @Spec(Spec.Target.MIXEE)
    private CommandSpec mixee;

    @Parameters(index = "0", arity = "0..1", paramLabel = "FILE", description = "The TinyScript source file.")
    private Path file;

    @Option(names = {"-e", "--eval"}, paramLabel = "CODE", description = "Program text to run instead of a file.")
    private String code;

    /**
     * Reads the program text.
     * @return The source code.
     * @throws CommandLine.ParameterException if neither or both of FILE and {@code -e} were given.
     * @throws IOException if the file cannot be read.
     */
    public String read() throws IOException {
        if (file == null && code == null) {
            throw new CommandLine.ParameterException(mixee.commandLine(), "Missing program: give a FILE or -e CODE");
        }
        if (file != null && code != null) {
            throw new CommandLine.ParameterException(mixee.commandLine(), "FILE and -e CODE are mutually exclusive");
        }
        return code != null ? code : Files.readString(file, StandardCharsets.UTF_8);
    }

    /**
     * @return The name diagnostics should use for the program.
     */
    public String name() {
        return file != null ? file.toString() : INLINE_SOURCE_NAME;
    }
}
