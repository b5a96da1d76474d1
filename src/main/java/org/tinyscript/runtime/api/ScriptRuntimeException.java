package org.tinyscript.runtime.api;

/**
 * Thrown by the interpreter when the evaluation of a program cannot continue.
 * <p>
 * The line is that of the node being evaluated when the error was detected, or 0 when the
 * error is raised outside of a node (for example by a built-in invoked directly).
 */
public class ScriptRuntimeException extends RuntimeException {

    private final RuntimeErrorKind kind;
    private final int line;

    /**
     * Creates a new runtime error without position information.
     * @param kind The error kind.
     * @param message The message, e.g. {@code name 'x' is not defined}.
     */
    public ScriptRuntimeException(RuntimeErrorKind kind, String message) {
        this(kind, message, 0);
    }

    /**
     * Creates a new runtime error.
     * @param kind The error kind.
     * @param message The message, e.g. {@code name 'x' is not defined}.
     * @param line The source line, or 0 if unknown.
     */
    public ScriptRuntimeException(RuntimeErrorKind kind, String message, int line) {
        super(message);
        this.kind = kind;
        this.line = line;
    }

    /**
     * Returns a copy of this error attributed to a source line, unless it already has one.
     * @param sourceLine The line to attach.
     * @return An error carrying a line number.
     */
    public ScriptRuntimeException atLine(int sourceLine) {
        if (line > 0) {
            return this;
        }
        return new ScriptRuntimeException(kind, getMessage(), sourceLine);
    }

    public RuntimeErrorKind getKind() {
        return kind;
    }

    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        if (line > 0) {
            return String.format("%s: %s (line %d)", kind.displayName(), getMessage(), line);
        }
        return kind.displayName() + ": " + getMessage();
    }
}
