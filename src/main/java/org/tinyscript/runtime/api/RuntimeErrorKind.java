package org.tinyscript.runtime.api;

/**
 * The kinds of error that can stop the evaluation of a program.
 */
public enum RuntimeErrorKind {
    /** An undefined variable or function name. */
    NAME_ERROR("NameError"),
    /** An operand or argument of the wrong kind, or a built-in called with the wrong arity. */
    TYPE_ERROR("TypeError"),
    /** A division whose right operand is zero. */
    ZERO_DIVISION_ERROR("ZeroDivisionError");

    private final String displayName;

    RuntimeErrorKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * @return The name shown to users, e.g. {@code NameError}.
     */
    public String displayName() {
        return displayName;
    }
}
