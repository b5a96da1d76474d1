package org.tinyscript.cli;

/**
 * Process exit codes returned by the CLI commands.
 */
public final class ExitCodes {

    public static final int OK = 0;
    /** Invalid arguments, unreadable input or a broken configuration file. */
    public static final int USAGE_ERROR = 1;
    public static final int COMPILATION_ERROR = 2;
    public static final int RUNTIME_ERROR = 3;
    public static final int TIMEOUT = 4;

    private ExitCodes() {}
}
