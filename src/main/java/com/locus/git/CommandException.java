package com.locus.git;

/**
 * An external command (git, gh, docker) failed in a way the caller cannot recover from locally.
 */
public class CommandException extends RuntimeException {

    private final String command;
    private final int exitCode;
    private final String stderr;

    public CommandException(String command, int exitCode, String stderr) {
        super("'%s' failed (exit code %d): %s".formatted(command, exitCode, stderr));
        this.command = command;
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    public CommandException(String message, Throwable cause) {
        super(message, cause);
        this.command = null;
        this.exitCode = -1;
        this.stderr = null;
    }

    public String getCommand() {
        return command;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getStderr() {
        return stderr;
    }
}
