package com.example.accountscheduler.cli;

import lombok.Value;

/**
 * Outcome of a CLI command: process exit code plus the text to print
 */
@Value
public class CommandResult {

    public static final int OK = 0;
    public static final int REJECTED = 1;
    public static final int USAGE = 2;

    int exitCode;
    String output;

    public static CommandResult ok(String output) {
        return new CommandResult(OK, output);
    }

    public static CommandResult rejected(String output) {
        return new CommandResult(REJECTED, output);
    }

    public static CommandResult usage(String output) {
        return new CommandResult(USAGE, output + System.lineSeparator() + SchedulerCommands.USAGE);
    }

    public boolean isSuccess() {
        return exitCode == OK;
    }
}
