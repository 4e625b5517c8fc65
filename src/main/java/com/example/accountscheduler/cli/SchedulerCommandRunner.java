package com.example.accountscheduler.cli;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Set;

/**
 * Runs a CLI command when the application is started with one, e.g.
 * {@code java -jar app.jar schedule --platform=TIKTOK --account=acc-1 --content=pack-42 --at="2026-01-05 04:52"}.
 * Without a command it does nothing and the service starts normally.
 */
@Component
@RequiredArgsConstructor
public class SchedulerCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final Set<String> COMMANDS = Set.of("schedule", "status", "cancel");

    private final SchedulerCommands commands;

    private int exitCode = CommandResult.OK;

    public static boolean isCommand(String[] args) {
        if (args == null) {
            return false;
        }
        for (var arg : args) {
            if (!arg.startsWith("--")) {
                return COMMANDS.contains(arg);
            }
        }
        return false;
    }

    @Override
    public void run(ApplicationArguments args) {
        var nonOptions = args.getNonOptionArgs();
        if (nonOptions.isEmpty() || !COMMANDS.contains(nonOptions.get(0))) {
            return;
        }

        var options = new HashMap<String, String>();
        for (var name : args.getOptionNames()) {
            var values = args.getOptionValues(name);
            options.put(name, values == null || values.isEmpty() ? "" : values.get(values.size() - 1));
        }

        var result = commands.run(nonOptions.get(0), options);
        if (result.isSuccess()) {
            System.out.println(result.getOutput());
        } else {
            System.err.println(result.getOutput());
        }
        exitCode = result.getExitCode();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
