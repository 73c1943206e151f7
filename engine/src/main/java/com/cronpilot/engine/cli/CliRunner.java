package com.cronpilot.engine.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Runs one CLI command after the context is up and reports its exit code
 * back to SpringApplication.exit.
 */
@Component
@Profile("cli")
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final CronCommand command;

    private int exitCode;

    public CliRunner(CronCommand command) {
        this.command = command;
    }

    @Override
    public void run(String... args) {
        exitCode = command.execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
