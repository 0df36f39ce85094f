package com.batrun.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to {@link BatrunCommand}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final BatrunCommand batrunCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(BatrunCommand batrunCommand, IFactory factory) {
        this.batrunCommand = batrunCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(batrunCommand, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
