package dev.execgraph;

import dev.execgraph.cli.ExecGraphCli;
import picocli.CommandLine;

import java.util.Arrays;

public class Main {
    public static void main(String[] args) {
        // must be set before the first logger is created
        if (Arrays.asList(args).contains("--verbose")) {
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        }
        int exitCode = new CommandLine(new ExecGraphCli()).execute(args);
        System.exit(exitCode);
    }
}
