package dev.apicius;

import dev.apicius.cli.ApiciusCli;

public class Main {
    public static void main(String[] args) {
        int exitCode = ApiciusCli.commandLine().execute(args);
        System.exit(exitCode);
    }
}
