package dev.dataprep;

import dev.dataprep.cli.DataPrepCli;

public class Main {
    public static void main(String[] args) {
        int exitCode = DataPrepCli.commandLine().execute(args);
        System.exit(exitCode);
    }
}
