package dev.sfn;

import dev.sfn.cli.SfnCompilerCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new SfnCompilerCli()).execute(args);
        System.exit(exitCode);
    }
}
