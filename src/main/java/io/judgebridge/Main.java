package io.judgebridge;

import io.judgebridge.cli.JudgeBridgeCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new JudgeBridgeCommand()).execute(args);
        System.exit(code);
    }
}
