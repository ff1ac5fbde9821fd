package io.steptrace;

import io.steptrace.cli.StepTraceCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new StepTraceCommand()).execute(args);
        System.exit(code);
    }
}
