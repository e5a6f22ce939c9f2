package io.copilotsession;

import io.copilotsession.cli.CopilotSessionCommand;

import java.util.Arrays;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        // slf4j-simple reads its level once, when the first logger is created.
        if (Arrays.asList(args).contains(CopilotSessionCommand.VERBOSE_FLAG)) {
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        }
        int code = CopilotSessionCommand.commandLine().execute(args);
        System.exit(code);
    }
}
