package io.copilotsession.prompt;

import io.copilotsession.model.SessionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Text menus for terminals without a selector program. Menus go to the given stream (stderr
 * from the CLI, stdout stays reserved for the account id). End of input cancels.
 */
public final class ConsolePrompter implements Prompter {
    private static final Logger log = LoggerFactory.getLogger(ConsolePrompter.class);

    private final BufferedReader in;
    private final PrintStream out;

    public ConsolePrompter(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public static ConsolePrompter onStdio() {
        return new ConsolePrompter(
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.err
        );
    }

    @Override
    public Optional<SessionChoice> chooseSession(List<SessionSummary> valid, List<SessionSummary> expired) {
        out.println();
        if (valid.isEmpty()) {
            out.println("No valid sessions.");
        } else {
            out.println("Saved sessions:");
            for (int i = 0; i < valid.size(); i++) {
                out.println("  " + (i + 1) + ") " + describe(valid.get(i)));
            }
        }
        if (!expired.isEmpty()) {
            out.println("Expired sessions:");
            for (SessionSummary s : expired) {
                out.println("  -  " + describe(s));
            }
        }
        while (true) {
            out.print(valid.isEmpty()
                    ? "[n] new login, [r] refresh a session, [q] quit: "
                    : "Session number, [n] new login, [r] refresh a session, [q] quit: ");
            out.flush();
            String line = readLine();
            if (line == null) {
                return Optional.empty();
            }
            String answer = line.trim().toLowerCase(Locale.ROOT);
            switch (answer) {
                case "q", "quit" -> {
                    return Optional.empty();
                }
                case "n", "new" -> {
                    return Optional.of(SessionChoice.newSession());
                }
                case "r", "refresh" -> {
                    return Optional.of(SessionChoice.refresh());
                }
                default -> {
                    int index = parseIndex(answer, valid.size());
                    if (index >= 0) {
                        return Optional.of(SessionChoice.use(valid.get(index).accountId()));
                    }
                    out.println("Invalid choice: " + line.trim());
                }
            }
        }
    }

    @Override
    public Optional<SessionChoice> chooseAccount(List<SessionSummary> accounts) {
        if (accounts.isEmpty()) {
            return Optional.empty();
        }
        out.println();
        out.println("Select the session to refresh:");
        for (int i = 0; i < accounts.size(); i++) {
            out.println("  " + (i + 1) + ") " + describe(accounts.get(i)));
        }
        while (true) {
            out.print("Session number, or empty to go back: ");
            out.flush();
            String line = readLine();
            if (line == null || line.isBlank()) {
                return Optional.empty();
            }
            int index = parseIndex(line.trim(), accounts.size());
            if (index >= 0) {
                return Optional.of(SessionChoice.use(accounts.get(index).accountId()));
            }
            out.println("Invalid choice: " + line.trim());
        }
    }

    private String readLine() {
        try {
            return in.readLine();
        } catch (IOException e) {
            log.warn("Failed to read operator input, treating as cancel: {}", e.getMessage());
            return null;
        }
    }

    private static String describe(SessionSummary s) {
        return s.companyName() + " (ID: " + s.accountId() + ", " + s.loginMethod() + ")";
    }

    private static int parseIndex(String raw, int size) {
        try {
            int value = Integer.parseInt(raw);
            return value >= 1 && value <= size ? value - 1 : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
