package io.copilotsession.prompt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.copilotsession.model.SessionSummary;
import io.copilotsession.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external selector program: {@code <command> <validJson> <expiredJson> <True|False>}.
 * The program answers with one JSON object on stdout and exit code 0. Anything else, including
 * running past the timeout, counts as a cancelled dialog.
 */
public final class ProcessPrompter implements Prompter {
    private static final Logger log = LoggerFactory.getLogger(ProcessPrompter.class);
    private static final int MAX_LOG_CHARS = 512;

    private final List<String> command;
    private final long timeoutMs;

    public ProcessPrompter(List<String> command, long timeoutMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("selector command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public Optional<SessionChoice> chooseSession(List<SessionSummary> valid, List<SessionSummary> expired) {
        return invoke(valid, expired, true);
    }

    @Override
    public Optional<SessionChoice> chooseAccount(List<SessionSummary> accounts) {
        return invoke(accounts, List.of(), false);
    }

    static ArrayNode toJson(List<SessionSummary> sessions) {
        ArrayNode out = Jsons.mapper().createArrayNode();
        for (SessionSummary s : sessions) {
            ObjectNode row = out.addObject();
            row.put("account_id", s.accountId());
            row.put("user_id", s.accountId());
            row.put("company_name", s.companyName());
            row.put("login_method", s.loginMethod());
        }
        return out;
    }

    private Optional<SessionChoice> invoke(List<SessionSummary> first, List<SessionSummary> second, boolean showButtons) {
        List<String> argv = new ArrayList<>(command);
        argv.add(Jsons.toCompactJson(toJson(first)));
        argv.add(Jsons.toCompactJson(toJson(second)));
        argv.add(showButtons ? "True" : "False");

        Path stdout;
        try {
            stdout = Files.createTempFile("copilot-selector-", ".out");
        } catch (IOException e) {
            log.error("Error showing session selector: {}", e.getMessage());
            return Optional.empty();
        }
        ProcessBuilder pb = new ProcessBuilder(argv);
        pb.redirectOutput(stdout.toFile());
        pb.redirectError(ProcessBuilder.Redirect.INHERIT);
        Process process = null;
        try {
            process = pb.start();
            process.getOutputStream().close();
            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                log.warn("Session selector timed out after {}", Duration.ofMillis(timeoutMs));
                return Optional.empty();
            }
            String output = Files.readString(stdout, StandardCharsets.UTF_8).strip();
            log.debug("Selector exit={} stdout={}", process.exitValue(), truncate(output));
            if (process.exitValue() != 0 || output.isEmpty()) {
                log.info("User cancelled session selection or selector failed");
                return Optional.empty();
            }
            JsonNode parsed = Jsons.mapper().readTree(output);
            Optional<SessionChoice> choice = SessionChoice.fromJson(parsed);
            if (choice.isEmpty()) {
                log.warn("Invalid selector result: {}", truncate(output));
            }
            return choice;
        } catch (IOException e) {
            log.error("Error showing session selector: {}", e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                process.destroyForcibly();
            }
            log.warn("Session selector interrupted");
            return Optional.empty();
        } finally {
            try {
                Files.deleteIfExists(stdout);
            } catch (IOException e) {
                log.debug("Could not remove selector output {}: {}", stdout, e.getMessage());
            }
        }
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_LOG_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_LOG_CHARS) + "...";
    }
}
