package io.copilotsession.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.copilotsession.browser.BrowserAuthenticator;
import io.copilotsession.browser.BrowserEngine;
import io.copilotsession.browser.BrowserProvider;
import io.copilotsession.browser.PlaywrightBrowserProvider;
import io.copilotsession.config.SessionConfig;
import io.copilotsession.model.SessionRecord;
import io.copilotsession.prompt.ConsolePrompter;
import io.copilotsession.prompt.ProcessPrompter;
import io.copilotsession.prompt.Prompter;
import io.copilotsession.remote.HttpSessionValidator;
import io.copilotsession.remote.SessionValidator;
import io.copilotsession.runtime.AuthFlow;
import io.copilotsession.security.CredentialVault;
import io.copilotsession.security.KeyringSecretBackend;
import io.copilotsession.security.SecretBackend;
import io.copilotsession.security.SensitiveDataMasker;
import io.copilotsession.storage.SessionStore;
import io.copilotsession.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Function;

@Command(
        name = "copilot-session",
        mixinStandardHelpOptions = true,
        description = "Resolve a Shipping Manager session: reuse, refresh or log in through the browser",
        subcommands = {
                CopilotSessionCommand.ListCommand.class,
                CopilotSessionCommand.DeleteCommand.class,
                CopilotSessionCommand.MigrateCommand.class,
                CopilotSessionCommand.EncryptionInfoCommand.class
        }
)
public final class CopilotSessionCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(CopilotSessionCommand.class);
    public static final String VERBOSE_FLAG = "--verbose";

    @Spec
    CommandSpec spec;

    @Option(names = {"--data-dir"}, description = "Data root directory (default: platform data dir or $SMCOPILOT_DATA_DIR)")
    String dataDir;

    @Option(names = {"--selector"}, arity = "1..*", description = "External session selector command and its arguments")
    List<String> selector;

    @Option(names = {"--browser"}, description = "Browser engine to try, repeatable: chromium|firefox|webkit")
    List<String> browsers;

    @Option(names = {"--no-keyring"}, defaultValue = "false", description = "Skip the OS keyring and use local obfuscation")
    boolean noKeyring;

    @Option(names = {"--save-only"}, defaultValue = "false", hidden = true, description = "Deprecated, sessions are always saved")
    boolean saveOnly;

    @Option(names = {VERBOSE_FLAG}, defaultValue = "false", description = "Debug logging")
    boolean verbose;

    Function<SessionConfig, SessionValidator> validatorFactory = HttpSessionValidator::new;

    public static CommandLine commandLine() {
        return commandLine(new CopilotSessionCommand());
    }

    static CommandLine commandLine(CopilotSessionCommand command) {
        CommandLine cmd = new CommandLine(command);
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            log.error("Error: {}", ex.getMessage());
            log.debug("Failure detail", ex);
            return 1;
        });
        return cmd;
    }

    @Override
    public Integer call() {
        if (saveOnly) {
            log.warn("--save-only is deprecated and ignored, sessions are always saved");
        }
        SessionConfig config = config();
        SessionStore store = store(config);
        SessionValidator validator = validator(config);
        BrowserAuthenticator authenticator = new BrowserAuthenticator(config, providers(), validator);
        AuthFlow flow = new AuthFlow(store, validator, authenticator, prompter(config));

        Optional<String> accountId = flow.run();
        if (accountId.isEmpty()) {
            log.error("No session obtained");
            return 1;
        }
        PrintWriter out = spec.commandLine().getOut();
        out.println(accountId.get());
        out.flush();
        return 0;
    }

    SessionConfig config() {
        return SessionConfig.fromDataRoot(dataDir);
    }

    CredentialVault vault(SessionConfig config) {
        SecretBackend backend = noKeyring
                ? SecretBackend.unavailable("disabled by --no-keyring")
                : new KeyringSecretBackend(config.serviceName());
        return new CredentialVault(backend);
    }

    SessionStore store(SessionConfig config) {
        return new SessionStore(config.sessionsFile(), vault(config));
    }

    SessionValidator validator(SessionConfig config) {
        return validatorFactory.apply(config);
    }

    List<BrowserProvider> providers() {
        List<BrowserEngine> engines = new ArrayList<>();
        if (browsers == null || browsers.isEmpty()) {
            engines.addAll(BrowserEngine.platformOrder(System.getProperty("os.name", "")));
        } else {
            for (String raw : browsers) {
                engines.add(BrowserEngine.fromString(raw));
            }
        }
        return PlaywrightBrowserProvider.forEngines(engines);
    }

    Prompter prompter(SessionConfig config) {
        if (selector == null || selector.isEmpty()) {
            return ConsolePrompter.onStdio();
        }
        return new ProcessPrompter(selector, config.promptTimeoutMs());
    }

    private static void print(CommandSpec spec, String text) {
        PrintWriter out = spec.commandLine().getOut();
        out.println(text);
        out.flush();
    }

    @Command(name = "list", description = "Show stored sessions with secrets masked")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        CopilotSessionCommand parent;

        @Spec
        CommandSpec spec;

        @Option(names = {"--validate"}, defaultValue = "false", description = "Check each session against the game server")
        boolean validate;

        @Override
        public Integer call() {
            SessionConfig config = parent.config();
            SessionStore store = parent.store(config);
            SessionValidator validator = validate ? parent.validator(config) : null;
            ObjectNode out = Jsons.mapper().createObjectNode();
            for (Map.Entry<String, SessionRecord> entry : SessionStore.byRecency(store.load())) {
                JsonNode masked = SensitiveDataMasker.masked(Jsons.mapper().valueToTree(entry.getValue()));
                ObjectNode row = masked.isObject() ? (ObjectNode) masked : Jsons.mapper().createObjectNode();
                if (validator != null) {
                    boolean live = store.decryptBundle(entry.getKey(), entry.getValue())
                            .flatMap(validator::validate)
                            .isPresent();
                    row.put("status", live ? "valid" : "expired");
                }
                out.set(entry.getKey(), row);
            }
            print(spec, Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "delete", description = "Remove a stored session and its keyring entries")
    static final class DeleteCommand implements Callable<Integer> {
        @ParentCommand
        CopilotSessionCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Account id")
        String accountId;

        @Override
        public Integer call() {
            SessionConfig config = parent.config();
            if (!parent.store(config).delete(accountId)) {
                log.error("No session stored for account {}", accountId);
                return 1;
            }
            print(spec, "Deleted session " + accountId);
            return 0;
        }
    }

    @Command(name = "migrate", description = "Encrypt sessions still stored in plaintext")
    static final class MigrateCommand implements Callable<Integer> {
        @ParentCommand
        CopilotSessionCommand parent;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            SessionConfig config = parent.config();
            int migrated = parent.store(config).migrateToEncrypted();
            ObjectNode out = Jsons.mapper().createObjectNode();
            out.put("migrated", migrated);
            out.put("sessionsFile", config.sessionsFile().toString());
            print(spec, Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "encryption-info", description = "Show which secret backend protects stored sessions")
    static final class EncryptionInfoCommand implements Callable<Integer> {
        @ParentCommand
        CopilotSessionCommand parent;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            SessionConfig config = parent.config();
            CredentialVault.EncryptionStatus status = parent.vault(config).status();
            ObjectNode out = Jsons.mapper().createObjectNode();
            out.put("backend", status.backend());
            out.put("secure", status.secure());
            out.put("fallbackScheme", status.fallbackScheme());
            out.put("serviceName", config.serviceName());
            out.put("sessionsFile", config.sessionsFile().toString());
            print(spec, Jsons.toJson(out));
            return 0;
        }
    }
}
