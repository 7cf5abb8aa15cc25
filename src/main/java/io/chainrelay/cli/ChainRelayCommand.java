package io.chainrelay.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.chainrelay.config.ChainRelayConfig;
import io.chainrelay.config.RuntimeSettings;
import io.chainrelay.connector.ConnectorRegistry;
import io.chainrelay.model.CanonicalIntent;
import io.chainrelay.model.IntentCodec;
import io.chainrelay.model.OperatorException;
import io.chainrelay.observability.AuditIntegrityOutcome;
import io.chainrelay.plane.ExecutionPayloadParser;
import io.chainrelay.policy.PolicyDocument;
import io.chainrelay.policy.PolicyLoader;
import io.chainrelay.runtime.ExecutionOrchestrator;
import io.chainrelay.runtime.ExecutionOutcome;
import io.chainrelay.runtime.PlanOutcome;
import io.chainrelay.runtime.ReplayOutcome;
import io.chainrelay.storage.BreakerState;
import io.chainrelay.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.Callable;

@Command(
        name = "chainrelay",
        mixinStandardHelpOptions = true,
        description = "ChainRelay execution orchestration CLI",
        subcommands = {
                ChainRelayCommand.InitCommand.class,
                ChainRelayCommand.PlanCommand.class,
                ChainRelayCommand.ExecuteCommand.class,
                ChainRelayCommand.ExecutePlaneCommand.class,
                ChainRelayCommand.ReplayCommand.class,
                ChainRelayCommand.AuditVerifyCommand.class,
                ChainRelayCommand.BreakerStatusCommand.class,
                ChainRelayCommand.NonceGcCommand.class
        }
)
public final class ChainRelayCommand implements Runnable {
    static final String EXAMPLE_POLICY_RESOURCE = "/policy.example.json";

    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--namespace"}, description = "Runtime namespace (tenant scope)", defaultValue = "default")
    String namespace;

    /** Command line with operator errors rendered as JSON and mapped to exit code 1. */
    public static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new ChainRelayCommand());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof OperatorException operatorException) {
                ObjectNode out = Jsons.mapper().createObjectNode();
                out.put("ok", false);
                out.set("error", operatorException.error().toJson());
                commandLine.getOut().println(Jsons.toJson(out));
                commandLine.getOut().flush();
                return 1;
            }
            throw ex;
        });
        return cmd;
    }

    @Override
    public void run() {
        System.out.println("Use subcommands: init | plan | execute | execute-plane | replay | audit-verify | breaker-status | nonce-gc");
    }

    ChainRelayConfig config() {
        return ChainRelayConfig.fromRoot(root, namespace);
    }

    ExecutionOrchestrator runtime() {
        ChainRelayConfig config = config();
        RuntimeSettings settings = RuntimeSettings.load(config);
        return new ExecutionOrchestrator(config, settings, ConnectorRegistry.fromSettings(settings), Clock.systemUTC());
    }

    PolicyDocument policy(String policyPath) {
        Path file = policyPath == null || policyPath.isBlank()
                ? config().defaultPolicyFile()
                : Paths.get(policyPath);
        return PolicyLoader.load(file);
    }

    @Command(name = "init", description = "Initialize directories, SQLite schema and an example policy")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        ChainRelayCommand parent;

        @Override
        public Integer call() throws IOException {
            try (ExecutionOrchestrator runtime = parent.runtime()) {
                runtime.init();
                Path policyFile = runtime.config().defaultPolicyFile();
                if (!Files.exists(policyFile)) {
                    try (InputStream in = ChainRelayCommand.class.getResourceAsStream(EXAMPLE_POLICY_RESOURCE)) {
                        if (in == null) {
                            throw new IllegalStateException("Missing bundled resource " + EXAMPLE_POLICY_RESOURCE);
                        }
                        Files.copy(in, policyFile);
                    }
                }
                System.out.println("Initialized ChainRelay at: " + runtime.config().rootDir());
                return 0;
            }
        }
    }

    @Command(name = "plan", description = "Evaluate an intent and print the steps an execution would take")
    static final class PlanCommand implements Callable<Integer> {
        @ParentCommand
        ChainRelayCommand parent;

        @Option(names = {"--intent"}, required = true, description = "Canonical intent JSON file")
        Path intentFile;

        @Option(names = {"--policy"}, description = "Policy JSON file (default <root>/policy.json)")
        String policy;

        @Option(names = {"--dry-run"}, description = "Plan a preflight-only execution")
        boolean dryRun;

        @Override
        public Integer call() {
            CanonicalIntent intent = IntentCodec.fromFile(intentFile);
            PolicyDocument policyDocument = parent.policy(policy);
            try (ExecutionOrchestrator runtime = parent.runtime()) {
                PlanOutcome outcome = runtime.plan(intent, policyDocument, dryRun);
                System.out.println(Jsons.toJson(outcome));
                return outcome.ok() ? 0 : 1;
            }
        }
    }

    @Command(name = "execute", description = "Execute a canonical intent on the control plane")
    static final class ExecuteCommand implements Callable<Integer> {
        @ParentCommand
        ChainRelayCommand parent;

        @Option(names = {"--intent"}, required = true, description = "Canonical intent JSON file")
        Path intentFile;

        @Option(names = {"--policy"}, description = "Policy JSON file (default <root>/policy.json)")
        String policy;

        @Option(names = {"--dry-run"}, description = "Preflight only; no store is touched")
        boolean dryRun;

        @Override
        public Integer call() {
            CanonicalIntent intent = IntentCodec.fromFile(intentFile);
            PolicyDocument policyDocument = parent.policy(policy);
            try (ExecutionOrchestrator runtime = parent.runtime()) {
                runtime.init();
                ExecutionOutcome outcome = runtime.execute(intent, policyDocument, dryRun);
                System.out.println(Jsons.toJson(outcome));
                return outcome.ok() ? 0 : 1;
            }
        }
    }

    @Command(name = "execute-plane", description = "Authenticate and execute an A2A v1 payload")
    static final class ExecutePlaneCommand implements Callable<Integer> {
        @ParentCommand
        ChainRelayCommand parent;

        @Option(names = {"--payload"}, required = true, description = "Execution payload JSON file")
        Path payloadFile;

        @Option(names = {"--policy"}, description = "Policy JSON file (default <root>/policy.json)")
        String policy;

        @Option(names = {"--dry-run"}, description = "Preflight only; no store is touched")
        boolean dryRun;

        @Override
        public Integer call() {
            JsonNode payload = ExecutionPayloadParser.readFile(payloadFile);
            PolicyDocument policyDocument = parent.policy(policy);
            try (ExecutionOrchestrator runtime = parent.runtime()) {
                runtime.init();
                ExecutionOutcome outcome = runtime.executePayload(payload, policyDocument, dryRun);
                System.out.println(Jsons.toJson(outcome));
                return outcome.ok() ? 0 : 1;
            }
        }
    }

    @Command(name = "replay", description = "Print the audit events of one run in append order")
    static final class ReplayCommand implements Callable<Integer> {
        @ParentCommand
        ChainRelayCommand parent;

        @Option(names = {"--run-id"}, required = true, description = "Run id")
        String runId;

        @Override
        public Integer call() {
            try (ExecutionOrchestrator runtime = parent.runtime()) {
                ReplayOutcome outcome = runtime.replay(runId);
                System.out.println(Jsons.toJson(outcome));
                return outcome.found() ? 0 : 1;
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        ChainRelayCommand parent;

        @Override
        public Integer call() {
            try (ExecutionOrchestrator runtime = parent.runtime()) {
                AuditIntegrityOutcome out = runtime.verifyAudit();
                System.out.println(Jsons.toJson(out));
                return out.ok() ? 0 : 1;
            }
        }
    }

    @Command(name = "breaker-status", description = "Show circuit breaker state for a scope")
    static final class BreakerStatusCommand implements Callable<Integer> {
        @ParentCommand
        ChainRelayCommand parent;

        @Option(names = {"--scope"}, required = true, description = "Breaker scope, e.g. connector:jupiter")
        String scope;

        @Override
        public Integer call() {
            try (ExecutionOrchestrator runtime = parent.runtime()) {
                runtime.init();
                BreakerState state = runtime.breakerState(scope);
                System.out.println(Jsons.toJson(state));
                return 0;
            }
        }
    }

    @Command(name = "nonce-gc", description = "Delete expired A2A nonces")
    static final class NonceGcCommand implements Callable<Integer> {
        @ParentCommand
        ChainRelayCommand parent;

        @Override
        public Integer call() {
            try (ExecutionOrchestrator runtime = parent.runtime()) {
                runtime.init();
                ObjectNode out = Jsons.mapper().createObjectNode();
                out.put("purged", runtime.purgeExpiredNonces());
                System.out.println(Jsons.toJson(out));
                return 0;
            }
        }
    }
}
