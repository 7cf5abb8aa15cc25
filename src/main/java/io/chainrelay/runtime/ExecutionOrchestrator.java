package io.chainrelay.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.chainrelay.config.ChainRelayConfig;
import io.chainrelay.config.RuntimeSettings;
import io.chainrelay.connector.Connector;
import io.chainrelay.connector.ConnectorRegistry;
import io.chainrelay.connector.ConnectorResult;
import io.chainrelay.connector.DispatchRequest;
import io.chainrelay.model.CanonicalIntent;
import io.chainrelay.model.CrossDomainLeg;
import io.chainrelay.model.ErrorCode;
import io.chainrelay.model.ExecutionState;
import io.chainrelay.model.IntentCodec;
import io.chainrelay.model.OperatorError;
import io.chainrelay.model.OperatorException;
import io.chainrelay.model.Phase;
import io.chainrelay.model.Plane;
import io.chainrelay.observability.AuditEvent;
import io.chainrelay.observability.AuditIntegrityOutcome;
import io.chainrelay.observability.AuditLog;
import io.chainrelay.plane.ExecutionPayload;
import io.chainrelay.plane.ExecutionPayloadParser;
import io.chainrelay.policy.EvaluationContext;
import io.chainrelay.policy.PolicyDocument;
import io.chainrelay.policy.PolicyEngine;
import io.chainrelay.policy.PolicyEvaluationResult;
import io.chainrelay.policy.PolicyViolation;
import io.chainrelay.routing.RouteCheck;
import io.chainrelay.routing.RouteFeasibilityTable;
import io.chainrelay.security.A2aKeyring;
import io.chainrelay.security.A2aSecurityPerimeter;
import io.chainrelay.security.AuthResult;
import io.chainrelay.security.FileA2aKeyring;
import io.chainrelay.storage.BreakerState;
import io.chainrelay.storage.CircuitBreaker;
import io.chainrelay.storage.Database;
import io.chainrelay.storage.FileLockManager;
import io.chainrelay.storage.IdempotencyRecord;
import io.chainrelay.storage.IdempotencyStore;
import io.chainrelay.storage.NonceStore;
import io.chainrelay.util.Hashing;
import io.chainrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one intent through policy, idempotency, breaker, route and dispatch, appending
 * one audit event per transition.
 *
 * <p>Nothing here retries. Policy, route and security failures end the attempt before
 * any store is mutated; a connector failure settles the idempotency record and counts
 * against the breaker. Dry-runs reach the connector in preflight mode and leave both
 * stores untouched.
 */
public final class ExecutionOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExecutionOrchestrator.class);
    private static final String SKIPPED_DRY_RUN = "dry_run";

    private final ChainRelayConfig config;
    private final RuntimeSettings settings;
    private final Clock clock;
    private final Database database;
    private final IdempotencyStore idempotency;
    private final CircuitBreaker breaker;
    private final NonceStore nonces;
    private final A2aSecurityPerimeter perimeter;
    private final AuditLog auditLog;
    private final PolicyEngine policyEngine;
    private final RouteFeasibilityTable routes;
    private final ConnectorRegistry connectors;
    private final ExecutionPlanner planner;
    private final ExecutorService dispatchPool;

    public ExecutionOrchestrator(ChainRelayConfig config, RuntimeSettings settings, ConnectorRegistry connectors, Clock clock) {
        this(config, settings, connectors, FileA2aKeyring.load(config.a2aKeysFile()), clock);
    }

    public ExecutionOrchestrator(
            ChainRelayConfig config,
            RuntimeSettings settings,
            ConnectorRegistry connectors,
            A2aKeyring keyring,
            Clock clock
    ) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.connectors = connectors;
        this.database = new Database(config);
        this.idempotency = new IdempotencyStore(database,
                new FileLockManager(config.idempotencyLocks(), settings.lockTimeoutMs(), settings.lockStaleMs()), clock);
        this.breaker = new CircuitBreaker(database,
                new FileLockManager(config.breakerLocks(), settings.lockTimeoutMs(), settings.lockStaleMs()), clock,
                new CircuitBreaker.Settings(settings.breakerMaxFailures(), settings.breakerWindowMs(),
                        settings.breakerCooldownMs(), settings.breakerTrialStaleMs()));
        this.nonces = new NonceStore(database,
                new FileLockManager(config.nonceLocks(), settings.lockTimeoutMs(), settings.lockStaleMs()), clock,
                settings.a2aNonceTtlMs());
        this.perimeter = new A2aSecurityPerimeter(keyring, nonces, clock,
                new A2aSecurityPerimeter.Settings(settings.a2aSecurityMode(), settings.a2aAllowUnsignedLive(),
                        settings.a2aMaxSkewMs()));
        String signingSecret = settings.auditSigningSecret().isBlank()
                ? loadOrCreateAuditSigningSecret(config.auditSigningKeyFile())
                : settings.auditSigningSecret();
        this.auditLog = new AuditLog(config.auditFile(), config.namespace(), signingSecret, clock);
        this.policyEngine = new PolicyEngine();
        this.routes = new RouteFeasibilityTable();
        this.planner = new ExecutionPlanner(policyEngine, routes, connectors, settings.signerIdentities());
        AtomicInteger threads = new AtomicInteger();
        this.dispatchPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "chainrelay-dispatch-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void init() {
        database.init();
    }

    public ChainRelayConfig config() {
        return config;
    }

    public RuntimeSettings settings() {
        return settings;
    }

    public IdempotencyStore idempotencyStore() {
        return idempotency;
    }

    public CircuitBreaker circuitBreaker() {
        return breaker;
    }

    public NonceStore nonceStore() {
        return nonces;
    }

    public AuditLog auditLog() {
        return auditLog;
    }

    /** Fingerprint of an intent under a policy version; equal requests map to equal keys. */
    public static String idempotencyKeyFor(CanonicalIntent intent, PolicyDocument policy) {
        ObjectNode material = Jsons.mapper().createObjectNode();
        material.set("intent", IntentCodec.toJson(intent));
        material.put("policyVersion", policy.version());
        return Hashing.sha256Hex(Jsons.canonical(material));
    }

    public PlanOutcome plan(CanonicalIntent intent, PolicyDocument policy, boolean dryRun) {
        return planner.plan(intent, policy, dryRun || policy.defaultDryRun());
    }

    /** Control-plane execution of an already-trusted intent. */
    public ExecutionOutcome execute(CanonicalIntent intent, PolicyDocument policy, boolean dryRun) {
        Run run = new Run(newRunId(), Plane.CONTROL, dryRun || policy.defaultDryRun(), null);
        return run(run, intent, policy);
    }

    /** Execution-plane entry: the envelope is authenticated before anything else happens. */
    public ExecutionOutcome executePayload(JsonNode raw, PolicyDocument policy, boolean dryRun) {
        String runId = newRunId();
        boolean requestedDryRun = dryRun || policy.defaultDryRun() || raw.path("meta").path("dryRun").asBoolean(false);
        ExecutionPayload payload;
        CanonicalIntent intent;
        try {
            payload = ExecutionPayloadParser.parse(raw);
            intent = ExecutionPayloadParser.toIntent(payload);
        } catch (OperatorException e) {
            Run rejected = new Run(runId, Plane.EXECUTION, requestedDryRun, null);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("operation", raw.path("operation").asText(null));
            details.put("error", e.error());
            audit(rejected, Phase.SECURITY, "payload_rejected", ExecutionState.FAILED, details);
            return failed(rejected, ExecutionState.FAILED, null, null, e.error(), null);
        }
        boolean effectiveDryRun = requestedDryRun || payload.meta().dryRun();
        AuthResult auth;
        try {
            auth = perimeter.authenticate(raw, effectiveDryRun);
        } catch (RuntimeException e) {
            log.error("Run {} failed to authenticate on infrastructure", runId, e);
            Run rejected = new Run(runId, Plane.EXECUTION, effectiveDryRun, null);
            OperatorError error = OperatorError.of(ErrorCode.STORE_FAILURE, String.valueOf(e.getMessage()));
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("operation", payload.operation().wireName());
            details.put("requestId", payload.meta().requestId());
            details.put("error", error);
            audit(rejected, Phase.SECURITY, "auth_rejected", ExecutionState.FAILED, details);
            return failed(rejected, ExecutionState.FAILED, IntentCodec.toJson(intent), null, error, null);
        }
        Run run = new Run(runId, Plane.EXECUTION, effectiveDryRun, auth);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operation", payload.operation().wireName());
        details.put("mode", auth.mode().wireName());
        details.put("verified", auth.verified());
        details.put("keyId", auth.keyId());
        details.put("reason", auth.reason());
        details.put("requestId", payload.meta().requestId());
        details.put("correlationId", payload.meta().correlationId());
        if (!auth.ok()) {
            details.put("error", auth.error());
            audit(run, Phase.SECURITY, "auth_rejected", ExecutionState.FAILED, details);
            return failed(run, ExecutionState.FAILED, IntentCodec.toJson(intent), null, auth.error(), null);
        }
        audit(run, Phase.SECURITY, "auth_accepted", ExecutionState.RECEIVED, details);
        return run(run, intent, policy);
    }

    public ReplayOutcome replay(String runId) {
        return ReplayOutcome.of(runId, auditLog.readRun(runId));
    }

    public AuditIntegrityOutcome verifyAudit() {
        return auditLog.verify();
    }

    public BreakerState breakerState(String scope) {
        return breaker.state(scope);
    }

    public int purgeExpiredNonces() {
        return nonces.purgeExpired();
    }

    @Override
    public void close() {
        dispatchPool.shutdownNow();
    }

    private ExecutionOutcome run(Run run, CanonicalIntent intent, PolicyDocument policy) {
        JsonNode intentJson = IntentCodec.toJson(intent);
        String key = idempotencyKeyFor(intent, policy);

        PolicyEvaluationResult evaluation = policyEngine.evaluate(intent, policy,
                EvaluationContext.of(run.dryRun(), settings.signerIdentities()));
        if (!evaluation.allowed()) {
            OperatorError error = OperatorError.of(ErrorCode.POLICY_VIOLATION, "Intent violates policy " + policy.version(),
                    Map.of("policyVersion", policy.version(), "violations", violationMaps(evaluation.violations())));
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("action", intent.action().wireName());
            details.put("policyVersion", policy.version());
            details.put("violations", violationMaps(evaluation.violations()));
            audit(run, Phase.POLICY, "policy_denied", ExecutionState.FAILED, details);
            return failed(run, ExecutionState.FAILED, intentJson, null, error, evaluation);
        }
        Map<String, Object> policyDetails = new LinkedHashMap<>();
        policyDetails.put("action", intent.action().wireName());
        policyDetails.put("policyVersion", policy.version());
        policyDetails.put("notionalUsd", evaluation.notionalUsd());
        policyDetails.put("requiresSimulationFirst", evaluation.requiresSimulationFirst());
        policyDetails.put("intent", intentJson);
        audit(run, Phase.POLICY, "policy_checked", ExecutionState.POLICY_CHECKED, policyDetails);

        Attempt attempt = new Attempt(run, intent, intentJson, key, evaluation);
        try {
            return attempt.proceed();
        } catch (OperatorException e) {
            attempt.abandon();
            audit(run, Phase.RESULT, "failed", ExecutionState.FAILED, Map.of("error", e.error()));
            return failed(run, ExecutionState.FAILED, intentJson, key, e.error(), evaluation);
        } catch (RuntimeException e) {
            log.error("Run {} failed on infrastructure", run.runId(), e);
            attempt.abandon();
            OperatorError error = OperatorError.of(ErrorCode.STORE_FAILURE, String.valueOf(e.getMessage()));
            audit(run, Phase.RESULT, "failed", ExecutionState.FAILED, Map.of("error", error));
            return failed(run, ExecutionState.FAILED, intentJson, key, error, evaluation);
        }
    }

    /** Mutable progress of one live or dry-run attempt past the policy gate. */
    private final class Attempt {
        private final Run run;
        private final CanonicalIntent intent;
        private final JsonNode intentJson;
        private final String key;
        private final PolicyEvaluationResult evaluation;
        private final String scope;
        private boolean reserved;
        private String trialToken;
        private boolean dispatched;

        private Attempt(Run run, CanonicalIntent intent, JsonNode intentJson, String key, PolicyEvaluationResult evaluation) {
            this.run = run;
            this.intent = intent;
            this.intentJson = intentJson;
            this.key = key;
            this.evaluation = evaluation;
            this.scope = settings.breakerScope().keyFor(intent);
        }

        ExecutionOutcome proceed() {
            if (run.dryRun()) {
                audit(run, Phase.IDEMPOTENCY, "idempotency_skipped", ExecutionState.IDEMPOTENCY_CHECKED,
                        Map.of("idempotencyKey", key, "skipped", SKIPPED_DRY_RUN));
            } else {
                IdempotencyStore.BeginResult begin = idempotency.begin(key, run.runId());
                if (!begin.isNew()) {
                    return fromExisting(begin.existing());
                }
                reserved = true;
                audit(run, Phase.IDEMPOTENCY, "idempotency_reserved", ExecutionState.IDEMPOTENCY_CHECKED,
                        Map.of("idempotencyKey", key));
            }

            if (run.dryRun()) {
                audit(run, Phase.BREAKER, "breaker_skipped", ExecutionState.BREAKER_CHECKED,
                        Map.of("scope", scope, "skipped", SKIPPED_DRY_RUN));
            } else if (!admit()) {
                BreakerState state = breaker.state(scope);
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("scope", scope);
                details.put("state", state.status().name());
                details.put("cooldownUntilMs", state.cooldownUntilMs());
                details.put("lastError", state.lastError());
                return stop(Phase.BREAKER, "breaker_open",
                        OperatorError.of(ErrorCode.CIRCUIT_BREAKER_OPEN, "Circuit breaker is open for " + scope, details));
            } else {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("scope", scope);
                details.put("state", breaker.state(scope).status().name());
                details.put("trial", trialToken != null);
                audit(run, Phase.BREAKER, "breaker_checked", ExecutionState.BREAKER_CHECKED, details);
            }

            Optional<CrossDomainLeg> leg = intent.crossDomainLeg();
            if (leg.isPresent()) {
                RouteCheck route = routes.checkRoute(leg.get().source(), leg.get().destination(), leg.get().provider());
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("source", route.source());
                details.put("destination", route.destination());
                details.put("provider", route.provider());
                if (!route.supported()) {
                    details.put("recommendedPipeline", route.recommendedPipeline());
                    return stop(Phase.ROUTE, "route_unsupported", OperatorError.of(ErrorCode.ROUTE_NOT_SUPPORTED,
                            "Route " + route.source() + "->" + route.destination() + " is not supported by " + route.provider(),
                            details));
                }
                details.put("operation", routes.operationFor(route.source(), route.destination(), route.provider()).orElse(null));
                audit(run, Phase.ROUTE, "route_checked", ExecutionState.ROUTE_CHECKED, details);
            }

            Optional<Connector> connector = connectors.findById(intent.connectorId());
            if (connector.isEmpty()) {
                return stop(Phase.DISPATCH, "connector_missing", OperatorError.of(ErrorCode.CONNECTOR_NOT_REGISTERED,
                        "No connector registered for " + intent.connectorId(),
                        Map.of("connectorId", intent.connectorId(), "registered", List.copyOf(connectors.listConnectorIds()))));
            }
            dispatched = true;
            audit(run, Phase.DISPATCH, "dispatched", ExecutionState.DISPATCHED,
                    Map.of("connectorId", intent.connectorId(), "dryRun", run.dryRun()));
            DispatchRequest request = new DispatchRequest(run.runId(), run.dryRun() ? null : key, intent, run.dryRun());
            ConnectorResult result = invoke(connector.get(), request);
            return settle(result);
        }

        private boolean admit() {
            CircuitBreaker.Admission admission = breaker.canAttempt(scope);
            trialToken = admission.trialToken();
            return admission.allowed();
        }

        private ExecutionOutcome fromExisting(IdempotencyRecord existing) {
            if (!existing.settled()) {
                return stop(Phase.IDEMPOTENCY, "idempotency_pending", OperatorError.of(ErrorCode.IDEMPOTENCY_PENDING,
                        "An identical request is still in flight",
                        Map.of("idempotencyKey", key, "runId", existing.runId())));
            }
            boolean completed = existing.status() == IdempotencyRecord.Status.COMPLETED;
            ExecutionState state = completed ? ExecutionState.COMPLETED : ExecutionState.FAILED;
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("code", ErrorCode.IDEMPOTENCY_REPLAYED.name());
            details.put("idempotencyKey", key);
            details.put("replayedFromRunId", existing.runId());
            details.put("status", existing.status().name());
            audit(run, Phase.IDEMPOTENCY, "idempotency_replayed", state, details);
            return new ExecutionOutcome(completed, run.runId(), run.plane(), run.dryRun(), state, key, true,
                    existing.runId(), intentJson, existing.result(), existing.error(), evaluation, run.auth());
        }

        private ExecutionOutcome settle(ConnectorResult result) {
            if (result.success()) {
                JsonNode output = result.output() == null ? Jsons.mapper().createObjectNode() : result.output();
                if (!run.dryRun()) {
                    idempotency.complete(key, output);
                    breaker.recordSuccess(scope, trialToken);
                }
                audit(run, Phase.RESULT, "completed", ExecutionState.COMPLETED,
                        Map.of("connectorId", intent.connectorId(), "result", output));
                return new ExecutionOutcome(true, run.runId(), run.plane(), run.dryRun(), ExecutionState.COMPLETED,
                        key, false, null, intentJson, output, null, evaluation, run.auth());
            }
            ConnectorResult.Failure failure = result.failure();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("connectorId", intent.connectorId());
            details.put("connectorCode", failure.code());
            details.put("details", failure.details());
            OperatorError error = OperatorError.of(ErrorCode.CONNECTOR_FAILURE, failure.message(), details);
            if (!run.dryRun()) {
                idempotency.fail(key, error);
                breaker.recordFailure(scope, failure.code() + ": " + failure.message(), trialToken);
            }
            audit(run, Phase.RESULT, "failed", ExecutionState.FAILED, Map.of("error", error));
            return failed(run, ExecutionState.FAILED, intentJson, key, error, evaluation);
        }

        private ExecutionOutcome stop(Phase phase, String event, OperatorError error) {
            abandon();
            audit(run, phase, event, ExecutionState.FAILED, error.details());
            return failed(run, ExecutionState.FAILED, intentJson, key, error, evaluation);
        }

        /** Releases whatever this attempt holds when it ends before a connector was invoked. */
        void abandon() {
            if (dispatched) {
                return;
            }
            if (reserved) {
                reserved = false;
                try {
                    idempotency.release(key);
                } catch (RuntimeException e) {
                    log.warn("Failed to release idempotency record {} for run {}", key, run.runId(), e);
                }
            }
            if (trialToken != null) {
                String token = trialToken;
                trialToken = null;
                try {
                    breaker.releaseTrial(scope, token);
                } catch (RuntimeException e) {
                    log.warn("Failed to release breaker trial for scope {}", scope, e);
                }
            }
        }
    }

    private ConnectorResult invoke(Connector connector, DispatchRequest request) {
        long timeoutMs = settings.connectorTimeoutMs();
        Future<ConnectorResult> future = dispatchPool.submit(() -> connector.dispatch(request));
        try {
            ConnectorResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return result == null
                    ? ConnectorResult.fail("CONNECTOR_EMPTY_RESULT", "connector returned no result")
                    : result;
        } catch (TimeoutException e) {
            log.warn("Connector {} did not answer run {} within {} ms", connector.id(), request.runId(), timeoutMs);
            return ConnectorResult.fail("CONNECTOR_TIMEOUT", "connector timed out after " + timeoutMs + " ms",
                    Map.of("reason", "timeout", "timeoutMs", timeoutMs));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Connector {} threw during run {}", connector.id(), request.runId(), cause);
            return ConnectorResult.fail("CONNECTOR_EXCEPTION", String.valueOf(cause.getMessage()),
                    Map.of("reason", "exception", "exception", cause.getClass().getSimpleName()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ConnectorResult.fail("CONNECTOR_INTERRUPTED", "interrupted waiting for connector",
                    Map.of("reason", "interrupted"));
        }
    }

    private void audit(Run run, Phase phase, String event, ExecutionState state, Map<String, Object> payload) {
        auditLog.append(AuditEvent.of(run.runId(), run.plane(), phase, event, state, payload));
    }

    private static ExecutionOutcome failed(
            Run run,
            ExecutionState state,
            JsonNode intent,
            String key,
            OperatorError error,
            PolicyEvaluationResult evaluation
    ) {
        return new ExecutionOutcome(false, run.runId(), run.plane(), run.dryRun(), state, key, false, null,
                intent, null, error, evaluation, run.auth());
    }

    private static List<Map<String, Object>> violationMaps(List<PolicyViolation> violations) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (PolicyViolation v : violations) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("code", v.code());
            m.put("field", v.field());
            m.put("detail", v.detail());
            out.add(m);
        }
        return out;
    }

    private String newRunId() {
        return "run_" + clock.millis() + "_" + Hashing.randomHex(4);
    }

    private static String loadOrCreateAuditSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            String generated = Hashing.randomHex(32);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }

    private record Run(String runId, Plane plane, boolean dryRun, AuthResult auth) {
    }
}
