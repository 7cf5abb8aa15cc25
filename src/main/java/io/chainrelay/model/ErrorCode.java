package io.chainrelay.model;

/**
 * Every failure the operator can report. The set is closed: connectors and bindings
 * report their own codes inside {@link OperatorError#details()}, never as a new value here.
 */
public enum ErrorCode {
    POLICY_VIOLATION(Kind.POLICY),
    POLICY_NOT_FOUND(Kind.POLICY),
    POLICY_INVALID(Kind.POLICY),

    IDEMPOTENCY_REPLAYED(Kind.IDEMPOTENCY),
    IDEMPOTENCY_PENDING(Kind.IDEMPOTENCY),

    CIRCUIT_BREAKER_OPEN(Kind.BREAKER),

    ROUTE_NOT_SUPPORTED(Kind.ROUTE),

    A2A_AUTH_REQUIRED(Kind.SECURITY),
    A2A_AUTH_INVALID(Kind.SECURITY),
    A2A_AUTH_SCHEME_UNSUPPORTED(Kind.SECURITY),
    A2A_KEY_UNKNOWN(Kind.SECURITY),
    A2A_SIGNATURE_INVALID(Kind.SECURITY),
    A2A_TIMESTAMP_INVALID(Kind.SECURITY),
    A2A_TIMESTAMP_WINDOW_EXCEEDED(Kind.SECURITY),
    A2A_TIMESTAMP_DRIFT_EXCEEDED(Kind.SECURITY),
    A2A_NONCE_REPLAY(Kind.SECURITY),
    A2A_CONFIG_INVALID(Kind.SECURITY),

    CONNECTOR_NOT_REGISTERED(Kind.CONNECTOR),
    CONNECTOR_FAILURE(Kind.CONNECTOR),

    INTENT_INVALID(Kind.INPUT),
    EXECUTION_PAYLOAD_INVALID(Kind.INPUT),
    EXECUTION_OPERATION_UNKNOWN(Kind.INPUT),

    LOCK_TIMEOUT(Kind.INFRASTRUCTURE),
    STORE_FAILURE(Kind.INFRASTRUCTURE);

    public enum Kind {
        POLICY,
        IDEMPOTENCY,
        BREAKER,
        ROUTE,
        SECURITY,
        CONNECTOR,
        INPUT,
        INFRASTRUCTURE
    }

    private final Kind kind;

    ErrorCode(Kind kind) {
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
