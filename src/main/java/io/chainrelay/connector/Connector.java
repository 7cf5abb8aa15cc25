package io.chainrelay.connector;

/**
 * Network-facing executor for one chain, venue, protocol or bridge provider. The
 * orchestrator is the only caller and bounds every call with a timeout; implementations
 * report failures as a failed {@link ConnectorResult} or by throwing.
 */
public interface Connector {
    String id();

    ConnectorResult dispatch(DispatchRequest request) throws Exception;
}
