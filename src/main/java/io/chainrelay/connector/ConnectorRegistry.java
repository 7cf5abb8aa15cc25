package io.chainrelay.connector;

import io.chainrelay.config.RuntimeSettings;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

public final class ConnectorRegistry {
    private final Map<String, Connector> connectors = new ConcurrentHashMap<>();

    public static ConnectorRegistry fromSettings(RuntimeSettings settings) {
        ConnectorRegistry registry = new ConnectorRegistry();
        settings.connectors().forEach((id, binding) -> registry.register(new ProcessConnector(
                id,
                binding.command(),
                binding.timeoutMs() == null ? settings.connectorTimeoutMs() : binding.timeoutMs()
        )));
        return registry;
    }

    public ConnectorRegistry register(Connector connector) {
        connectors.put(connector.id(), connector);
        return this;
    }

    public Optional<Connector> findById(String connectorId) {
        return Optional.ofNullable(connectors.get(connectorId));
    }

    public Collection<String> listConnectorIds() {
        return new TreeSet<>(connectors.keySet());
    }
}
