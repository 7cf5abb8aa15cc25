package io.chainrelay.connector;

import com.fasterxml.jackson.databind.JsonNode;
import io.chainrelay.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delegates to an external binding command. The request is written to stdin as JSON;
 * the binding answers on stdout with {@code {"ok":true,"result":...}} or
 * {@code {"ok":false,"error":{"code":...,"message":...,"details":...}}}.
 */
public final class ProcessConnector implements Connector {
    private static final int MAX_ERROR_CHARS = 512;
    private static final AtomicInteger READER_THREADS = new AtomicInteger();
    private static final ExecutorService READERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "chainrelay-binding-reader-" + READER_THREADS.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private final String id;
    private final List<String> command;
    private final long timeoutMs;

    public ProcessConnector(String id, List<String> command, long timeoutMs) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("connector id cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("connector command cannot be empty: " + id);
        }
        this.id = id;
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(100L, timeoutMs);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public ConnectorResult dispatch(DispatchRequest request) {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return ConnectorResult.fail("BINDING_SPAWN_FAILED", "binding spawn failed: " + e.getMessage());
        }

        // stdout is drained concurrently; a binding blocks once the pipe buffer is full
        CompletableFuture<byte[]> output = CompletableFuture.supplyAsync(() -> {
            try {
                return process.getInputStream().readAllBytes();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, READERS);
        try {
            process.getOutputStream().write(Jsons.toCompactJson(request.toJson()).getBytes(StandardCharsets.UTF_8));
            process.getOutputStream().flush();
            process.getOutputStream().close();

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return ConnectorResult.fail("BINDING_TIMEOUT", "binding timeout after " + Duration.ofMillis(timeoutMs));
            }

            String stdout;
            try {
                stdout = new String(output.get(timeoutMs, TimeUnit.MILLISECONDS), StandardCharsets.UTF_8).strip();
            } catch (ExecutionException | TimeoutException e) {
                process.destroyForcibly();
                return ConnectorResult.fail("BINDING_IO", "binding output could not be read: " + e.getMessage());
            }
            if (process.exitValue() != 0) {
                return ConnectorResult.fail("BINDING_EXIT", "binding exit=" + process.exitValue(),
                        Map.of("output", truncate(stdout)));
            }
            return parse(stdout);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return ConnectorResult.fail("BINDING_INTERRUPTED", "binding call interrupted");
        } catch (IOException e) {
            process.destroyForcibly();
            return ConnectorResult.fail("BINDING_IO", "binding execution failed: " + e.getMessage());
        }
    }

    @SuppressWarnings("unchecked")
    private ConnectorResult parse(String stdout) {
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(stdout);
        } catch (IOException e) {
            return ConnectorResult.fail("BINDING_OUTPUT_INVALID", "binding output is not JSON",
                    Map.of("output", truncate(stdout)));
        }
        if (node == null || !node.isObject() || !node.path("ok").isBoolean()) {
            return ConnectorResult.fail("BINDING_OUTPUT_INVALID", "binding output lacks a boolean ok member",
                    Map.of("output", truncate(stdout)));
        }
        if (node.get("ok").booleanValue()) {
            return ConnectorResult.ok(node.path("result").isMissingNode() ? Jsons.mapper().createObjectNode() : node.get("result"));
        }
        JsonNode error = node.path("error");
        Map<String, Object> details = error.path("details").isObject()
                ? Jsons.mapper().convertValue(error.get("details"), Map.class)
                : Map.of();
        return ConnectorResult.fail(
                error.path("code").asText("BINDING_ERROR"),
                error.path("message").asText("binding reported failure"),
                details
        );
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
