package io.chainrelay.routing;

/** One leg of a decomposed cross-domain route. */
public record PipelineHop(int sequence, String source, String destination, String provider, String operation) {
}
