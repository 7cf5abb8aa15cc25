package io.chainrelay.routing;

import java.util.List;

public record RouteCheck(
        String source,
        String destination,
        String provider,
        boolean supported,
        List<PipelineHop> recommendedPipeline
) {
    public RouteCheck {
        recommendedPipeline = recommendedPipeline == null ? List.of() : List.copyOf(recommendedPipeline);
    }

    public boolean decomposable() {
        return !supported && !recommendedPipeline.isEmpty();
    }
}
