package io.chainrelay.connector;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.chainrelay.model.CanonicalIntent;
import io.chainrelay.model.IntentCodec;
import io.chainrelay.util.Jsons;

/** What a connector receives. In dry-run the connector must only preflight. */
public record DispatchRequest(
        String runId,
        String idempotencyKey,
        CanonicalIntent intent,
        boolean dryRun
) {
    public ObjectNode toJson() {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("runId", runId);
        if (idempotencyKey != null) {
            node.put("idempotencyKey", idempotencyKey);
        }
        node.put("dryRun", dryRun);
        node.set("intent", IntentCodec.toJson(intent));
        return node;
    }
}
