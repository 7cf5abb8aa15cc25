package io.chainrelay.observability;

public record AuditIntegrityOutcome(
        boolean ok,
        int totalRows,
        int checkedRows,
        int legacyRows,
        int brokenLine,
        String reason,
        String tailHash
) {
}
