package io.recovery.retention;

import java.util.Map;

/**
 * Outcome of a retention pass.
 *
 * @param tables       per-table outcome keyed by table name, in pass order
 * @param expiredLocks expired lock rows found and removed
 * @param dryRun       whether deletion was suppressed
 * @param errors       tables or steps that failed
 */
public record RetentionReport(Map<String, TableRetention> tables, TableRetention expiredLocks,
        boolean dryRun, int errors) {

    public RetentionReport {
        tables = Map.copyOf(tables);
    }

    public long totalCandidates() {
        return tables.values().stream().mapToLong(TableRetention::candidates).sum();
    }

    public long totalDeleted() {
        return tables.values().stream().mapToLong(TableRetention::deleted).sum();
    }
}
