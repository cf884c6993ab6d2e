package org.nevr.vault.core.dto;

import lombok.Builder;
import lombok.Value;
import org.nevr.vault.core.enums.AuditOperation;

import java.time.Instant;
import java.util.Set;

/**
 * Filter for audit ledger queries. Null fields do not filter.
 * {@code limit} keeps the most recent N matches.
 */
@Value
@Builder
public class AuditQuery {
    Set<AuditOperation> operations;
    String actor;
    Instant from;
    Instant to;
    Integer limit;

    public static AuditQuery all() {
        return AuditQuery.builder().build();
    }
}
