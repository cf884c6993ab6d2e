package org.nevr.vault.core.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class AuditSummary {
    int totalEntries;
    Map<String, Integer> byOperation;
    Map<String, Integer> byActor;
    Instant firstEntry;
    Instant lastEntry;
}
