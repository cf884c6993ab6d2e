package org.nevr.vault.core.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Non-secret envelope metadata. {@code createdAt} and {@code createdBy} survive re-encryption.
 */
@Value
@Builder(toBuilder = true)
public class VaultMetadata {
    Instant createdAt;
    Instant updatedAt;
    String createdBy;
    int variables;
}
