package org.nevr.vault.core.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.nevr.vault.core.enums.AuditOperation;

import java.time.Instant;

/**
 * One line of the audit ledger. Each entry's hash covers the previous entry's hash, so an
 * edit anywhere breaks every later link.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"sequence", "timestamp", "operation", "actor", "payloadDigest", "prevHash", "hash"})
public class AuditLogEntry {

    /**
     * 1-based, continues across rotations
     */
    private long sequence;

    private Instant timestamp;

    private AuditOperation operation;

    /**
     * Who performed the operation, if known
     */
    private String actor;

    /**
     * SHA-256 of the serialized envelope the operation touched; never plaintext
     */
    private String payloadDigest;

    private String prevHash;

    private String hash;
}
