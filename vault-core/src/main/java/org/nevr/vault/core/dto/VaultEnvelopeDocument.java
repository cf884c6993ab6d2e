package org.nevr.vault.core.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JSON shape of the vault file. Binary fields are lowercase hex.
 * Field order is fixed so re-encrypted vaults diff cleanly in version control.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"version", "salt", "iv", "authTag", "encrypted", "hmac", "metadata"})
public class VaultEnvelopeDocument {

    private Integer version;
    private String salt;
    private String iv;
    private String authTag;
    private String encrypted;
    private String hmac;
    private Metadata metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonPropertyOrder({"createdAt", "updatedAt", "createdBy", "variables"})
    public static class Metadata {
        private Instant createdAt;
        private Instant updatedAt;
        private String createdBy;
        private Integer variables;
    }
}
