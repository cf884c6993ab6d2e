package org.nevr.vault.core.service;

import org.nevr.vault.core.dto.VaultEnvelope;
import org.nevr.vault.core.result.VaultResult;
import org.nevr.vault.core.util.Digests;

/**
 * Text form of a {@link VaultEnvelope}, independent of its cryptographic content
 */
public interface VaultEnvelopeCodec {

    /**
     * Deterministic field order
     */
    String serialize(VaultEnvelope envelope);

    /**
     * FORMAT error on wrong version, missing fields, bad encodings or byte lengths
     */
    VaultResult<VaultEnvelope> deserialize(String text);

    /**
     * SHA-256 hex of serialized envelope text, as recorded in audit entries
     */
    default String digest(String serialized) {
        return Digests.sha256Hex(serialized);
    }
}
