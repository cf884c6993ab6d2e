package org.nevr.vault.core.service;

import org.nevr.vault.core.dto.VaultEnvelope;
import org.nevr.vault.core.dto.VaultMetadata;
import reactor.core.publisher.Mono;

/**
 * Password-based authenticated encryption of vault payloads.
 * Key derivation is deliberately slow, so both operations run on a dedicated worker
 * scheduler; cancelling the returned {@link Mono} abandons the result.
 * Failures are signalled as {@link org.nevr.vault.core.exception.VaultException}s.
 */
public interface CryptoEngine {

    /**
     * @param existingMetadata metadata of the vault being replaced, or null for a new vault
     */
    Mono<VaultEnvelope> encrypt(byte[] plaintext, String password, VaultMetadata existingMetadata);

    /**
     * Verifies the keyed integrity tag before the cipher is touched.
     * INTEGRITY on tag mismatch, DECRYPTION if the AEAD tag then fails.
     */
    Mono<byte[]> decrypt(VaultEnvelope envelope, String password);
}
