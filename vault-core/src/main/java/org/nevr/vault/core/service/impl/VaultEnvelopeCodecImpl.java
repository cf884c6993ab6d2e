package org.nevr.vault.core.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nevr.vault.core.dto.VaultEnvelope;
import org.nevr.vault.core.dto.VaultEnvelopeDocument;
import org.nevr.vault.core.dto.VaultMetadata;
import org.nevr.vault.core.exception.VaultFormatException;
import org.nevr.vault.core.result.VaultResult;
import org.nevr.vault.core.service.VaultEnvelopeCodec;
import org.nevr.vault.core.util.Digests;

/**
 * Pretty-printed JSON with a fixed field order and hex-encoded binary fields
 */
@Slf4j
@RequiredArgsConstructor
public class VaultEnvelopeCodecImpl implements VaultEnvelopeCodec {

    private final ObjectMapper objectMapper;

    @Override
    public String serialize(VaultEnvelope envelope) {
        VaultMetadata metadata = envelope.getMetadata();
        VaultEnvelopeDocument document = VaultEnvelopeDocument.builder()
                .version(envelope.getVersion())
                .salt(Digests.toHex(envelope.getSalt()))
                .iv(Digests.toHex(envelope.getIv()))
                .authTag(Digests.toHex(envelope.getAuthTag()))
                .encrypted(Digests.toHex(envelope.getEncrypted()))
                .hmac(Digests.toHex(envelope.getHmac()))
                .metadata(VaultEnvelopeDocument.Metadata.builder()
                        .createdAt(metadata.getCreatedAt())
                        .updatedAt(metadata.getUpdatedAt())
                        .createdBy(metadata.getCreatedBy())
                        .variables(metadata.getVariables())
                        .build())
                .build();
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize vault envelope", e);
        }
    }

    @Override
    public VaultResult<VaultEnvelope> deserialize(String text) {
        try {
            return VaultResult.ok(parse(text));
        } catch (VaultFormatException e) {
            log.debug("Rejected vault file: {}", e.getMessage());
            return VaultResult.fromException(e);
        }
    }

    private VaultEnvelope parse(String text) {
        if (text == null || text.isBlank()) {
            throw new VaultFormatException("Vault file is empty");
        }

        VaultEnvelopeDocument document;
        try {
            document = objectMapper.readValue(text, VaultEnvelopeDocument.class);
        } catch (JsonProcessingException e) {
            throw new VaultFormatException("Invalid vault file: the file may be corrupted", e);
        }
        if (document == null) {
            throw new VaultFormatException("Vault file is empty");
        }

        if (document.getVersion() == null || document.getVersion() != VaultEnvelope.CURRENT_VERSION) {
            throw new VaultFormatException(String.format("Unsupported vault version: %s. Expected: %d",
                    document.getVersion(), VaultEnvelope.CURRENT_VERSION));
        }

        VaultEnvelopeDocument.Metadata metadata = document.getMetadata();
        if (metadata == null) {
            throw new VaultFormatException("Vault field 'metadata' is missing");
        }
        if (metadata.getCreatedAt() == null || metadata.getUpdatedAt() == null) {
            throw new VaultFormatException("Vault metadata must carry createdAt and updatedAt");
        }
        if (metadata.getVariables() == null || metadata.getVariables() < 0) {
            throw new VaultFormatException("Vault metadata 'variables' must be a non-negative number");
        }

        return VaultEnvelope.builder()
                .version(document.getVersion())
                .salt(decode("salt", document.getSalt(), VaultEnvelope.SALT_LENGTH))
                .iv(decode("iv", document.getIv(), VaultEnvelope.IV_LENGTH))
                .authTag(decode("authTag", document.getAuthTag(), VaultEnvelope.AUTH_TAG_LENGTH))
                .encrypted(decode("encrypted", document.getEncrypted(), -1))
                .hmac(decode("hmac", document.getHmac(), VaultEnvelope.HMAC_LENGTH))
                .metadata(VaultMetadata.builder()
                        .createdAt(metadata.getCreatedAt())
                        .updatedAt(metadata.getUpdatedAt())
                        .createdBy(metadata.getCreatedBy())
                        .variables(metadata.getVariables())
                        .build())
                .build();
    }

    /**
     * @param expectedLength required decoded length, or -1 for any
     */
    private static byte[] decode(String field, String hex, int expectedLength) {
        if (hex == null) {
            throw new VaultFormatException(String.format("Vault field '%s' is missing", field));
        }
        byte[] bytes;
        try {
            bytes = Digests.fromHex(hex);
        } catch (IllegalArgumentException e) {
            throw new VaultFormatException(String.format("Vault field '%s' is not valid hex", field), e);
        }
        if (expectedLength >= 0 && bytes.length != expectedLength) {
            throw new VaultFormatException(String.format("Vault field '%s' must be %d bytes, found %d",
                    field, expectedLength, bytes.length));
        }
        return bytes;
    }
}
