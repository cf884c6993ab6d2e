package org.nevr.vault.core.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.nevr.vault.core.dto.VaultEnvelope;
import org.nevr.vault.core.dto.VaultMetadata;
import org.nevr.vault.core.result.VaultError;
import org.nevr.vault.core.result.VaultErrorKind;
import org.nevr.vault.core.result.VaultResult;
import org.nevr.vault.core.util.Digests;
import org.nevr.vault.core.util.JsonMappers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class VaultEnvelopeCodecImplTest {

    private final ObjectMapper objectMapper = JsonMappers.vaultObjectMapper();
    private final VaultEnvelopeCodecImpl codec = new VaultEnvelopeCodecImpl(objectMapper);

    @Test
    void testSerialize_FixedFieldOrderAndHexEncoding() throws Exception {
        // When
        String text = codec.serialize(sampleEnvelope());

        // Then
        JsonNode root = objectMapper.readTree(text);
        List<String> fields = new ArrayList<>();
        Iterator<String> names = root.fieldNames();
        names.forEachRemaining(fields::add);
        assertEquals(List.of("version", "salt", "iv", "authTag", "encrypted", "hmac", "metadata"), fields);
        assertEquals("0101010101010101010101010101010101010101010101010101010101010101", root.get("salt").asText());
        assertEquals("2026-02-01T08:00:00Z", root.get("metadata").get("createdAt").asText());
        assertFalse(root.get("metadata").has("createdBy"), "null createdBy is omitted");
        assertTrue(text.endsWith("}\n"));
    }

    @Test
    void testDeserialize_ReadsWhatSerializeWrites() {
        // Given
        VaultEnvelope envelope = sampleEnvelope().toBuilder()
                .metadata(sampleEnvelope().getMetadata().toBuilder().createdBy("ci-bot").build())
                .build();

        // When
        VaultEnvelope parsed = codec.deserialize(codec.serialize(envelope)).orElseThrow();

        // Then
        assertArrayEquals(envelope.getSalt(), parsed.getSalt());
        assertArrayEquals(envelope.getIv(), parsed.getIv());
        assertArrayEquals(envelope.getAuthTag(), parsed.getAuthTag());
        assertArrayEquals(envelope.getEncrypted(), parsed.getEncrypted());
        assertArrayEquals(envelope.getHmac(), parsed.getHmac());
        assertEquals(envelope.getMetadata(), parsed.getMetadata());
    }

    @Test
    void testDeserialize_AcceptsUppercaseHex() throws Exception {
        ObjectNode root = (ObjectNode) objectMapper.readTree(codec.serialize(sampleEnvelope()));
        root.put("encrypted", "ABCDEF");

        VaultEnvelope parsed = codec.deserialize(objectMapper.writeValueAsString(root)).orElseThrow();

        assertArrayEquals(Digests.fromHex("abcdef"), parsed.getEncrypted());
    }

    @Test
    void testDeserialize_RejectsMalformedInput() {
        assertFormatError(null);
        assertFormatError("");
        assertFormatError("   ");
        assertFormatError("not json");
        assertFormatError("[]");
        assertFormatError("{\"version\": 1");
    }

    @Test
    void testDeserialize_RejectsWrongVersion() {
        VaultError error = assertFormatError(mutate(root -> root.put("version", 2)));

        assertTrue(error.getMessage().contains("version"));
    }

    @Test
    void testDeserialize_RejectsNonIntegralVersion() {
        assertFormatError(mutate(root -> root.put("version", 1.9)));
        assertFormatError(mutate(root -> root.put("version", 1.0)));
        assertFormatError(mutate(root -> root.put("version", "1")));
    }

    @Test
    void testDeserialize_RejectsMissingFields() {
        assertFormatError(mutate(root -> root.remove("version")));
        assertFormatError(mutate(root -> root.remove("salt")));
        assertFormatError(mutate(root -> root.remove("hmac")));
        assertFormatError(mutate(root -> root.remove("metadata")));
        assertFormatError(mutate(root -> ((ObjectNode) root.get("metadata")).remove("createdAt")));
        assertFormatError(mutate(root -> ((ObjectNode) root.get("metadata")).remove("updatedAt")));
    }

    @Test
    void testDeserialize_RejectsBadHexAndLengths() {
        assertFormatError(mutate(root -> root.put("salt", "zz" + "01".repeat(31))));
        assertFormatError(mutate(root -> root.put("iv", "010")));
        assertFormatError(mutate(root -> root.put("iv", "01".repeat(12))));
        assertFormatError(mutate(root -> root.put("authTag", "01".repeat(17))));
        assertFormatError(mutate(root -> root.put("hmac", "")));
    }

    @Test
    void testDeserialize_RejectsNegativeVariableCount() {
        assertFormatError(mutate(root -> ((ObjectNode) root.get("metadata")).put("variables", -1)));
    }

    @Test
    void testDigest_IsSha256OfText() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", codec.digest(""));
        assertEquals(64, codec.digest(codec.serialize(sampleEnvelope())).length());
    }

    private VaultError assertFormatError(String text) {
        VaultResult<VaultEnvelope> result = codec.deserialize(text);
        VaultResult.Err<?> err = assertInstanceOf(VaultResult.Err.class, result, "expected FORMAT for: " + text);
        assertEquals(VaultErrorKind.FORMAT, err.error().getKind());
        return err.error();
    }

    private String mutate(Consumer<ObjectNode> change) {
        try {
            ObjectNode root = (ObjectNode) objectMapper.readTree(codec.serialize(sampleEnvelope()));
            change.accept(root);
            return objectMapper.writeValueAsString(root);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static VaultEnvelope sampleEnvelope() {
        return VaultEnvelope.builder()
                .version(1)
                .salt(filled(VaultEnvelope.SALT_LENGTH, 1))
                .iv(filled(VaultEnvelope.IV_LENGTH, 2))
                .authTag(filled(VaultEnvelope.AUTH_TAG_LENGTH, 3))
                .encrypted(new byte[]{10, 20, 30, 40})
                .hmac(filled(VaultEnvelope.HMAC_LENGTH, 4))
                .metadata(VaultMetadata.builder()
                        .createdAt(Instant.parse("2026-02-01T08:00:00Z"))
                        .updatedAt(Instant.parse("2026-02-03T09:30:00Z"))
                        .variables(4)
                        .build())
                .build();
    }

    private static byte[] filled(int length, int value) {
        byte[] bytes = new byte[length];
        java.util.Arrays.fill(bytes, (byte) value);
        return bytes;
    }
}
