package org.nevr.vault.core.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.nevr.vault.core.dto.CryptoSettings;
import org.nevr.vault.core.dto.VaultEnvelope;
import org.nevr.vault.core.dto.VaultMetadata;
import org.nevr.vault.core.exception.VaultDecryptionException;
import org.nevr.vault.core.exception.VaultFormatException;
import org.nevr.vault.core.exception.VaultIntegrityException;
import org.nevr.vault.core.service.CryptoEngine;
import org.nevr.vault.core.util.EnvCodec;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;

/**
 * AES-256-GCM with PBKDF2-HMAC-SHA512 key derivation and an outer HMAC-SHA256 integrity tag.
 *
 * The PBKDF2 output is a 64-byte master from which two keys are expanded with distinct labels,
 * one for the cipher and one for the HMAC, so no key serves two primitives.
 */
@Slf4j
public class CryptoEngineImpl implements CryptoEngine {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final String KDF_ALGORITHM = "PBKDF2WithHmacSHA512";
    private static final String MAC_ALGORITHM = "HmacSHA256";
    private static final int GCM_TAG_LENGTH = VaultEnvelope.AUTH_TAG_LENGTH; // 128 bits
    private static final int MASTER_KEY_BITS = 512;
    private static final byte[] AEAD_CONTEXT = "nevr-vault/aead/v1".getBytes(StandardCharsets.UTF_8);
    private static final byte[] MAC_CONTEXT = "nevr-vault/hmac/v1".getBytes(StandardCharsets.UTF_8);

    private final CryptoSettings settings;
    private final Scheduler scheduler;
    private final Clock clock;
    private final SecureRandom secureRandom;

    public CryptoEngineImpl(CryptoSettings settings, Scheduler scheduler) {
        this(settings, scheduler, Clock.systemUTC(), new SecureRandom());
    }

    public CryptoEngineImpl(CryptoSettings settings, Scheduler scheduler, Clock clock, SecureRandom secureRandom) {
        if (settings.getIterations() < 1) {
            throw new IllegalArgumentException("iterations must be positive: " + settings.getIterations());
        }
        if (settings.getIterations() < CryptoSettings.DEFAULT_ITERATIONS) {
            log.warn("Key derivation configured with {} iterations, below the recommended {}",
                    settings.getIterations(), CryptoSettings.DEFAULT_ITERATIONS);
        }
        this.settings = settings;
        this.scheduler = scheduler;
        this.clock = clock;
        this.secureRandom = secureRandom;
    }

    /**
     * Dedicated pool for key derivation so it never runs on a shared event loop
     */
    public static Scheduler newCryptoScheduler(int threads) {
        return Schedulers.newBoundedElastic(threads, Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "vault-crypto");
    }

    @Override
    public Mono<VaultEnvelope> encrypt(byte[] plaintext, String password, VaultMetadata existingMetadata) {
        return Mono.fromCallable(() -> encryptNow(plaintext, password, existingMetadata))
                .subscribeOn(scheduler);
    }

    @Override
    public Mono<byte[]> decrypt(VaultEnvelope envelope, String password) {
        return Mono.fromCallable(() -> decryptNow(envelope, password))
                .subscribeOn(scheduler);
    }

    VaultEnvelope encryptNow(byte[] plaintext, String password, VaultMetadata existingMetadata) {
        byte[] salt = randomBytes(VaultEnvelope.SALT_LENGTH);
        byte[] iv = randomBytes(VaultEnvelope.IV_LENGTH);
        DerivedKeys keys = deriveKeys(password, salt);
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(keys.aeadKey(), "AES"),
                    new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            byte[] sealed = cipher.doFinal(plaintext);

            // GCM appends the tag to the ciphertext
            byte[] encrypted = Arrays.copyOfRange(sealed, 0, sealed.length - GCM_TAG_LENGTH);
            byte[] authTag = Arrays.copyOfRange(sealed, sealed.length - GCM_TAG_LENGTH, sealed.length);
            byte[] hmac = computeHmac(keys.macKey(), VaultEnvelope.CURRENT_VERSION, salt, iv, authTag, encrypted);

            Instant now = clock.instant();
            VaultMetadata metadata = VaultMetadata.builder()
                    .createdAt(existingMetadata != null && existingMetadata.getCreatedAt() != null
                            ? existingMetadata.getCreatedAt() : now)
                    .updatedAt(now)
                    .createdBy(existingMetadata != null ? existingMetadata.getCreatedBy() : null)
                    .variables(EnvCodec.parse(new String(plaintext, StandardCharsets.UTF_8)).size())
                    .build();

            log.debug("Encrypted {} bytes ({} variables)", plaintext.length, metadata.getVariables());
            return VaultEnvelope.builder()
                    .version(VaultEnvelope.CURRENT_VERSION)
                    .salt(salt)
                    .iv(iv)
                    .authTag(authTag)
                    .encrypted(encrypted)
                    .hmac(hmac)
                    .metadata(metadata)
                    .build();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Encryption failed", e);
        } finally {
            keys.destroy();
        }
    }

    byte[] decryptNow(VaultEnvelope envelope, String password) {
        if (envelope.getVersion() != VaultEnvelope.CURRENT_VERSION) {
            throw new VaultFormatException(String.format("Unsupported vault version: %d. Expected: %d",
                    envelope.getVersion(), VaultEnvelope.CURRENT_VERSION));
        }
        requireLength("salt", envelope.getSalt(), VaultEnvelope.SALT_LENGTH);
        requireLength("iv", envelope.getIv(), VaultEnvelope.IV_LENGTH);
        requireLength("authTag", envelope.getAuthTag(), VaultEnvelope.AUTH_TAG_LENGTH);
        requireLength("hmac", envelope.getHmac(), VaultEnvelope.HMAC_LENGTH);
        if (envelope.getEncrypted() == null) {
            throw new VaultFormatException("Vault field 'encrypted' is missing");
        }

        DerivedKeys keys = deriveKeys(password, envelope.getSalt());
        try {
            byte[] expectedHmac = computeHmac(keys.macKey(), envelope.getVersion(), envelope.getSalt(),
                    envelope.getIv(), envelope.getAuthTag(), envelope.getEncrypted());

            // constant time; the cipher is not touched on mismatch
            if (!MessageDigest.isEqual(expectedHmac, envelope.getHmac())) {
                throw new VaultIntegrityException();
            }

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(keys.aeadKey(), "AES"),
                    new GCMParameterSpec(GCM_TAG_LENGTH * 8, envelope.getIv()));
            byte[] sealed = ByteBuffer.allocate(envelope.getEncrypted().length + GCM_TAG_LENGTH)
                    .put(envelope.getEncrypted())
                    .put(envelope.getAuthTag())
                    .array();
            return cipher.doFinal(sealed);
        } catch (GeneralSecurityException e) {
            // AEADBadTagException included; no detail reaches the caller
            throw new VaultDecryptionException(e);
        } finally {
            keys.destroy();
        }
    }

    DerivedKeys deriveKeys(String password, byte[] salt) {
        PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), salt, settings.getIterations(), MASTER_KEY_BITS);
        byte[] master = null;
        try {
            master = SecretKeyFactory.getInstance(KDF_ALGORITHM).generateSecret(spec).getEncoded();
            return new DerivedKeys(expand(master, AEAD_CONTEXT), expand(master, MAC_CONTEXT));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Key derivation failed", e);
        } finally {
            spec.clearPassword();
            if (master != null) {
                Arrays.fill(master, (byte) 0);
            }
        }
    }

    static byte[] computeHmac(byte[] macKey, int version, byte[] salt, byte[] iv, byte[] authTag, byte[] encrypted)
            throws GeneralSecurityException {
        Mac mac = Mac.getInstance(MAC_ALGORITHM);
        mac.init(new SecretKeySpec(macKey, MAC_ALGORITHM));
        mac.update(ByteBuffer.allocate(Integer.BYTES).putInt(version).array());
        mac.update(salt);
        mac.update(iv);
        mac.update(authTag);
        mac.update(encrypted);
        return mac.doFinal();
    }

    private static byte[] expand(byte[] master, byte[] context) throws GeneralSecurityException {
        Mac hmac = Mac.getInstance(MAC_ALGORITHM);
        hmac.init(new SecretKeySpec(master, MAC_ALGORITHM));
        return hmac.doFinal(context);
    }

    private static void requireLength(String field, byte[] value, int expected) {
        if (value == null || value.length != expected) {
            throw new VaultFormatException(String.format("Vault field '%s' must be %d bytes", field, expected));
        }
    }

    private byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        secureRandom.nextBytes(bytes);
        return bytes;
    }

    record DerivedKeys(byte[] aeadKey, byte[] macKey) {

        void destroy() {
            Arrays.fill(aeadKey, (byte) 0);
            Arrays.fill(macKey, (byte) 0);
        }
    }
}
