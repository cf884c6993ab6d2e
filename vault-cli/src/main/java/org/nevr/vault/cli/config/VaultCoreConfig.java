package org.nevr.vault.cli.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.nevr.vault.core.dto.CryptoSettings;
import org.nevr.vault.core.service.AuditLedgerService;
import org.nevr.vault.core.service.CryptoEngine;
import org.nevr.vault.core.service.KeyManager;
import org.nevr.vault.core.service.VaultEnvelopeCodec;
import org.nevr.vault.core.service.VaultOrchestrator;
import org.nevr.vault.core.service.VaultService;
import org.nevr.vault.core.service.impl.AuditLedgerServiceImpl;
import org.nevr.vault.core.service.impl.CryptoEngineImpl;
import org.nevr.vault.core.service.impl.KeyManagerImpl;
import org.nevr.vault.core.service.impl.VaultEnvelopeCodecImpl;
import org.nevr.vault.core.service.impl.VaultOrchestratorImpl;
import org.nevr.vault.core.util.JsonMappers;
import org.nevr.vault.core.util.VaultWriteQueue;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;

/**
 * Wires the framework-free core into the application context
 */
@Configuration
public class VaultCoreConfig {

    @Bean
    public ObjectMapper vaultObjectMapper() {
        return JsonMappers.vaultObjectMapper();
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler vaultCryptoScheduler(VaultProperties properties) {
        return CryptoEngineImpl.newCryptoScheduler(properties.getWorkerThreads());
    }

    @Bean
    public CryptoEngine cryptoEngine(VaultProperties properties,
                                     @Qualifier("vaultCryptoScheduler") Scheduler vaultCryptoScheduler) {
        CryptoSettings settings = CryptoSettings.builder()
                .iterations(properties.getIterations())
                .build();
        return new CryptoEngineImpl(settings, vaultCryptoScheduler);
    }

    @Bean
    public KeyManager keyManager() {
        return new KeyManagerImpl();
    }

    @Bean
    public VaultEnvelopeCodec vaultEnvelopeCodec(ObjectMapper vaultObjectMapper) {
        return new VaultEnvelopeCodecImpl(vaultObjectMapper);
    }

    @Bean
    public AuditLedgerService auditLedgerService(ObjectMapper vaultObjectMapper) {
        return new AuditLedgerServiceImpl(vaultObjectMapper);
    }

    @Bean
    public VaultWriteQueue vaultWriteQueue() {
        return new VaultWriteQueue();
    }

    @Bean
    public VaultOrchestrator vaultOrchestrator(KeyManager keyManager,
                                               CryptoEngine cryptoEngine,
                                               VaultEnvelopeCodec vaultEnvelopeCodec,
                                               AuditLedgerService auditLedgerService,
                                               VaultWriteQueue vaultWriteQueue) {
        return new VaultOrchestratorImpl(keyManager, cryptoEngine, vaultEnvelopeCodec, auditLedgerService,
                vaultWriteQueue);
    }

    @Bean
    public VaultService vaultService(VaultOrchestrator vaultOrchestrator, AuditLedgerService auditLedgerService) {
        return new VaultService(vaultOrchestrator, auditLedgerService);
    }
}
