package org.nevr.vault.cli.config;

import org.junit.jupiter.api.Test;
import org.nevr.vault.core.dto.VaultOptions;
import org.nevr.vault.core.service.VaultService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "nevr.vault.iterations=1000",
        "nevr.vault.crypto-timeout=30s",
        "nevr.vault.actor=deploy-bot",
        "nevr.vault.vault-file=team.vault"
})
class VaultCliContextTest {

    @Autowired
    private VaultProperties properties;

    @Autowired
    private VaultService vaultService;

    @Test
    void testContext_BindsPropertiesAndWiresService() {
        assertNotNull(vaultService);
        assertEquals(1000, properties.getIterations());
        assertEquals("NEVR_ENV_KEY", properties.getKeyVariable());

        VaultOptions options = properties.toOptions();
        assertEquals("team.vault", options.getVaultFile());
        assertEquals("team.audit.log", options.auditFile());
        assertEquals("deploy-bot", options.getActor());
        assertEquals(Duration.ofSeconds(30), options.getCryptoTimeout());
        assertEquals(5, options.getRecentAuditEntries());
    }
}
