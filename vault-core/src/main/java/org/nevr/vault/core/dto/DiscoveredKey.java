package org.nevr.vault.core.dto;

import lombok.Value;
import org.nevr.vault.core.enums.KeySourceType;

@Value
public class DiscoveredKey {
    VaultKey key;
    KeySourceType sourceType;
    String source;
}
