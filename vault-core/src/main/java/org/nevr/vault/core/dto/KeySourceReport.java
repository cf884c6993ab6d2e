package org.nevr.vault.core.dto;

import lombok.Builder;
import lombok.Value;
import org.nevr.vault.core.enums.KeySourceType;

import java.util.List;

/**
 * Where a key-carrier value was seen, without exposing the value
 */
@Value
@Builder
public class KeySourceReport {
    boolean found;
    boolean valid;
    KeySourceType sourceType;
    String source;
    List<String> checkedSources;
}
