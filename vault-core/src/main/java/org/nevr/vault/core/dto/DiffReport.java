package org.nevr.vault.core.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Names only; values are never part of a diff
 */
@Value
@Builder
public class DiffReport {
    List<String> onlyInVault;
    List<String> onlyInLocal;
    List<String> inBoth;
    List<String> different;
}
