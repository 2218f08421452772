package com.auditchain.core.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Summary of a chain for dashboards and auditors.
 */
@JsonIgnoreProperties(value = "unexportedCheckpoint", allowGetters = true, ignoreUnknown = true)
public record ChainStatus(
        String chainId,
        long entryCount,
        Long headSequence,
        String headHash,
        Checkpoint latestCheckpoint
) {

    @JsonProperty("unexportedCheckpoint")
    public boolean hasUnexportedCheckpoint() {
        return latestCheckpoint != null && !latestCheckpoint.isExported();
    }
}
