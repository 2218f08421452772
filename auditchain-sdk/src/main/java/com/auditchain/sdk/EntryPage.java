package com.auditchain.sdk;

import com.auditchain.core.domain.AuditEntry;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * One page of entries as the API returns it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EntryPage(
        List<AuditEntry> content,
        long totalElements,
        int totalPages,
        int number,
        boolean last
) {

    public EntryPage {
        content = content == null ? List.of() : List.copyOf(content);
    }
}
