package com.auditchain.core.canonical;

import com.auditchain.core.domain.AuditPackage;
import com.auditchain.core.exception.SerializationException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Seals evidence packages so a modified copy can be told apart from the one issued.
 */
public final class PackageHasher {

    private static final ObjectMapper SORTED = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    private PackageHasher() {}

    public static String hash(AuditPackage auditPackage) {
        try {
            return EntryHasher.sha256Hex(SORTED.writeValueAsBytes(auditPackage.withPackageHash(null)));
        } catch (JsonProcessingException e) {
            throw new SerializationException("Audit package could not be serialized", e);
        }
    }

    public static AuditPackage seal(AuditPackage auditPackage) {
        return auditPackage.withPackageHash(hash(auditPackage));
    }

    public static boolean isIntact(AuditPackage auditPackage) {
        return auditPackage.packageHash() != null && auditPackage.packageHash().equals(hash(auditPackage));
    }
}
