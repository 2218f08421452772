package com.auditchain.sdk;

import com.auditchain.core.domain.AuditEntry;
import com.auditchain.core.domain.AuditPackage;
import com.auditchain.core.domain.ChainStatus;
import com.auditchain.core.domain.Checkpoint;
import com.auditchain.core.domain.CheckpointArtifact;
import com.auditchain.core.domain.InclusionProof;
import com.auditchain.core.verify.VerificationResult;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * HTTP client for the chain API, for auditors who fetch entries, checkpoints and
 * evidence packages and then check them with {@link OfflineVerifier}.
 */
public class AuditorClient implements AutoCloseable {

    private static final String CHAINS = "/api/v1/chains/";

    private final String baseUrl;
    private final String clientId;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    private AuditorClient(Builder builder) {
        this.baseUrl = builder.baseUrl.endsWith("/")
                ? builder.baseUrl.substring(0, builder.baseUrl.length() - 1)
                : builder.baseUrl;
        this.clientId = builder.clientId;
        this.requestTimeout = Duration.ofSeconds(builder.requestTimeoutSeconds);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(builder.connectTimeoutSeconds))
                .build();
        this.objectMapper = objectMapper();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mapper matching the server's JSON: ISO timestamps, decimal payload numbers kept exact.
     */
    static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        return mapper;
    }

    // ==================== Chains ====================

    public ChainStatus getStatus(String chainId) throws IOException, InterruptedException {
        return get(CHAINS + encode(chainId), new TypeReference<ChainStatus>() {});
    }

    public EntryPage getEntries(String chainId, int page, int size) throws IOException, InterruptedException {
        return get(CHAINS + encode(chainId) + "/entries?page=" + page + "&size=" + size,
                new TypeReference<EntryPage>() {});
    }

    public AuditEntry getEntry(String chainId, long sequence) throws IOException, InterruptedException {
        return get(CHAINS + encode(chainId) + "/entries/" + sequence, new TypeReference<AuditEntry>() {});
    }

    /**
     * Merkle path of one entry up to the checkpoint that covers it. Check it with
     * {@link OfflineVerifier#verifyInclusion}.
     */
    public InclusionProof getInclusionProof(String chainId, long sequence) throws IOException, InterruptedException {
        return get(CHAINS + encode(chainId) + "/entries/" + sequence + "/proof",
                new TypeReference<InclusionProof>() {});
    }

    /**
     * Every entry of a chain in sequence order, fetched page by page.
     */
    public List<AuditEntry> fetchChain(String chainId, int pageSize) throws IOException, InterruptedException {
        List<AuditEntry> entries = new ArrayList<>();
        int page = 0;
        EntryPage current;
        do {
            current = getEntries(chainId, page++, pageSize);
            entries.addAll(current.content());
        } while (!current.last() && !current.content().isEmpty());
        return entries;
    }

    // ==================== Checkpoints ====================

    public List<Checkpoint> getCheckpoints(String chainId) throws IOException, InterruptedException {
        return get(CHAINS + encode(chainId) + "/checkpoints", new TypeReference<List<Checkpoint>>() {});
    }

    // ==================== Verification ====================

    /**
     * Asks the service to verify the chain from genesis.
     */
    public VerificationResult verifyRemote(String chainId) throws IOException, InterruptedException {
        return get(CHAINS + encode(chainId) + "/verify", new TypeReference<VerificationResult>() {});
    }

    /**
     * Asks the service to verify the chain against a checkpoint artifact the auditor holds.
     */
    public VerificationResult verifyRemote(String chainId, CheckpointArtifact artifact)
            throws IOException, InterruptedException {
        return post(CHAINS + encode(chainId) + "/verify", artifact, new TypeReference<VerificationResult>() {});
    }

    // ==================== Evidence ====================

    public AuditPackage exportPackage(String chainId, Instant from, Instant to)
            throws IOException, InterruptedException {
        StringBuilder path = new StringBuilder(CHAINS).append(encode(chainId)).append("/export");
        char separator = '?';
        if (from != null) {
            path.append(separator).append("from=").append(encode(from.toString()));
            separator = '&';
        }
        if (to != null) {
            path.append(separator).append("to=").append(encode(to.toString()));
        }
        return get(path.toString(), new TypeReference<AuditPackage>() {});
    }

    // ==================== HTTP Methods ====================

    private <T> T get(String path, TypeReference<T> typeRef) throws IOException, InterruptedException {
        HttpRequest request = requestBuilder(path).GET().build();
        return send(request, typeRef);
    }

    private <T> T post(String path, Object body, TypeReference<T> typeRef)
            throws IOException, InterruptedException {
        String jsonBody = objectMapper.writeValueAsString(body);
        HttpRequest request = requestBuilder(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                .build();
        return send(request, typeRef);
    }

    private HttpRequest.Builder requestBuilder(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Accept", "application/json");
        if (clientId != null) {
            builder.header("X-Client-ID", clientId);
        }
        return builder;
    }

    private <T> T send(HttpRequest request, TypeReference<T> typeRef) throws IOException, InterruptedException {
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() / 100 != 2) {
            throw AuditorClientException.from(response.statusCode(), response.body(), objectMapper);
        }
        return objectMapper.readValue(response.body(), typeRef);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    @Override
    public void close() {
        // HttpClient holds no resources that need releasing on JDK 17
    }

    // ==================== Builder ====================

    public static class Builder {
        private String baseUrl = "http://localhost:8080";
        private String clientId;
        private int connectTimeoutSeconds = 10;
        private int requestTimeoutSeconds = 120;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder connectTimeout(int seconds) {
            this.connectTimeoutSeconds = seconds;
            return this;
        }

        public Builder requestTimeout(int seconds) {
            this.requestTimeoutSeconds = seconds;
            return this;
        }

        public AuditorClient build() {
            Objects.requireNonNull(baseUrl, "Base URL is required");
            return new AuditorClient(this);
        }
    }
}
