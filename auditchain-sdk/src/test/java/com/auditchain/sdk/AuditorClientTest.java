package com.auditchain.sdk;

import com.auditchain.core.canonical.EntryHasher;
import com.auditchain.core.canonical.MerkleTree;
import com.auditchain.core.domain.AuditEntry;
import com.auditchain.core.domain.AuditEvent;
import com.auditchain.core.domain.CheckpointArtifact;
import com.auditchain.core.domain.InclusionProof;
import com.auditchain.core.domain.SequenceRange;
import com.auditchain.core.verify.VerificationResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

/**
 * Client against a local stand-in for the chain API.
 */
class AuditorClientTest {

    private final ObjectMapper mapper = AuditorClient.objectMapper();
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private HttpServer server;
    private AuditorClient client;
    private List<AuditEntry> chain;

    @BeforeEach
    void setUp() throws IOException {
        chain = new ArrayList<>();
        String previous = EntryHasher.GENESIS_SENTINEL;
        for (int i = 0; i < 3; i++) {
            AuditEntry entry = EntryHasher.seal(AuditEntry.next("orders", i, previous,
                    AuditEvent.of("svc", "order.updated", "order", "o-" + i, Map.of("rev", i)),
                    Instant.parse("2024-06-01T00:00:00Z").plusSeconds(i)));
            chain.add(entry);
            previous = entry.entryHash();
        }

        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/v1/chains/orders/entries", exchange -> {
            requests.add(exchange.getRequestURI().toString());
            boolean first = exchange.getRequestURI().getQuery().contains("page=0");
            List<AuditEntry> content = first ? chain.subList(0, 2) : chain.subList(2, 3);
            respond(exchange, 200, mapper.writeValueAsString(Map.of(
                    "content", content, "totalElements", 3, "totalPages", 2,
                    "number", first ? 0 : 1, "last", !first)));
        });
        server.createContext("/api/v1/chains/orders/entries/1/proof", exchange -> {
            MerkleTree tree = MerkleTree.build(chain.stream().map(AuditEntry::entryHash).toList());
            respond(exchange, 200, mapper.writeValueAsString(new InclusionProof("orders", 1,
                    chain.get(1).entryHash(), 2, chain.get(2).entryHash(), tree.root(), 0, tree.proof(1))));
        });
        server.createContext("/api/v1/chains/orders/verify", exchange -> {
            requests.add(exchange.getRequestHeaders().getFirst("X-Client-ID"));
            respond(exchange, 200, mapper.writeValueAsString(
                    new VerificationResult.Valid(SequenceRange.of(0, 2), chain.get(2).entryHash())));
        });
        server.createContext("/api/v1/chains/missing", exchange ->
                respond(exchange, 404, "{\"code\":\"AUDIT_404\",\"message\":\"Chain not found or empty: missing\"}"));
        server.start();

        client = AuditorClient.builder()
                .baseUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/")
                .clientId("auditor-7")
                .build();
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.stop(0);
    }

    @Test
    void fetchChain_followsPagesAndVerifiesOffline() throws Exception {
        // When
        List<AuditEntry> fetched = client.fetchChain("orders", 2);

        // Then
        assertThat(fetched).containsExactlyElementsOf(chain);
        assertThat(requests).containsExactly(
                "/api/v1/chains/orders/entries?page=0&size=2",
                "/api/v1/chains/orders/entries?page=1&size=2");
        assertThat(OfflineVerifier.verifyChain(fetched).isValid()).isTrue();
    }

    @Test
    void verifyRemote_readsPolymorphicResult() throws Exception {
        VerificationResult result = client.verifyRemote("orders");

        assertThat(result).isEqualTo(new VerificationResult.Valid(SequenceRange.of(0, 2), chain.get(2).entryHash()));
        assertThat(requests).containsExactly("auditor-7");
    }

    @Test
    void getInclusionProof_checksAgainstHeldArtifact() throws Exception {
        // Given
        CheckpointArtifact held = new CheckpointArtifact(CheckpointArtifact.FORMAT, "orders", 2,
                chain.get(2).entryHash(), Instant.parse("2024-06-01T01:00:00Z"),
                MerkleTree.build(chain.stream().map(AuditEntry::entryHash).toList()).root());

        // When
        InclusionProof proof = client.getInclusionProof("orders", 1);

        // Then
        assertThat(proof.path()).hasSize(2);
        assertThat(OfflineVerifier.verifyInclusion(chain.get(1), proof, held)).isTrue();
    }

    @Test
    void errorBody_becomesClientException() {
        assertThatThrownBy(() -> client.getStatus("missing"))
                .isInstanceOf(AuditorClientException.class)
                .satisfies(e -> {
                    AuditorClientException ex = (AuditorClientException) e;
                    assertThat(ex.getStatus()).isEqualTo(404);
                    assertThat(ex.getCode()).isEqualTo("AUDIT_404");
                });
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
