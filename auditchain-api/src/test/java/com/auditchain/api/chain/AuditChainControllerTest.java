package com.auditchain.api.chain;

import com.auditchain.api.append.AppendEngine;
import com.auditchain.api.checkpoint.CheckpointManager;
import com.auditchain.api.checkpoint.InclusionProofService;
import com.auditchain.api.config.RateLimitConfig;
import com.auditchain.api.evidence.AuditPackageService;
import com.auditchain.api.verify.VerificationEngine;
import com.auditchain.core.canonical.EntryHasher;
import com.auditchain.core.canonical.MerkleTree;
import com.auditchain.core.domain.AuditEntry;
import com.auditchain.core.domain.AuditEvent;
import com.auditchain.core.domain.AuditQuery;
import com.auditchain.core.domain.ChainStatus;
import com.auditchain.core.domain.Checkpoint;
import com.auditchain.core.domain.InclusionProof;
import com.auditchain.core.domain.SequenceRange;
import com.auditchain.core.exception.ChainIntegrityException;
import com.auditchain.core.exception.CheckpointNotFoundException;
import com.auditchain.core.exception.ConcurrentAppendConflictException;
import com.auditchain.core.exception.EntryNotFoundException;
import com.auditchain.core.exception.SerializationException;
import com.auditchain.core.exception.StoreUnavailableException;
import com.auditchain.core.verify.BreakReason;
import com.auditchain.core.verify.CancellationToken;
import com.auditchain.core.verify.VerificationResult;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AuditChainController.class)
@Import(RateLimitConfig.class)
@TestPropertySource(properties = {
        "auditchain.rate-limit.strict-per-minute=10000",
        "auditchain.rate-limit.default-per-minute=10000",
        "auditchain.rate-limit.high-volume-per-minute=10000"
})
class AuditChainControllerTest {

    private static final Instant TS = Instant.parse("2024-05-01T10:00:00.000123Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AppendEngine appendEngine;
    @MockBean
    private ChainQueryService queryService;
    @MockBean
    private VerificationEngine verificationEngine;
    @MockBean
    private CheckpointManager checkpointManager;
    @MockBean
    private AuditPackageService packageService;
    @MockBean
    private InclusionProofService proofService;

    private static AuditEntry genesis() {
        return EntryHasher.seal(AuditEntry.next("tenant-a", 0, EntryHasher.GENESIS_SENTINEL,
                AuditEvent.of("alice", "create", "document", "d-1", Map.of("title", "Draft")), TS));
    }

    // ==================== Entries ====================

    @Test
    void append_returnsCreatedEntry() throws Exception {
        // Given
        AuditEntry committed = genesis();
        when(appendEngine.append(eq("tenant-a"), any(AuditEvent.class))).thenReturn(committed);

        // When / Then
        mockMvc.perform(post("/api/v1/chains/tenant-a/entries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actorId\":\"alice\",\"action\":\"create\",\"resourceType\":\"document\","
                                + "\"resourceId\":\"d-1\",\"payload\":{\"title\":\"Draft\",\"amount\":12.50}}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sequence").value(0))
                .andExpect(jsonPath("$.previousHash").value(EntryHasher.GENESIS_SENTINEL))
                .andExpect(jsonPath("$.entryHash").value(committed.entryHash()))
                .andExpect(jsonPath("$.timestamp").value("2024-05-01T10:00:00.000123Z"))
                .andExpect(header().exists("X-Rate-Limit-Remaining"));

        ArgumentCaptor<AuditEvent> event = ArgumentCaptor.forClass(AuditEvent.class);
        verify(appendEngine).append(eq("tenant-a"), event.capture());
        assertThat(event.getValue().actorId()).isEqualTo("alice");
        assertThat(event.getValue().timestamp()).isNull();
        assertThat(event.getValue().payload().get("amount")).isEqualTo(new BigDecimal("12.50"));
    }

    @Test
    void append_invalidEvent_isBadRequest() throws Exception {
        when(appendEngine.append(eq("tenant-a"), any(AuditEvent.class)))
                .thenThrow(new SerializationException("actorId is required"));

        mockMvc.perform(post("/api/v1/chains/tenant-a/entries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"create\",\"resourceType\":\"document\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("AUDIT_400"))
                .andExpect(jsonPath("$.message").value("actorId is required"));
    }

    @Test
    void append_lostRace_isConflict() throws Exception {
        when(appendEngine.append(eq("tenant-a"), any(AuditEvent.class)))
                .thenThrow(new ConcurrentAppendConflictException("tenant-a", 5, null));

        mockMvc.perform(post("/api/v1/chains/tenant-a/entries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actorId\":\"a\",\"action\":\"b\",\"resourceType\":\"c\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("AUDIT_409"));
    }

    @Test
    void append_storeDown_isServiceUnavailable() throws Exception {
        when(appendEngine.append(eq("tenant-a"), any(AuditEvent.class)))
                .thenThrow(new StoreUnavailableException("database not responding", null));

        mockMvc.perform(post("/api/v1/chains/tenant-a/entries")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actorId\":\"a\",\"action\":\"b\",\"resourceType\":\"c\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("AUDIT_503"));
    }

    @Test
    void getEntries_passesFiltersAndPage() throws Exception {
        // Given
        when(queryService.query(any(AuditQuery.class), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(genesis()), PageRequest.of(1, 10), 11));

        // When / Then
        mockMvc.perform(get("/api/v1/chains/tenant-a/entries")
                        .param("actorId", "alice")
                        .param("from", "2024-05-01T00:00:00Z")
                        .param("to", "2024-05-02T00:00:00Z")
                        .param("page", "1")
                        .param("size", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[0].actorId").value("alice"))
                .andExpect(jsonPath("$.totalElements").value(11));

        verify(queryService).query(
                new AuditQuery("tenant-a", "alice", null, null,
                        Instant.parse("2024-05-01T00:00:00Z"), Instant.parse("2024-05-02T00:00:00Z")),
                PageRequest.of(1, 10));
    }

    @Test
    void searchEntries_acrossChains() throws Exception {
        when(queryService.query(any(AuditQuery.class), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(), PageRequest.of(0, 50), 0));

        mockMvc.perform(get("/api/v1/chains/entries").param("resourceType", "document"))
                .andExpect(status().isOk());

        verify(queryService).query(new AuditQuery(null, null, "document", null, null, null), PageRequest.of(0, 50));
    }

    @Test
    void getEntries_oversizedPage_isBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/chains/tenant-a/entries").param("size", "5000"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("AUDIT_400"));
    }

    @Test
    void getEntry_missing_isNotFound() throws Exception {
        when(queryService.getEntry("tenant-a", 7)).thenThrow(new EntryNotFoundException("tenant-a", 7));

        mockMvc.perform(get("/api/v1/chains/tenant-a/entries/7"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("AUDIT_404"));
    }

    @Test
    void getInclusionProof_returnsPathAgainstCoveringCheckpoint() throws Exception {
        // Given
        InclusionProof proof = new InclusionProof("tenant-a", 2, "a".repeat(64), 4, "b".repeat(64), "c".repeat(64), 0,
                List.of(new MerkleTree.ProofStep("d".repeat(64), false), new MerkleTree.ProofStep("e".repeat(64), true)));
        when(proofService.prove("tenant-a", 2)).thenReturn(proof);

        // When / Then
        mockMvc.perform(get("/api/v1/chains/tenant-a/entries/2/proof"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.checkpointSequence").value(4))
                .andExpect(jsonPath("$.merkleRoot").value("c".repeat(64)))
                .andExpect(jsonPath("$.path[0].hash").value("d".repeat(64)))
                .andExpect(jsonPath("$.path[1].siblingOnLeft").value(true));
    }

    @Test
    void getInclusionProof_beforeAnyCoveringCheckpoint_isNotFound() throws Exception {
        when(proofService.prove("tenant-a", 7)).thenThrow(CheckpointNotFoundException.covering("tenant-a", 7));

        mockMvc.perform(get("/api/v1/chains/tenant-a/entries/7/proof"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("AUDIT_404"));
    }

    @Test
    void getStatus_includesExportFlag() throws Exception {
        Checkpoint pending = Checkpoint.create("tenant-a", 4, "c".repeat(64), TS);
        when(queryService.status("tenant-a")).thenReturn(new ChainStatus("tenant-a", 5, 4L, "d".repeat(64), pending));

        mockMvc.perform(get("/api/v1/chains/tenant-a"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entryCount").value(5))
                .andExpect(jsonPath("$.headSequence").value(4))
                .andExpect(jsonPath("$.latestCheckpoint.sequence").value(4))
                .andExpect(jsonPath("$.unexportedCheckpoint").value(true));
    }

    // ==================== Verification ====================

    @Test
    void verify_reportsBreakWithReason() throws Exception {
        when(verificationEngine.verify("tenant-a", Optional.empty())).thenReturn(
                new VerificationResult.Broken(1, BreakReason.HASH_MISMATCH, SequenceRange.of(0, 0),
                        "stored hash does not match content"));

        mockMvc.perform(get("/api/v1/chains/tenant-a/verify"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("BROKEN"))
                .andExpect(jsonPath("$.sequence").value(1))
                .andExpect(jsonPath("$.reason").value("HASH_MISMATCH"))
                .andExpect(jsonPath("$.verified.from").value(0))
                .andExpect(jsonPath("$.verified.to").value(0));
    }

    @Test
    void verify_fromStoredCheckpoint() throws Exception {
        Checkpoint stored = Checkpoint.create("tenant-a", 5, "e".repeat(64), TS);
        when(checkpointManager.find("tenant-a", 5)).thenReturn(Optional.of(stored));
        when(verificationEngine.verify("tenant-a", Optional.of(stored))).thenReturn(
                new VerificationResult.Valid(SequenceRange.of(5, 9), "f".repeat(64)));

        mockMvc.perform(get("/api/v1/chains/tenant-a/verify").param("fromCheckpoint", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("VALID"))
                .andExpect(jsonPath("$.covered.from").value(5));
    }

    @Test
    void verify_fromUnknownCheckpoint_isNotFound() throws Exception {
        when(checkpointManager.find("tenant-a", 5)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/chains/tenant-a/verify").param("fromCheckpoint", "5"))
                .andExpect(status().isNotFound());
    }

    @Test
    void verify_againstHeldArtifact() throws Exception {
        Checkpoint trusted = Checkpoint.trusted("tenant-a", 3, "a".repeat(64));
        when(verificationEngine.verify("tenant-a", Optional.of(trusted))).thenReturn(
                new VerificationResult.Valid(SequenceRange.of(3, 8), "b".repeat(64)));

        mockMvc.perform(post("/api/v1/chains/tenant-a/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"format\":\"auditchain-checkpoint/v1\",\"chainId\":\"tenant-a\",\"sequence\":3,"
                                + "\"rootHash\":\"" + "a".repeat(64) + "\",\"timestamp\":\"2024-05-01T10:00:00Z\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("VALID"));
    }

    @Test
    void verify_againstUnknownArtifactFormat_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/chains/tenant-a/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"format\":\"other/v9\",\"chainId\":\"tenant-a\",\"sequence\":3,"
                                + "\"rootHash\":\"" + "a".repeat(64) + "\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(verificationEngine);
    }

    @Test
    void verifySegmented_usesParallelWalk() throws Exception {
        when(verificationEngine.verifySegmented(eq("tenant-a"), any(CancellationToken.class))).thenReturn(
                new VerificationResult.Valid(SequenceRange.of(0, 99), "a".repeat(64)));

        mockMvc.perform(get("/api/v1/chains/tenant-a/verify/segmented"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.covered.to").value(99));
    }

    // ==================== Checkpoints and evidence ====================

    @Test
    void createCheckpoint_onBrokenChain_isConflict() throws Exception {
        when(checkpointManager.checkpoint("tenant-a"))
                .thenThrow(new ChainIntegrityException("tenant-a", 2, BreakReason.LINKAGE_MISMATCH, "previous hash does not match entry 1"));

        mockMvc.perform(post("/api/v1/chains/tenant-a/checkpoints"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("AUDIT_422"));
    }

    @Test
    void createCheckpoint_returnsCreated() throws Exception {
        when(checkpointManager.checkpoint("tenant-a"))
                .thenReturn(Checkpoint.create("tenant-a", 9, "a".repeat(64), TS).exported(TS, "file:///w"));

        mockMvc.perform(post("/api/v1/chains/tenant-a/checkpoints"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sequence").value(9))
                .andExpect(jsonPath("$.exportDestination").value("file:///w"));
    }

    @Test
    void listCheckpoints() throws Exception {
        when(checkpointManager.list("tenant-a")).thenReturn(List.of(
                Checkpoint.create("tenant-a", 9, "a".repeat(64), TS),
                Checkpoint.create("tenant-a", 19, "b".repeat(64), TS)));

        mockMvc.perform(get("/api/v1/chains/tenant-a/checkpoints"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[1].sequence").value(19));
    }

    @Test
    void exportPackage_invertedWindow_isBadRequest() throws Exception {
        when(packageService.exportPackage(eq("tenant-a"), any(), any()))
                .thenThrow(new IllegalArgumentException("Time window start must be before its end"));

        mockMvc.perform(get("/api/v1/chains/tenant-a/export")
                        .param("from", "2024-05-02T00:00:00Z")
                        .param("to", "2024-05-01T00:00:00Z"))
                .andExpect(status().isBadRequest());
    }
}
