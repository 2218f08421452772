package com.auditchain.api.chain;

import com.auditchain.api.append.AppendEngine;
import com.auditchain.api.checkpoint.CheckpointManager;
import com.auditchain.api.checkpoint.InclusionProofService;
import com.auditchain.api.evidence.AuditPackageService;
import com.auditchain.api.verify.VerificationEngine;
import com.auditchain.core.domain.AuditEntry;
import com.auditchain.core.domain.AuditEvent;
import com.auditchain.core.domain.AuditPackage;
import com.auditchain.core.domain.AuditQuery;
import com.auditchain.core.domain.ChainStatus;
import com.auditchain.core.domain.Checkpoint;
import com.auditchain.core.domain.CheckpointArtifact;
import com.auditchain.core.domain.InclusionProof;
import com.auditchain.core.exception.AuditChainException;
import com.auditchain.core.exception.ChainIntegrityException;
import com.auditchain.core.exception.ChainNotFoundException;
import com.auditchain.core.exception.CheckpointExportFailureException;
import com.auditchain.core.exception.CheckpointNotFoundException;
import com.auditchain.core.exception.ConcurrentAppendConflictException;
import com.auditchain.core.exception.EntryNotFoundException;
import com.auditchain.core.exception.SerializationException;
import com.auditchain.core.exception.StoreUnavailableException;
import com.auditchain.core.verify.CancellationToken;
import com.auditchain.core.verify.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST API for audit chains.
 */
@RestController
@RequestMapping("/api/v1/chains")
public class AuditChainController {

    private static final Logger log = LoggerFactory.getLogger(AuditChainController.class);
    private static final int MAX_PAGE_SIZE = 500;

    private final AppendEngine appendEngine;
    private final ChainQueryService queryService;
    private final VerificationEngine verificationEngine;
    private final CheckpointManager checkpointManager;
    private final AuditPackageService packageService;
    private final InclusionProofService proofService;

    public AuditChainController(AppendEngine appendEngine,
                                ChainQueryService queryService,
                                VerificationEngine verificationEngine,
                                CheckpointManager checkpointManager,
                                AuditPackageService packageService,
                                InclusionProofService proofService) {
        this.appendEngine = appendEngine;
        this.queryService = queryService;
        this.verificationEngine = verificationEngine;
        this.checkpointManager = checkpointManager;
        this.packageService = packageService;
        this.proofService = proofService;
    }

    // ==================== Entries ====================

    /**
     * Append an event.
     * POST /api/v1/chains/{chainId}/entries
     */
    @PostMapping("/{chainId}/entries")
    public ResponseEntity<AuditEntry> append(@PathVariable String chainId,
                                             @RequestBody AppendRequest request) {
        AuditEntry entry = appendEngine.append(chainId, request.toEvent());
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }

    /**
     * Query one chain.
     * GET /api/v1/chains/{chainId}/entries
     */
    @GetMapping("/{chainId}/entries")
    public ResponseEntity<Page<AuditEntry>> getEntries(
            @PathVariable String chainId,
            @RequestParam(required = false) String actorId,
            @RequestParam(required = false) String resourceType,
            @RequestParam(required = false) String resourceId,
            @RequestParam(required = false) Instant from,
            @RequestParam(required = false) Instant to,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {

        AuditQuery filter = new AuditQuery(chainId, actorId, resourceType, resourceId, from, to);
        return ResponseEntity.ok(queryService.query(filter, pageOf(page, size)));
    }

    /**
     * Query across chains.
     * GET /api/v1/chains/entries
     */
    @GetMapping("/entries")
    public ResponseEntity<Page<AuditEntry>> searchEntries(
            @RequestParam(required = false) String actorId,
            @RequestParam(required = false) String resourceType,
            @RequestParam(required = false) String resourceId,
            @RequestParam(required = false) Instant from,
            @RequestParam(required = false) Instant to,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {

        AuditQuery filter = new AuditQuery(null, actorId, resourceType, resourceId, from, to);
        return ResponseEntity.ok(queryService.query(filter, pageOf(page, size)));
    }

    /**
     * GET /api/v1/chains/{chainId}/entries/{sequence}
     */
    @GetMapping("/{chainId}/entries/{sequence}")
    public ResponseEntity<AuditEntry> getEntry(@PathVariable String chainId, @PathVariable long sequence) {
        return ResponseEntity.ok(queryService.getEntry(chainId, sequence));
    }

    /**
     * Merkle inclusion proof of one entry against the checkpoint covering it.
     * GET /api/v1/chains/{chainId}/entries/{sequence}/proof
     */
    @GetMapping("/{chainId}/entries/{sequence}/proof")
    public ResponseEntity<InclusionProof> getInclusionProof(@PathVariable String chainId, @PathVariable long sequence) {
        return ResponseEntity.ok(proofService.prove(chainId, sequence));
    }

    /**
     * Chain status.
     * GET /api/v1/chains/{chainId}
     */
    @GetMapping("/{chainId}")
    public ResponseEntity<ChainStatus> getStatus(@PathVariable String chainId) {
        return ResponseEntity.ok(queryService.status(chainId));
    }

    // ==================== Verification ====================

    /**
     * Verify from genesis, or from a stored checkpoint.
     * GET /api/v1/chains/{chainId}/verify
     */
    @GetMapping("/{chainId}/verify")
    public ResponseEntity<VerificationResult> verify(@PathVariable String chainId,
                                                     @RequestParam(required = false) Long fromCheckpoint) {
        Optional<Checkpoint> anchor = Optional.empty();
        if (fromCheckpoint != null) {
            anchor = Optional.of(checkpointManager.find(chainId, fromCheckpoint)
                    .orElseThrow(() -> new CheckpointNotFoundException(chainId, fromCheckpoint)));
        }
        return ResponseEntity.ok(verificationEngine.verify(chainId, anchor));
    }

    /**
     * Verify from a checkpoint artifact held outside the system.
     * POST /api/v1/chains/{chainId}/verify
     */
    @PostMapping("/{chainId}/verify")
    public ResponseEntity<VerificationResult> verifyAgainstArtifact(@PathVariable String chainId,
                                                                    @RequestBody CheckpointArtifact artifact) {
        Checkpoint trusted = artifact.toTrustedCheckpoint();
        return ResponseEntity.ok(verificationEngine.verify(chainId, Optional.of(trusted)));
    }

    /**
     * Parallel verification split at stored checkpoints.
     * GET /api/v1/chains/{chainId}/verify/segmented
     */
    @GetMapping("/{chainId}/verify/segmented")
    public ResponseEntity<VerificationResult> verifySegmented(@PathVariable String chainId) {
        return ResponseEntity.ok(verificationEngine.verifySegmented(chainId, CancellationToken.none()));
    }

    // ==================== Checkpoints ====================

    /**
     * Create and export a checkpoint at the current head.
     * POST /api/v1/chains/{chainId}/checkpoints
     */
    @PostMapping("/{chainId}/checkpoints")
    public ResponseEntity<Checkpoint> createCheckpoint(@PathVariable String chainId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(checkpointManager.checkpoint(chainId));
    }

    /**
     * GET /api/v1/chains/{chainId}/checkpoints
     */
    @GetMapping("/{chainId}/checkpoints")
    public ResponseEntity<List<Checkpoint>> listCheckpoints(@PathVariable String chainId) {
        return ResponseEntity.ok(checkpointManager.list(chainId));
    }

    // ==================== Evidence ====================

    /**
     * Evidence package for a time window.
     * GET /api/v1/chains/{chainId}/export
     */
    @GetMapping("/{chainId}/export")
    public ResponseEntity<AuditPackage> exportPackage(
            @PathVariable String chainId,
            @RequestParam(required = false) Instant from,
            @RequestParam(required = false) Instant to) {
        return ResponseEntity.ok(packageService.exportPackage(chainId, from, to));
    }

    private static Pageable pageOf(int page, int size) {
        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE);
        }
        return PageRequest.of(page, size);
    }

    // Request DTOs
    public record AppendRequest(
            String actorId,
            String action,
            String resourceType,
            String resourceId,
            Map<String, Object> payload,
            Instant timestamp
    ) {
        AuditEvent toEvent() {
            return new AuditEvent(actorId, action, resourceType, resourceId, payload, timestamp);
        }
    }

    // Exception handlers
    @ExceptionHandler(SerializationException.class)
    public ResponseEntity<ErrorResponse> handleSerialization(SerializationException e) {
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(SerializationException.CODE, e.getMessage()));
    }

    @ExceptionHandler({ChainNotFoundException.class, EntryNotFoundException.class,
            CheckpointNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(AuditChainException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(ConcurrentAppendConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ConcurrentAppendConflictException e) {
        return error(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(ChainIntegrityException.class)
    public ResponseEntity<ErrorResponse> handleIntegrity(ChainIntegrityException e) {
        log.error("Integrity violation reported to caller chain={} sequence={} reason={}",
                e.getChainId(), e.getSequence(), e.getReason());
        return error(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(CheckpointExportFailureException.class)
    public ResponseEntity<ErrorResponse> handleExportFailure(CheckpointExportFailureException e) {
        return error(HttpStatus.BAD_GATEWAY, e);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(StoreUnavailableException e) {
        log.warn("Store unavailable: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, AuditChainException e) {
        return ResponseEntity.status(status).body(new ErrorResponse(e.getCode(), e.getMessage()));
    }

    public record ErrorResponse(String code, String message) {}
}
