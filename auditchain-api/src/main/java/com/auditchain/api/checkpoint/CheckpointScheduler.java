package com.auditchain.api.checkpoint;

import com.auditchain.api.config.CheckpointProperties;
import com.auditchain.core.domain.AuditEntry;
import com.auditchain.core.domain.Checkpoint;
import com.auditchain.core.exception.AuditChainException;
import com.auditchain.core.store.ChainStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Periodic checkpointing: chains that are far enough past their latest checkpoint, or
 * whose checkpoint is old, get a new one; pending exports are retried; exports stuck
 * past the threshold are reported.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "auditchain.checkpoint.scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class CheckpointScheduler {

    private static final Logger log = LoggerFactory.getLogger(CheckpointScheduler.class);

    private final CheckpointManager checkpointManager;
    private final ChainStore chainStore;
    private final CheckpointProperties properties;
    private final Clock clock;

    public CheckpointScheduler(CheckpointManager checkpointManager, ChainStore chainStore,
                               CheckpointProperties properties, Clock clock) {
        this.checkpointManager = checkpointManager;
        this.chainStore = chainStore;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${auditchain.checkpoint.scheduler-delay-ms:60000}",
               initialDelayString = "${auditchain.checkpoint.scheduler-delay-ms:60000}")
    public void runCycle() {
        int created = 0;
        for (String chainId : chainStore.chainIds()) {
            try {
                if (isDue(chainId)) {
                    checkpointManager.checkpoint(chainId);
                    created++;
                }
            } catch (AuditChainException e) {
                log.error("Checkpointing chain {} failed [{}]: {}", chainId, e.getCode(), e.getMessage());
            }
        }
        checkpointManager.retryPendingExports();

        List<CheckpointManager.CheckpointExportFailure> stale =
                checkpointManager.staleExports(properties.getStaleAfter());
        if (!stale.isEmpty()) {
            log.error("{} checkpoints unexported for more than {}: {}", stale.size(), properties.getStaleAfter(),
                    stale.stream().map(CheckpointManager.CheckpointExportFailure::key).toList());
        }
        log.debug("Checkpoint cycle complete, {} checkpoints taken", created);
    }

    boolean isDue(String chainId) {
        Optional<AuditEntry> head = chainStore.getHead(chainId);
        if (head.isEmpty()) {
            return false;
        }
        Optional<Checkpoint> latest = checkpointManager.latest(chainId);
        if (latest.isEmpty()) {
            return true;
        }
        long behind = head.get().sequence() - latest.get().sequence();
        if (behind <= 0) {
            return false;
        }
        Instant ageLimit = clock.instant().minus(properties.getInterval());
        return behind >= properties.getEveryEntries() || latest.get().createdAt().isBefore(ageLimit);
    }
}
