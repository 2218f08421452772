package com.auditchain.api.append;

import com.auditchain.api.config.AppendProperties;
import com.auditchain.core.canonical.EntryHasher;
import com.auditchain.core.canonical.PayloadCodec;
import com.auditchain.core.domain.AuditEntry;
import com.auditchain.core.domain.AuditEvent;
import com.auditchain.core.exception.ConcurrentAppendConflictException;
import com.auditchain.core.exception.DuplicateSequenceException;
import com.auditchain.core.exception.SerializationException;
import com.auditchain.core.store.ChainStore;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Turns logical events into committed chain entries.
 * <p>
 * Per append: take the chain's lock, read the head, link and hash the new entry, store
 * it. A duplicate sequence means a writer in another process took the position first;
 * the append is retried from the head read with exponential backoff. Invalid input and
 * store outages are never retried.
 */
@Service
public class AppendEngine {

    private static final Logger log = LoggerFactory.getLogger(AppendEngine.class);
    private static final Pattern CHAIN_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._:-]*");

    private final ChainStore chainStore;
    private final ChainLockRegistry locks;
    private final AppendProperties properties;
    private final Clock clock;
    private final Retry retry;

    public AppendEngine(ChainStore chainStore, ChainLockRegistry locks, AppendProperties properties, Clock clock) {
        this.chainStore = chainStore;
        this.locks = locks;
        this.properties = properties;
        this.clock = clock;
        this.retry = Retry.of("chain-append", RetryConfig.custom()
                .maxAttempts(properties.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        properties.getInitialBackoff(),
                        properties.getBackoffMultiplier(),
                        properties.getMaxBackoff()))
                .retryExceptions(DuplicateSequenceException.class)
                .build());
        this.retry.getEventPublisher()
                .onRetry(event -> log.warn("Sequence conflict, retry attempt {}: {}",
                        event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
    }

    /**
     * Appends an event to a chain and returns the committed entry.
     *
     * @throws SerializationException            if the event is invalid or cannot be canonically encoded
     * @throws ConcurrentAppendConflictException if other writers kept winning the next sequence
     */
    public AuditEntry append(String chainId, AuditEvent event) {
        validate(chainId, event);
        Map<String, Object> payload = PayloadCodec.normalize(event.payload());
        int payloadBytes = PayloadCodec.write(payload).getBytes(StandardCharsets.UTF_8).length;
        if (payloadBytes > properties.getMaxPayloadBytes()) {
            throw new SerializationException("Payload of " + payloadBytes + " bytes exceeds the limit of "
                    + properties.getMaxPayloadBytes());
        }
        Instant timestamp = (event.timestamp() != null ? event.timestamp() : clock.instant())
                .truncatedTo(ChronoUnit.MICROS);
        AuditEvent normalized = new AuditEvent(event.actorId(), event.action(), event.resourceType(),
                event.resourceId(), payload, timestamp);

        ReentrantLock lock = locks.appendLock(chainId);
        lock.lock();
        try {
            AuditEntry committed = Retry.decorateSupplier(retry, () -> appendOnce(chainId, normalized)).get();
            log.info("Audit event logged chain={} sequence={} action={} resourceType={}",
                    chainId, committed.sequence(), committed.action(), committed.resourceType());
            return committed;
        } catch (DuplicateSequenceException e) {
            log.error("Append to chain {} gave up after {} attempts", chainId, properties.getMaxAttempts());
            throw new ConcurrentAppendConflictException(chainId, properties.getMaxAttempts(), e);
        } finally {
            lock.unlock();
        }
    }

    private AuditEntry appendOnce(String chainId, AuditEvent event) {
        AuditEntry entry = chainStore.getHead(chainId)
                .map(head -> AuditEntry.next(chainId, head.sequence() + 1, head.entryHash(), event, event.timestamp()))
                .orElseGet(() -> AuditEntry.next(chainId, 0, EntryHasher.GENESIS_SENTINEL, event, event.timestamp()));
        return chainStore.append(EntryHasher.seal(entry));
    }

    // ==================== Validation ====================

    private void validate(String chainId, AuditEvent event) {
        if (chainId == null || chainId.isBlank()) {
            throw new SerializationException("chainId is required");
        }
        if (chainId.length() > properties.getMaxChainIdLength() || !CHAIN_ID.matcher(chainId).matches()) {
            throw new SerializationException("chainId must be at most " + properties.getMaxChainIdLength()
                    + " characters of letters, digits, '.', '_', ':' or '-'");
        }
        if (event == null) {
            throw new SerializationException("event is required");
        }
        requireText("actorId", event.actorId());
        requireText("action", event.action());
        requireText("resourceType", event.resourceType());
        if (event.resourceId() != null && event.resourceId().length() > properties.getMaxFieldLength()) {
            throw new SerializationException("resourceId exceeds " + properties.getMaxFieldLength() + " characters");
        }
    }

    private void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new SerializationException(field + " is required");
        }
        if (value.length() > properties.getMaxFieldLength()) {
            throw new SerializationException(field + " exceeds " + properties.getMaxFieldLength() + " characters");
        }
    }
}
