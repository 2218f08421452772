package com.auditchain.api.append;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.auditchain.api.config.AppendProperties;
import com.auditchain.core.canonical.EntryHasher;
import com.auditchain.core.domain.AuditEntry;
import com.auditchain.core.domain.AuditEvent;
import com.auditchain.core.exception.ConcurrentAppendConflictException;
import com.auditchain.core.exception.DuplicateSequenceException;
import com.auditchain.core.exception.SerializationException;
import com.auditchain.core.exception.StoreUnavailableException;
import com.auditchain.core.store.ChainStore;
import com.auditchain.core.store.InMemoryChainStore;
import com.auditchain.core.verify.CancellationToken;
import com.auditchain.core.verify.ChainVerifier;
import com.auditchain.core.verify.VerificationAnchor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

class AppendEngineTest {

    private static final Instant NOW = Instant.parse("2024-07-01T12:00:00.123456789Z");

    private InMemoryChainStore store;
    private AppendProperties properties;
    private AppendEngine engine;
    private ListAppender<ILoggingEvent> logs;

    @BeforeEach
    void setUp() {
        store = new InMemoryChainStore();
        properties = new AppendProperties();
        properties.setInitialBackoff(Duration.ofMillis(1));
        properties.setMaxBackoff(Duration.ofMillis(4));
        engine = newEngine(store);

        logs = new ListAppender<>();
        logs.start();
        ((Logger) LoggerFactory.getLogger(AppendEngine.class)).addAppender(logs);
    }

    @AfterEach
    void tearDown() {
        ((Logger) LoggerFactory.getLogger(AppendEngine.class)).detachAppender(logs);
    }

    private AppendEngine newEngine(ChainStore chainStore) {
        return new AppendEngine(chainStore, new ChainLockRegistry(), properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static AuditEvent event(String action) {
        return AuditEvent.of("user-1", action, "document", "doc-1", Map.of("title", "Quarterly report"));
    }

    // ==================== Sequencing ====================

    @Test
    void firstAppend_createsGenesisEntry() {
        // When
        AuditEntry entry = engine.append("tenant-a", event("create"));

        // Then
        assertThat(entry.sequence()).isZero();
        assertThat(entry.previousHash()).isEqualTo(EntryHasher.GENESIS_SENTINEL);
        assertThat(entry.entryHash()).isEqualTo(EntryHasher.hash(entry));
        assertThat(entry.timestamp()).isEqualTo(Instant.parse("2024-07-01T12:00:00.123456Z"));
        assertThat(store.getHead("tenant-a")).contains(entry);
    }

    @Test
    void laterAppends_linkToHead() {
        // When
        AuditEntry first = engine.append("tenant-a", event("create"));
        AuditEntry second = engine.append("tenant-a", event("update"));
        AuditEntry third = engine.append("tenant-a", event("delete"));

        // Then
        assertThat(second.sequence()).isEqualTo(1);
        assertThat(second.previousHash()).isEqualTo(first.entryHash());
        assertThat(third.previousHash()).isEqualTo(second.entryHash());
        assertThat(store.count("tenant-a")).isEqualTo(3);
    }

    @Test
    void chains_areSequencedIndependently() {
        engine.append("tenant-a", event("create"));
        engine.append("tenant-a", event("update"));

        AuditEntry other = engine.append("tenant-b", event("create"));

        assertThat(other.sequence()).isZero();
        assertThat(other.previousHash()).isEqualTo(EntryHasher.GENESIS_SENTINEL);
    }

    @Test
    void callerTimestamp_isKeptAtMicrosecondPrecision() {
        Instant when = Instant.parse("2023-12-31T23:59:59.999999999Z");

        AuditEntry entry = engine.append("tenant-a", event("create").at(when));

        assertThat(entry.timestamp()).isEqualTo(Instant.parse("2023-12-31T23:59:59.999999Z"));
    }

    @Test
    void storedPayload_hashesLikeTheReturnedEntry() {
        // Given
        Map<String, Object> payload = Map.of("amount", new BigDecimal("100"), "rate", new BigDecimal("0.0350"));

        // When
        AuditEntry entry = engine.append("tenant-a",
                AuditEvent.of("user-1", "loan.priced", "loan", "l-1", payload));

        // Then
        AuditEntry stored = store.getEntry("tenant-a", 0).orElseThrow();
        assertThat(EntryHasher.hash(stored)).isEqualTo(entry.entryHash());
    }

    // ==================== Validation ====================

    @Test
    void invalidChainId_isRejected() {
        assertThatThrownBy(() -> engine.append("../etc", event("create")))
                .isInstanceOf(SerializationException.class);
        assertThatThrownBy(() -> engine.append(" ", event("create")))
                .isInstanceOf(SerializationException.class);
        assertThatThrownBy(() -> engine.append("a".repeat(129), event("create")))
                .isInstanceOf(SerializationException.class);
        assertThat(store.chainIds()).isEmpty();
    }

    @Test
    void missingRequiredFields_areRejected() {
        assertThatThrownBy(() -> engine.append("tenant-a", AuditEvent.of(null, "create", "document", null, Map.of())))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("actorId");
        assertThatThrownBy(() -> engine.append("tenant-a", AuditEvent.of("u", "", "document", null, Map.of())))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("action");
        assertThatThrownBy(() -> engine.append("tenant-a", AuditEvent.of("u", "create", null, null, Map.of())))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("resourceType");
    }

    @Test
    void unencodablePayload_isRejectedBeforeAnythingIsStored() {
        Map<String, Object> payload = Map.of("when", new Object());

        assertThatThrownBy(() -> engine.append("tenant-a",
                AuditEvent.of("user-1", "create", "document", "doc-1", payload)))
                .isInstanceOf(SerializationException.class);
        assertThat(store.count("tenant-a")).isZero();
    }

    @Test
    void oversizedPayload_isRejected() {
        properties.setMaxPayloadBytes(64);
        AppendEngine small = newEngine(store);

        assertThatThrownBy(() -> small.append("tenant-a",
                AuditEvent.of("user-1", "create", "document", "doc-1", Map.of("blob", "x".repeat(100)))))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("exceeds");
    }

    // ==================== Concurrency ====================

    @Test
    void concurrentAppends_neverFork() throws Exception {
        // Given
        int writers = 16;
        int perWriter = 25;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<AuditEntry>>> futures = new ArrayList<>();

        // When
        for (int w = 0; w < writers; w++) {
            int writer = w;
            Callable<List<AuditEntry>> task = () -> {
                start.await();
                List<AuditEntry> mine = new ArrayList<>();
                for (int i = 0; i < perWriter; i++) {
                    mine.add(engine.append("shared", event("w" + writer + "-" + i)));
                }
                return mine;
            };
            futures.add(pool.submit(task));
        }
        start.countDown();
        Set<Long> sequences = new HashSet<>();
        for (Future<List<AuditEntry>> future : futures) {
            future.get(30, TimeUnit.SECONDS).forEach(e -> sequences.add(e.sequence()));
        }
        pool.shutdown();

        // Then
        int total = writers * perWriter;
        assertThat(sequences).hasSize(total);
        assertThat(store.count("shared")).isEqualTo(total);
        try (Stream<AuditEntry> range = store.getRange("shared", 0, total - 1)) {
            assertThat(ChainVerifier.verify(range.iterator(), VerificationAnchor.fromGenesis(),
                    CancellationToken.none()).isValid()).isTrue();
        }
    }

    @Test
    void duplicateSequence_isRetriedFromFreshHead() {
        // Given a writer in another process that wins the next position twice
        engine.append("tenant-a", event("create"));
        AtomicInteger races = new AtomicInteger(2);
        InMemoryChainStore racing = new InMemoryChainStore() {
            @Override
            public AuditEntry append(AuditEntry entry) {
                if (races.getAndDecrement() > 0) {
                    store.append(EntryHasher.seal(AuditEntry.next(entry.chainId(), entry.sequence(),
                            entry.previousHash(), event("foreign"), NOW)));
                }
                return store.append(entry);
            }

            @Override
            public Optional<AuditEntry> getHead(String chainId) {
                return store.getHead(chainId);
            }
        };

        // When
        AuditEntry entry = newEngine(racing).append("tenant-a", event("update"));

        // Then
        assertThat(entry.sequence()).isEqualTo(3);
        assertThat(store.getEntry("tenant-a", 2).orElseThrow().entryHash()).isEqualTo(entry.previousHash());
        assertThat(logs.list).anyMatch(e -> e.getFormattedMessage().contains("Sequence conflict"));
    }

    @Test
    void persistentConflict_surfacesAfterBoundedAttempts() {
        // Given
        properties.setMaxAttempts(3);
        AtomicInteger attempts = new AtomicInteger();
        InMemoryChainStore alwaysTaken = new InMemoryChainStore() {
            @Override
            public AuditEntry append(AuditEntry entry) {
                attempts.incrementAndGet();
                throw new DuplicateSequenceException(entry.chainId(), entry.sequence());
            }
        };

        // When / Then
        assertThatThrownBy(() -> newEngine(alwaysTaken).append("tenant-a", event("create")))
                .isInstanceOf(ConcurrentAppendConflictException.class)
                .hasCauseInstanceOf(DuplicateSequenceException.class);
        assertThat(attempts).hasValue(3);
    }

    @Test
    void storeOutage_isNotRetried() {
        // Given
        AtomicInteger attempts = new AtomicInteger();
        InMemoryChainStore down = new InMemoryChainStore() {
            @Override
            public AuditEntry append(AuditEntry entry) {
                attempts.incrementAndGet();
                return super.append(entry);
            }
        };
        down.setUnavailable(true);

        // When / Then
        assertThatThrownBy(() -> newEngine(down).append("tenant-a", event("create")))
                .isInstanceOf(StoreUnavailableException.class);
        assertThat(attempts.get()).isLessThanOrEqualTo(1);
    }

    // ==================== Logging ====================

    @Test
    void payloadContents_neverReachTheLog() {
        engine.append("tenant-a", AuditEvent.of("user-1", "patient.viewed", "record", "r-9",
                Map.of("diagnosis", "SECRET-DIAGNOSIS-4711")));

        assertThat(logs.list).isNotEmpty();
        assertThat(logs.list).noneMatch(e -> e.getFormattedMessage().contains("SECRET-DIAGNOSIS-4711"));
        assertThat(logs.list).anyMatch(e -> e.getFormattedMessage().contains("chain=tenant-a sequence=0"));
    }
}
