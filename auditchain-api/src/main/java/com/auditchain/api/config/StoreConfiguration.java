package com.auditchain.api.config;

import com.auditchain.core.repository.AuditEntryRepository;
import com.auditchain.core.repository.CheckpointRepository;
import com.auditchain.core.store.ChainStore;
import com.auditchain.core.store.CheckpointStore;
import com.auditchain.core.store.InMemoryChainStore;
import com.auditchain.core.store.InMemoryCheckpointStore;
import com.auditchain.core.store.JpaChainStore;
import com.auditchain.core.store.JpaCheckpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;

/**
 * Selects the chain and checkpoint stores with {@code auditchain.store.type}: {@code jpa}
 * (default) or {@code memory}.
 */
@Configuration
public class StoreConfiguration {

    private static final Logger log = LoggerFactory.getLogger(StoreConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "auditchain.store.type", havingValue = "jpa", matchIfMissing = true)
    public ChainStore jpaChainStore(AuditEntryRepository repository,
                                    PlatformTransactionManager transactionManager,
                                    @Value("${auditchain.store.batch-size:500}") int batchSize) {
        log.info("Using JPA chain store with range batches of {}", batchSize);
        return new JpaChainStore(repository, transactionManager, batchSize);
    }

    @Bean
    @ConditionalOnProperty(name = "auditchain.store.type", havingValue = "jpa", matchIfMissing = true)
    public CheckpointStore jpaCheckpointStore(CheckpointRepository repository,
                                              PlatformTransactionManager transactionManager) {
        return new JpaCheckpointStore(repository, transactionManager);
    }

    @Bean
    @ConditionalOnProperty(name = "auditchain.store.type", havingValue = "memory")
    public ChainStore inMemoryChainStore() {
        log.warn("Using in-memory chain store; entries are lost on restart");
        return new InMemoryChainStore();
    }

    @Bean
    @ConditionalOnProperty(name = "auditchain.store.type", havingValue = "memory")
    public CheckpointStore inMemoryCheckpointStore() {
        return new InMemoryCheckpointStore();
    }
}
