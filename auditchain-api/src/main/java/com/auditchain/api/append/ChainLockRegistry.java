package com.auditchain.api.append;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * One fair lock per chain id, so writers to different chains never contend.
 * Serializes writers inside this process only; the store's uniqueness constraint
 * covers writers in other processes.
 * <p>
 * Locks are weakly held: a chain's lock lives as long as some caller references it, and
 * is collected once no writer needs it, so idle chains do not accumulate.
 */
@Component
public class ChainLockRegistry {

    private final Cache<String, ReentrantLock> appendLocks = Caffeine.newBuilder().weakValues().build();
    private final Cache<String, ReentrantLock> checkpointLocks = Caffeine.newBuilder().weakValues().build();

    public ReentrantLock appendLock(String chainId) {
        return appendLocks.get(chainId, id -> new ReentrantLock(true));
    }

    public ReentrantLock checkpointLock(String chainId) {
        return checkpointLocks.get(chainId, id -> new ReentrantLock(true));
    }

    int size() {
        appendLocks.cleanUp();
        checkpointLocks.cleanUp();
        return (int) (appendLocks.estimatedSize() + checkpointLocks.estimatedSize());
    }
}
