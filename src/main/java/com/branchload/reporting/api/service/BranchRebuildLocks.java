package com.branchload.reporting.api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One mutex per branch around the delete + reinsert phase of a rebuild
 */
@Component
@Slf4j
public class BranchRebuildLocks {

    private final Map<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(long branchId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(branchId, id -> new ReentrantLock());
        if (lock.isLocked() && !lock.isHeldByCurrentThread()) {
            log.info("Branch {} rebuild waiting for a running rebuild", branchId);
        }
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked(long branchId) {
        ReentrantLock lock = locks.get(branchId);
        return lock != null && lock.isLocked();
    }
}
