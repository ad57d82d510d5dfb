package com.loan.crm.component;

import com.loan.crm.exception.ErrorKind;
import com.loan.crm.exception.ReconciliationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes reconciliation of rows that resolve to the same phone key, across concurrent webhook calls.
 */
@Component
public class PhoneLockRegistry {

    private static final Logger log = LoggerFactory.getLogger(PhoneLockRegistry.class);

    private final Map<String, PhoneLock> locks = new ConcurrentHashMap<>();
    private final long timeoutSeconds;

    public PhoneLockRegistry(@Value("${crm.reconciliation.lock-timeout-seconds:30}") long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public <T> T withLock(String phoneKey, Supplier<T> work) {
        PhoneLock entry = retain(phoneKey);
        try {
            boolean acquired;
            try {
                acquired = entry.lock.tryLock(timeoutSeconds, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ReconciliationException(ErrorKind.CONCURRENT_UPDATE_CONFLICT,
                        "Interrupted while waiting for phone " + phoneKey, e);
            }
            if (!acquired) {
                log.warn("Timed out after {}s waiting for lock on phone {}", timeoutSeconds, phoneKey);
                throw new ReconciliationException(ErrorKind.CONCURRENT_UPDATE_CONFLICT,
                        "Another update for phone " + phoneKey + " is still running");
            }
            try {
                return work.get();
            } finally {
                entry.lock.unlock();
            }
        } finally {
            release(phoneKey);
        }
    }

    int size() {
        return locks.size();
    }

    // users is only read and written inside compute, under the map's per-key lock
    private PhoneLock retain(String phoneKey) {
        return locks.compute(phoneKey, (k, entry) -> {
            PhoneLock e = entry != null ? entry : new PhoneLock();
            e.users++;
            return e;
        });
    }

    private void release(String phoneKey) {
        locks.computeIfPresent(phoneKey, (k, entry) -> --entry.users == 0 ? null : entry);
    }

    private static final class PhoneLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
