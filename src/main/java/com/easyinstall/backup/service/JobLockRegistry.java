package com.easyinstall.backup.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes backup attempts that target the same job. Ad-hoc attempts
 * (no job id) run unguarded. A job's lock is dropped once no attempt holds
 * or waits for it.
 */
@Component
public class JobLockRegistry {

    private final ConcurrentMap<Long, JobLock> locks = new ConcurrentHashMap<>();

    public <T> T withJobLock(Long jobId, Supplier<T> action) {
        if (jobId == null) {
            return action.get();
        }
        JobLock jobLock = locks.compute(jobId, (id, existing) -> {
            JobLock held = existing == null ? new JobLock() : existing;
            held.users++;
            return held;
        });
        jobLock.lock.lock();
        try {
            return action.get();
        } finally {
            jobLock.lock.unlock();
            locks.computeIfPresent(jobId, (id, held) -> --held.users == 0 ? null : held);
        }
    }

    boolean isLocked(Long jobId) {
        JobLock jobLock = locks.get(jobId);
        return jobLock != null && jobLock.lock.isLocked();
    }

    int size() {
        return locks.size();
    }

    // users is only read and written inside ConcurrentHashMap compute calls
    private static final class JobLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
