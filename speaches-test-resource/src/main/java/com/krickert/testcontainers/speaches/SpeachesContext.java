package com.krickert.testcontainers.speaches;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns the Speaches instance registered under each label and the lock that serialises work
 * on it. Production code shares {@link #shared()}; tests create their own context.
 */
public class SpeachesContext {

    private static final SpeachesContext SHARED = new SpeachesContext();

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ServiceInstance> instances = new ConcurrentHashMap<>();

    public static SpeachesContext shared() {
        return SHARED;
    }

    /**
     * Runs the action while holding the label's lock. The lock is re-entrant, so nested calls
     * for the same label from the same thread do not block.
     */
    public <T> T withLock(String label, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(label, key -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public Optional<ServiceInstance> getInstance(String label) {
        return Optional.ofNullable(instances.get(label));
    }

    void register(ServiceInstance instance) {
        instances.put(instance.getLabel(), instance);
    }

    void remove(String label) {
        instances.remove(label);
    }
}
