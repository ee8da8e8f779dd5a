package com.solospot.rating.util;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 按 key（spotId）分配的互斥锁。
 * 同一 key 的任务串行执行，不同 key 之间完全并行。
 * 锁带引用计数，没有线程持有或等待时从表中移除，表大小只与活跃地点数相关。
 */
@Component
public class SpotLockRegistry {

    private final ConcurrentHashMap<String, KeyedLock> locks = new ConcurrentHashMap<>();

    /**
     * 持有 key 对应的锁执行 action，可重入
     */
    public <T> T withLock(String key, Supplier<T> action) {
        KeyedLock keyed = acquire(key);
        keyed.lock.lock();
        try {
            return action.get();
        } finally {
            keyed.lock.unlock();
            release(key);
        }
    }

    public void withLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    /**
     * 当前表中的 key 数（持有或等待中）
     */
    public int activeKeyCount() {
        return locks.size();
    }

    private KeyedLock acquire(String key) {
        // compute 对同一 key 原子执行，引用计数只在其中修改
        return locks.compute(key, (k, existing) -> {
            KeyedLock keyed = existing != null ? existing : new KeyedLock();
            keyed.refs++;
            return keyed;
        });
    }

    private void release(String key) {
        locks.computeIfPresent(key, (k, keyed) -> --keyed.refs == 0 ? null : keyed);
    }

    private static final class KeyedLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int refs;
    }
}
