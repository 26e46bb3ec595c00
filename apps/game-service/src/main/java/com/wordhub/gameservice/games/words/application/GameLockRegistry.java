package com.wordhub.gameservice.games.words.application;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 每局一把可重入锁：同一局的请求、超时回调、机器人回合串行执行。
 * 对局结束或过期后由 {@link #forget} 释放锁对象。
 */
@Component
public class GameLockRegistry {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String gameKey, Supplier<T> action) {
        ReentrantLock lock;
        while (true) {
            lock = locks.computeIfAbsent(gameKey, k -> new ReentrantLock());
            lock.lock();
            // 拿锁期间锁对象可能已被 forget 换掉，换掉了就重来
            if (locks.get(gameKey) == lock) {
                break;
            }
            lock.unlock();
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String gameKey, Runnable action) {
        withLock(gameKey, () -> {
            action.run();
            return null;
        });
    }

    /** 释放锁对象；仍有线程持有或排队时保留 */
    public void forget(String gameKey) {
        locks.computeIfPresent(gameKey, (k, lock) -> lock.isLocked() || lock.hasQueuedThreads() ? lock : null);
    }

    public boolean isTracked(String gameKey) {
        return locks.containsKey(gameKey);
    }
}
