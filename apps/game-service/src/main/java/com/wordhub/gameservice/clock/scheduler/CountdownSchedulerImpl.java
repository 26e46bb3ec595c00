package com.wordhub.gameservice.clock.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;

import java.io.Serializable;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * CountdownSchedulerImpl
 * ---------------------------------------
 * 通用倒计时调度引擎的默认实现。
 *
 * 职责：
 *  - 使用 ScheduledThreadPoolExecutor 每秒调度一次；
 *  - 将倒计时状态（key/owner/version/deadline）写入 Redis，重启后可恢复；
 *  - Redis SETNX holder 锁保证多节点下只有一个节点做超时回调；
 *  - 本节点内存里保留运行中的状态，stop 时据此算出剩余时间。
 *
 * 不做任何业务逻辑（广播、判定）。
 */
public class CountdownSchedulerImpl implements CountdownScheduler {

    private static final Logger log = LoggerFactory.getLogger(CountdownSchedulerImpl.class);

    private static final Duration STATE_TTL = Duration.ofHours(24);
    private static final Duration HOLDER_TTL = Duration.ofSeconds(10);

    private final RedisTemplate<String, Object> redis;
    private final ScheduledThreadPoolExecutor scheduler;

    // 本节点标识，用于 holder 锁
    @Value("${instance.id:${spring.application.name:game-service}-${random.value}}")
    private String nodeId = "local";

    private volatile TickListener tickListener;

    // key -> 运行中的倒计时
    private final ConcurrentMap<String, Active> active = new ConcurrentHashMap<>();

    public CountdownSchedulerImpl(RedisTemplate<String, Object> redis,
                                  ScheduledThreadPoolExecutor scheduler) {
        this.redis = redis;
        this.scheduler = scheduler;
    }

    @Override
    public void setTickListener(TickListener listener) {
        this.tickListener = listener;
    }

    /**
     * 启动或续上倒计时；若已到期则直接尝试触发超时，不再调度。
     */
    @Override
    public void startOrResume(String key, String owner, long deadlineEpochMs, long version, TimeoutHandler onTimeout) {
        // 同一 key 只保留一个任务
        stop(key);
        CountdownState state = new CountdownState(key, owner, version, deadlineEpochMs);
        saveState(state);
        if (state.deadlineEpochMs - System.currentTimeMillis() <= 0) {
            if (tryAcquireHolder(key)) {
                clearState(key);
                safeTimeout(onTimeout, state);
            }
            return;
        }
        schedule(state, onTimeout);
    }

    /**
     * 取消本节点任务并清理 Redis 中的状态与 holder 锁。
     */
    @Override
    public long stop(String key) {
        long now = System.currentTimeMillis();
        Active a = active.remove(key);
        long remainingMs = 0;
        if (a != null) {
            a.future.cancel(false);
            remainingMs = a.state.deadlineEpochMs - now;
        } else {
            CountdownState persisted = loadState(key);
            if (persisted != null) remainingMs = persisted.deadlineEpochMs - now;
        }
        clearState(key);
        return Math.max(0, remainingMs);
    }

    @Override
    public int restoreAllActive(TimeoutHandler onTimeout) {
        Set<String> keys;
        try {
            keys = redis.keys(stateKey("*"));
        } catch (RuntimeException e) {
            log.warn("Countdown restore skipped, redis unavailable: {}", e.getMessage());
            return 0;
        }
        if (keys == null || keys.isEmpty()) return 0;
        int restored = 0;
        int expiredHandled = 0;
        for (String redisKey : keys) {
            Object raw = redis.opsForValue().get(redisKey);
            if (!(raw instanceof CountdownState st)) continue;
            if (st.deadlineEpochMs - System.currentTimeMillis() <= 0) {
                redis.delete(redisKey);
                if (tryAcquireHolder(st.key)) {
                    safeTimeout(onTimeout, st);
                    expiredHandled++;
                }
                continue;
            }
            schedule(st, onTimeout);
            restored++;
        }
        log.info("Countdown restoreAllActive done: restored={}, expiredHandled={}", restored, expiredHandled);
        return restored;
    }

    private void schedule(CountdownState state, TimeoutHandler onTimeout) {
        // 立即首帧 TICK
        fireTick(state);
        ScheduledFuture<?> fut = scheduler.scheduleAtFixedRate(
                () -> tickTask(state, onTimeout), 1, 1, TimeUnit.SECONDS);
        active.put(state.key, new Active(state, fut));
    }

    /**
     * 周期任务：到期则抢 holder 并回调超时，否则发一帧 TICK。
     */
    private void tickTask(CountdownState state, TimeoutHandler onTimeout) {
        Active current = active.get(state.key);
        // 已被停掉或被新一轮替换
        if (current == null || current.state != state) return;
        if (state.deadlineEpochMs - System.currentTimeMillis() <= 0) {
            if (active.remove(state.key, current)) {
                current.future.cancel(false);
                if (tryAcquireHolder(state.key)) {
                    clearState(state.key);
                    safeTimeout(onTimeout, state);
                }
            }
            return;
        }
        fireTick(state);
    }

    private void fireTick(CountdownState state) {
        TickListener l = tickListener;
        if (l == null) return;
        long left = Math.max(0, (state.deadlineEpochMs - System.currentTimeMillis()) / 1000);
        try {
            l.onTick(state.key, state.owner, state.deadlineEpochMs, left);
        } catch (RuntimeException e) {
            log.warn("Countdown tick listener failed, key={}: {}", state.key, e.getMessage());
        }
    }

    private void safeTimeout(TimeoutHandler onTimeout, CountdownState state) {
        if (onTimeout == null) return;
        try {
            onTimeout.onTimeout(state.key, state.owner, state.version);
        } catch (RuntimeException e) {
            log.error("Countdown timeout handler failed, key={}, owner={}", state.key, state.owner, e);
        }
    }

    /**
     * SETNX holder 锁（10s 过期），true 表示本节点获得执行权。
     * Redis 不可用时按单节点处理。
     */
    private boolean tryAcquireHolder(String key) {
        try {
            Boolean ok = redis.opsForValue().setIfAbsent(holderKey(key), nodeId, HOLDER_TTL);
            return Boolean.TRUE.equals(ok);
        } catch (RuntimeException e) {
            log.warn("Countdown holder lock unavailable, key={}: {}", key, e.getMessage());
            return true;
        }
    }

    private void saveState(CountdownState st) {
        try {
            redis.opsForValue().set(stateKey(st.key), st, STATE_TTL);
        } catch (RuntimeException e) {
            log.warn("Countdown state not persisted, key={}: {}", st.key, e.getMessage());
        }
    }

    private CountdownState loadState(String key) {
        try {
            Object raw = redis.opsForValue().get(stateKey(key));
            return raw instanceof CountdownState st ? st : null;
        } catch (RuntimeException e) {
            log.warn("Countdown state not readable, key={}: {}", key, e.getMessage());
            return null;
        }
    }

    private void clearState(String key) {
        try {
            redis.delete(stateKey(key));
            redis.delete(holderKey(key));
        } catch (RuntimeException e) {
            log.warn("Countdown state not cleared, key={}: {}", key, e.getMessage());
        }
    }

    private String stateKey(String key) { return "countdown:" + key; }

    private String holderKey(String key) { return "countdown:holder:" + key; }

    private record Active(CountdownState state, ScheduledFuture<?> future) {}

    /**
     * 倒计时状态（写入 Redis）。
     */
    public static class CountdownState implements Serializable {
        public String key;
        // 被计时的玩家 key
        public String owner;
        // 对局 clockVersion
        public long version;
        public long deadlineEpochMs;

        public CountdownState() {}

        public CountdownState(String key, String owner, long version, long deadlineEpochMs) {
            this.key = key; this.owner = owner; this.version = version; this.deadlineEpochMs = deadlineEpochMs;
        }
    }
}
