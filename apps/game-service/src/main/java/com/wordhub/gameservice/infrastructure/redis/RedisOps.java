package com.wordhub.gameservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * 公用 Redis 工具类：
 * - 只提供“原语级”方法（String / Key / ZSET）；
 * - 业务键名放在 RedisKeys，序列化放在 Repo 层。
 */
@Component
@RequiredArgsConstructor
public class RedisOps {

    private final StringRedisTemplate strRedis;

    // -------------- String --------------

    /**
     * 写入字符串（带 TTL）
     */
    public void setString(String key, String val, Duration ttl) {
        strRedis.opsForValue().set(key, val, ttl);
    }

    public String getString(String key) {
        return strRedis.opsForValue().get(key);
    }

    // -------------- Key --------------

    public Long del(String... keys) {
        return strRedis.delete(Arrays.asList(keys));
    }

    public boolean exists(String key) {
        return Boolean.TRUE.equals(strRedis.hasKey(key));
    }

    // -------------- ZSET --------------

    public void zAdd(String key, String member, double score) {
        strRedis.opsForZSet().add(key, member, score);
    }

    public void zRem(String key, String... members) {
        strRedis.opsForZSet().remove(key, (Object[]) members);
    }

    /**
     * 按分值倒序，取 score <= max 的前 limit 个成员
     */
    public List<String> zRevRangeByScore(String key, double max, int limit) {
        Set<String> raw = strRedis.opsForZSet().reverseRangeByScore(key, Double.NEGATIVE_INFINITY, max, 0, limit);
        return raw == null ? List.of() : new ArrayList<>(raw);
    }

    public List<String> zRangeAll(String key) {
        Set<String> raw = strRedis.opsForZSet().range(key, 0, -1);
        return raw == null ? List.of() : new ArrayList<>(raw);
    }
}
