package com.wordhub.gameservice.games.words.infrastructure.redis.repo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wordhub.gameservice.games.words.domain.model.Game;
import com.wordhub.gameservice.games.words.domain.repository.GameRepository;
import com.wordhub.gameservice.games.words.infrastructure.redis.RedisKeys;
import com.wordhub.gameservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 对局仓储的 Redis 实现：
 *  - words:game:{key}   → 整局 JSON（String，带 TTL）
 *  - words:game:index   → ZSET，member = gameKey，score = 创建时间
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RedisGameRepository implements GameRepository {

    private final RedisOps redisOps;
    private final ObjectMapper objectMapper;

    @Override
    public void save(Game game, Duration ttl) {
        String json;
        try {
            json = objectMapper.writeValueAsString(game);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("对局序列化失败: " + game.getKey(), e);
        }
        redisOps.setString(RedisKeys.game(game.getKey()), json, ttl);
        redisOps.zAdd(RedisKeys.gameIndex(), game.getKey(), game.getCreationTimestamp());
    }

    @Override
    public Optional<Game> get(String gameKey) {
        String json = redisOps.getString(RedisKeys.game(gameKey));
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, Game.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("对局反序列化失败: " + gameKey, e);
        }
    }

    @Override
    public void delete(String gameKey) {
        redisOps.del(RedisKeys.game(gameKey));
        redisOps.zRem(RedisKeys.gameIndex(), gameKey);
    }

    @Override
    public boolean exists(String gameKey) {
        return redisOps.exists(RedisKeys.game(gameKey));
    }

    @Override
    public List<String> listKeys(Long cursor, int limit) {
        double max = cursor == null ? Double.POSITIVE_INFINITY : cursor - 1;
        return redisOps.zRevRangeByScore(RedisKeys.gameIndex(), max, limit);
    }

    @Override
    public List<String> allKeys() {
        return redisOps.zRangeAll(RedisKeys.gameIndex());
    }
}
