package com.wordhub.gameservice.games.words.domain.repository;

import com.wordhub.gameservice.games.words.domain.model.Game;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 对局持久化：整局聚合一个文档，另有按创建时间排序的索引。
 */
public interface GameRepository {

    void save(Game game, Duration ttl);

    Optional<Game> get(String gameKey);

    void delete(String gameKey);

    /** 对局文档是否还在（未过期） */
    boolean exists(String gameKey);

    /**
     * 按创建时间倒序分页列出对局 key。
     * @param cursor 上一页最后一条的创建时间（毫秒），为 null 表示从最新开始
     */
    List<String> listKeys(Long cursor, int limit);

    /** 索引中全部对局 key（清理任务用） */
    List<String> allKeys();
}
