package com.wordhub.gameservice.games.words.infrastructure.redis;

/**
 * 统一管理文字游戏的 Redis Key。
 */
public final class RedisKeys {

    private static final String PFX = "words:";

    private RedisKeys() {}

    /** 整局 JSON 文档 */
    public static String game(String gameKey) {
        return PFX + "game:" + gameKey;
    }

    /** 对局索引（ZSET，score = 创建时间） */
    public static String gameIndex() {
        return PFX + "game:index";
    }
}
