package com.wordhub.gameservice.games.words.service;

import com.wordhub.gameservice.games.words.domain.dto.GameSummary;
import com.wordhub.gameservice.games.words.domain.model.Game;
import com.wordhub.gameservice.games.words.domain.model.GameConfig;
import com.wordhub.gameservice.games.words.domain.model.Move;
import com.wordhub.gameservice.games.words.domain.model.Player;
import com.wordhub.gameservice.games.words.domain.model.Tile;
import com.wordhub.gameservice.games.words.domain.model.Turn;

import java.util.List;

/**
 * 文字游戏服务：每个入口都在该局的锁内执行，
 * 回合类操作结束后统一收尾（打时间戳、追加回合、落库、推送、交给机器人）。
 */
public interface WordGameService {

    // ---------------- 对局 ----------------

    /** 建局并返回 gameKey */
    String createGame(GameConfig config);

    /** 对局快照（锁内深拷贝），修改它不会影响进行中的对局 */
    Game getGame(String gameKey);

    GameSummary summary(String gameKey);

    /**
     * 按创建时间倒序分页。
     * @param cursor 上一页最后一条的创建时间，null 表示第一页
     */
    List<GameSummary> listGames(Long cursor, int limit);

    /** 入座（机器人或人类），返回新玩家 */
    Player addPlayer(String gameKey, String name, boolean robot, boolean canChallenge);

    void removePlayer(String gameKey, String playerKey);

    /**
     * 人数够了就开始：没有当前玩家则随机选一位，当前玩家已离开则交给第一位。
     * @return 对局是否已在进行且有当前玩家
     */
    boolean playIfReady(String gameKey);

    // ---------------- 回合 ----------------

    Turn makeMove(String gameKey, String playerKey, Move move);

    Turn pass(String gameKey, String playerKey);

    Turn swap(String gameKey, String playerKey, List<Tile> tiles);

    Turn challenge(String gameKey, String playerKey);

    /** 自愿悔棋（只能撤回自己的上一手） */
    Turn takeBack(String gameKey, String playerKey);

    /** 确认终局（例如上一手已出完牌） */
    Turn confirmGameOver(String gameKey, String playerKey);

    // ---------------- 其他 ----------------

    /** @return 切换后是否暂停 */
    boolean togglePause(String gameKey, String playerKey);

    void hint(String gameKey, String playerKey);

    /** @return 切换后是否开启建议 */
    boolean toggleAdvice(String gameKey, String playerKey);

    /** 用同样的配置和玩家再开一局，返回新 gameKey */
    String anotherGame(String gameKey);

    /** 回合计时到期回调（可能已过期） */
    void onTurnTimeout(String gameKey, String playerKey, long version);

    /** 长时间无活动则判为超时，返回是否发生变化 */
    boolean checkTimeout(String gameKey);

    /** 全部已索引的对局 key */
    List<String> allGameKeys();
}
