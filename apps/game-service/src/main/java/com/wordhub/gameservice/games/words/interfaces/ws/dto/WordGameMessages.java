package com.wordhub.gameservice.games.words.interfaces.ws.dto;

import com.wordhub.gameservice.games.words.domain.model.Placement;
import com.wordhub.gameservice.games.words.domain.model.Tile;
import com.wordhub.gameservice.games.words.domain.model.WordPlay;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * WebSocket 消息对象
 * ----------------------------------------
 *   1. 客户端 → 服务端：/app/words.* 指令（GameCmd / MoveCmd / SwapCmd）
 *   2. 服务端 → 客户端：/topic/game.{gameKey} 与 /user/queue/words.message 上的 BroadcastEvent
 *
 * 玩家身份取自连接上的 principal；未带身份时退回到指令里的 playerKey。
 */
public class WordGameMessages {

    /**
     * 无参数指令：pass、challenge、takeBack、pause、hint、advice、confirmGameOver、anotherGame。
     */
    @Data
    public static class GameCmd {
        private String gameKey;
        private String playerKey;
    }

    /**
     * 走子指令。score 与 words 由客户端计算。
     */
    @Data
    public static class MoveCmd {
        private String gameKey;
        private String playerKey;
        private List<Placement> placements = new ArrayList<>();
        private List<WordPlay> words = new ArrayList<>();
        private int score;
    }

    /**
     * 换牌指令，tiles 可以为空（等同于跳过）。
     */
    @Data
    public static class SwapCmd {
        private String gameKey;
        private String playerKey;
        private List<Tile> tiles = new ArrayList<>();
    }

    /**
     * 广播事件（服务端 → 客户端）。
     * type 取值见 GameEvents：turn / gameOverConfirmed / message / tick / connections ...
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BroadcastEvent {
        private String gameKey;
        private String type;
        private Object payload;
    }
}
