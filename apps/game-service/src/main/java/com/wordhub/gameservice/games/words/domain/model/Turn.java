package com.wordhub.gameservice.games.words.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.wordhub.gameservice.games.words.domain.enums.GameStatus;
import com.wordhub.gameservice.games.words.domain.enums.TurnType;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 回合日志中的一条不可变记录。只追加，不修改。
 * timestamp 由收尾步骤在落库前打上（见 {@link #withTimestamp(long)}）。
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Turn {

    String gameKey;
    TurnType type;
    /** 仅 game-ended：终局原因 */
    GameStatus endState;
    /** 行动玩家 */
    String playerKey;
    /** 下一位行动的玩家 */
    String nextToGoKey;
    /** 撤回记录中的质疑者 */
    String challengerKey;
    int score;
    /** 仅 game-ended：每位玩家的分值变化 */
    Map<String, Integer> scoreDeltas;
    List<Placement> placements;
    List<Tile> replacements;
    List<WordPlay> words;
    @With
    long timestamp;

    /**
     * 拷贝一份放置列表，防止后续牌面变化影响日志。
     */
    public static List<Placement> copyPlacements(List<Placement> placements) {
        if (placements == null) return null;
        List<Placement> out = new ArrayList<>(placements.size());
        placements.forEach(p -> out.add(p.copy()));
        return List.copyOf(out);
    }

    public static List<Tile> copyTiles(List<Tile> tiles) {
        if (tiles == null) return null;
        List<Tile> out = new ArrayList<>(tiles.size());
        tiles.forEach(t -> out.add(t.copy()));
        return List.copyOf(out);
    }

    public static List<WordPlay> copyWords(List<WordPlay> words) {
        if (words == null) return null;
        List<WordPlay> out = new ArrayList<>(words.size());
        words.forEach(w -> out.add(new WordPlay(w.getWord(), w.getScore())));
        return List.copyOf(out);
    }
}
