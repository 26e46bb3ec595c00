package com.wordhub.gameservice.games.words.domain.rule;

import com.wordhub.gameservice.games.words.domain.constants.GameMessages;
import com.wordhub.gameservice.games.words.domain.exception.GameInvariantException;
import com.wordhub.gameservice.games.words.domain.model.Player;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 终局结算：每个非空牌架扣掉牌面分之和，唯一出完牌的玩家（若有）得到全部扣分。
 * 恰有一名玩家出完牌时各玩家分值变化之和为 0；无人出完牌时每人只扣自己的牌面分，总和不为正。
 */
public final class EndGameScorer {

    private EndGameScorer() {}

    /**
     * 只计算，不修改玩家。多于一名空手玩家时抛出 GameInvariantException。
     */
    public static Map<String, Integer> computeDeltas(List<Player> players) {
        Map<String, Integer> deltas = new LinkedHashMap<>();
        String emptyKey = null;
        int pointsRemaining = 0;
        for (Player p : players) {
            if (p.getRack().isEmpty()) {
                if (emptyKey != null) {
                    throw new GameInvariantException(String.format(GameMessages.MULTIPLE_EMPTY_RACKS,
                            emptyKey + "," + p.getKey()));
                }
                emptyKey = p.getKey();
                deltas.put(p.getKey(), 0);
            } else {
                int rackScore = p.getRack().score();
                deltas.put(p.getKey(), -rackScore);
                pointsRemaining += rackScore;
            }
        }
        if (emptyKey != null) {
            deltas.put(emptyKey, pointsRemaining);
        }
        return deltas;
    }

    public static void apply(List<Player> players, Map<String, Integer> deltas) {
        for (Player p : players) {
            p.setScore(p.getScore() + deltas.getOrDefault(p.getKey(), 0));
        }
    }
}
