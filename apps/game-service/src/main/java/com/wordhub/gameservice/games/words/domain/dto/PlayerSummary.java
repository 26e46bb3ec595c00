package com.wordhub.gameservice.games.words.domain.dto;

import com.wordhub.gameservice.games.words.domain.model.Player;

/**
 * 玩家摘要（不含牌架内容）。
 */
public record PlayerSummary(String key,
                            String name,
                            boolean robot,
                            int score,
                            int passes,
                            int rackSize,
                            boolean wantsAdvice,
                            boolean connected) {

    public static PlayerSummary from(Player p, boolean connected) {
        return new PlayerSummary(p.getKey(), p.getName(), p.isRobot(), p.getScore(), p.getPasses(),
                p.getRack().size(), p.isWantsAdvice(), connected);
    }
}
