package com.wordhub.gameservice.games.words.domain.dto;

import com.wordhub.gameservice.games.words.domain.enums.GameStatus;
import com.wordhub.gameservice.games.words.domain.model.Game;

import java.util.List;
import java.util.Set;

/**
 * 对局列表使用的精简视图。
 */
public record GameSummary(String key,
                          long creationTimestamp,
                          String edition,
                          String dictionary,
                          boolean predictScore,
                          boolean checkDictionary,
                          boolean allowTakeBack,
                          GameStatus state,
                          List<PlayerSummary> players,
                          int turnCount,
                          String currentPlayerKey,
                          int secondsPerPlay,
                          String pausedBy,
                          int minPlayers,
                          int maxPlayers,
                          String nextGameKey,
                          long lastActivity) {

    /**
     * @param connectedKeys 当前在线的玩家 key，用于标注 connected
     */
    public static GameSummary from(Game game, Set<String> connectedKeys) {
        List<PlayerSummary> players = game.getPlayers().stream()
                .map(p -> PlayerSummary.from(p, connectedKeys.contains(p.getKey())))
                .toList();
        return new GameSummary(
                game.getKey(),
                game.getCreationTimestamp(),
                game.getEdition(),
                game.getDictionary(),
                game.isPredictScore(),
                game.isCheckDictionary(),
                game.isAllowTakeBack(),
                game.getState(),
                players,
                game.getTurns().size(),
                game.getCurrentPlayerKey(),
                game.getSecondsPerPlay(),
                game.getPausedBy(),
                game.getMinPlayers(),
                game.getMaxPlayers(),
                game.getNextGameKey(),
                game.lastActivity());
    }
}
