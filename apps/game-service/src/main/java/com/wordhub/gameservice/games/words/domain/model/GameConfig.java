package com.wordhub.gameservice.games.words.domain.model;

import com.wordhub.gameservice.games.words.domain.constants.GameMessages;
import com.wordhub.gameservice.games.words.domain.enums.SwapPassPolicy;
import com.wordhub.gameservice.games.words.domain.exception.GameConfigurationException;
import lombok.Builder;
import org.apache.commons.lang3.StringUtils;

/**
 * 建局参数（不可变）。构造时补齐默认值：
 * minPlayers 缺省为 2；maxPlayers 小于 minPlayers 时视为不限（0）；
 * secondsPerPlay 为 0 表示不限时；dictionary 为空或 "none" 表示不使用词典。
 */
@Builder(toBuilder = true)
public record GameConfig(String edition,
                         String dictionary,
                         int secondsPerPlay,
                         int minPlayers,
                         int maxPlayers,
                         boolean predictScore,
                         boolean allowTakeBack,
                         boolean checkDictionary,
                         SwapPassPolicy swapPassPolicy) {

    public static final int DEFAULT_MIN_PLAYERS = 2;

    public GameConfig {
        if (StringUtils.isBlank(edition)) {
            throw new GameConfigurationException(GameMessages.EDITION_REQUIRED);
        }
        if (StringUtils.isBlank(dictionary) || "none".equalsIgnoreCase(dictionary)) {
            dictionary = null;
        }
        if (secondsPerPlay < 0) secondsPerPlay = 0;
        if (minPlayers <= 0) minPlayers = DEFAULT_MIN_PLAYERS;
        if (maxPlayers < minPlayers) maxPlayers = 0;
        if (swapPassPolicy == null) swapPassPolicy = SwapPassPolicy.COUNT_ONLY;
    }

    /**
     * 从已有对局投影出同样的配置（开下一局时使用）。
     */
    public static GameConfig of(Game game) {
        return new GameConfig(
                game.getEdition(),
                game.getDictionary(),
                game.getSecondsPerPlay(),
                game.getMinPlayers(),
                game.getMaxPlayers(),
                game.isPredictScore(),
                game.isAllowTakeBack(),
                game.isCheckDictionary(),
                game.getSwapPassPolicy());
    }
}
