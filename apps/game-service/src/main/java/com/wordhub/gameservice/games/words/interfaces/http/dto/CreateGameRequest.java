package com.wordhub.gameservice.games.words.interfaces.http.dto;

import com.wordhub.gameservice.games.words.domain.enums.SwapPassPolicy;
import com.wordhub.gameservice.games.words.domain.model.GameConfig;
import lombok.Data;

/**
 * 建局参数。secondsPerPlay 优先；只给 minutesPerPlay 时换算成秒。
 */
@Data
public class CreateGameRequest {
    private String edition;
    private String dictionary;
    private Integer secondsPerPlay;
    private Integer minutesPerPlay;
    private Integer minPlayers;
    private Integer maxPlayers;
    private boolean predictScore;
    private boolean allowTakeBack;
    private boolean checkDictionary;
    private SwapPassPolicy swapPassPolicy;

    public GameConfig toConfig() {
        int seconds = 0;
        if (secondsPerPlay != null) {
            seconds = secondsPerPlay;
        } else if (minutesPerPlay != null) {
            seconds = minutesPerPlay * 60;
        }
        return GameConfig.builder()
                .edition(edition)
                .dictionary(dictionary)
                .secondsPerPlay(seconds)
                .minPlayers(minPlayers == null ? GameConfig.DEFAULT_MIN_PLAYERS : minPlayers)
                .maxPlayers(maxPlayers == null ? 0 : maxPlayers)
                .predictScore(predictScore)
                .allowTakeBack(allowTakeBack)
                .checkDictionary(checkDictionary)
                .swapPassPolicy(swapPassPolicy)
                .build();
    }
}
