package com.wordhub.gameservice.games.words.domain.exception;

import com.wordhub.gameservice.games.words.domain.constants.GameMessages;
import lombok.Getter;

/**
 * 换牌数量超过袋中剩余牌数。
 */
@Getter
public class InsufficientTilesException extends GameConfigurationException {

    private final int requested;
    private final int available;

    public InsufficientTilesException(int requested, int available) {
        super(GameMessages.formatInsufficientTiles(requested, available));
        this.requested = requested;
        this.available = available;
    }
}
