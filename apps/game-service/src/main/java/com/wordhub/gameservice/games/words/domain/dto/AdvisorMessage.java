package com.wordhub.gameservice.games.words.domain.dto;

import com.wordhub.gameservice.games.words.domain.constants.GameMessages;

/**
 * 发给单个玩家或全体的文本消息（建议、提示、词典校验结果）。
 */
public record AdvisorMessage(String sender, String text) {

    public static AdvisorMessage advisor(String text) {
        return new AdvisorMessage(GameMessages.ADVISOR, text);
    }
}
