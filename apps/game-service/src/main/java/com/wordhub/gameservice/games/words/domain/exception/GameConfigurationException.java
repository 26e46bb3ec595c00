package com.wordhub.gameservice.games.words.domain.exception;

/**
 * 配置或请求内容不合法：缺少版本、人数已满、袋中牌不足、走子/换牌格式错误。
 * 对应 HTTP 400。
 */
public class GameConfigurationException extends IllegalArgumentException {

    public GameConfigurationException(String message) {
        super(message);
    }
}
