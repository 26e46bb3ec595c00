package com.wordhub.gameservice.games.words.domain.port;

/**
 * 对局事件推送。发送失败只记录日志，不向调用方抛出。
 */
public interface GameNotifier {

    /** 推给单个玩家 */
    void notifyOne(String gameKey, String playerKey, String event, Object payload);

    /** 推给订阅该对局的所有人 */
    void notifyAll(String gameKey, String event, Object payload);
}
