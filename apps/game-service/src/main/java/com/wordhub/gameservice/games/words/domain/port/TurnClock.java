package com.wordhub.gameservice.games.words.domain.port;

/**
 * 回合计时器（每局一个）。
 * 启动新计时总是先停掉旧的；到期回调必须携带 version，由上层判断是否过期。
 */
public interface TurnClock {

    /**
     * 为 playerKey 启动本回合倒计时。
     * @param version 对局当前的 clockVersion
     */
    void start(String gameKey, String playerKey, int seconds, long version);

    /**
     * 停止倒计时（幂等）。
     * @return 停止时剩余的整秒数；没有运行中的计时返回 0
     */
    int stop(String gameKey);
}
