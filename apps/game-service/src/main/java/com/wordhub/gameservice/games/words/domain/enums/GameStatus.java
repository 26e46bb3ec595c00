package com.wordhub.gameservice.games.words.domain.enums;

/**
 * 对局生命周期状态：PLAYING 之外都是终局原因，进入后不可离开。
 */
public enum GameStatus {
    PLAYING("进行中"),
    /** 所有玩家都连续 pass 两次 */
    ALL_PASSED_TWICE("所有玩家均连续两次跳过"),
    /** 质疑失败且被质疑的一手没有补牌（对方已出完） */
    CHALLENGE_FAILED("质疑失败，对局结束"),
    /** 长时间无人操作 */
    TIMED_OUT("对局超时"),
    /** 显式确认结束 */
    GAME_OVER("对局结束");

    private final String label;

    GameStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean terminal() {
        return this != PLAYING;
    }
}
