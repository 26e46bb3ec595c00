package com.wordhub.gameservice.games.words.domain.enums;

/**
 * 换牌是否参与“所有人连续两次跳过”终局判定。
 */
public enum SwapPassPolicy {
    /** 换牌只累加 passes，不立即判终局（默认） */
    COUNT_ONLY,
    /** 换牌后立刻复核终局条件 */
    END_GAME
}
