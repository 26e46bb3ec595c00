package com.wordhub.gameservice.games.words.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 回合记录类型，对外使用短横线小写编码（move / passed / took-back ...）。
 */
public enum TurnType {
    MOVE("move"),
    PASSED("passed"),
    TIMEOUT("timeout"),
    SWAP("swap"),
    CHALLENGE_WON("challenge-won"),
    CHALLENGE_FAILED("challenge-failed"),
    TOOK_BACK("took-back"),
    GAME_ENDED("game-ended");

    private final String code;

    TurnType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static TurnType fromCode(String code) {
        for (TurnType t : values()) {
            if (t.code.equals(code) || t.name().equals(code)) {
                return t;
            }
        }
        throw new IllegalArgumentException("未知回合类型: " + code);
    }

    /** 可由 pass 入口产生的类型 */
    public boolean passLike() {
        return this == PASSED || this == TIMEOUT || this == CHALLENGE_FAILED;
    }
}
