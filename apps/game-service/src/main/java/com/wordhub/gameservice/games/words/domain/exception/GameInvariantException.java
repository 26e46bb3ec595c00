package com.wordhub.gameservice.games.words.domain.exception;

/**
 * 服务端内部不变量被破坏（多名玩家同时空手、未知玩家 key 等），属于程序缺陷。
 * 对应 HTTP 500，记录 error 日志。
 */
public class GameInvariantException extends IllegalStateException {

    public GameInvariantException(String message) {
        super(message);
    }
}
