package com.wordhub.gameservice.games.words.domain.port;

/**
 * 推送事件名。
 */
public final class GameEvents {

    private GameEvents() {}

    public static final String TURN = "turn";
    public static final String GAME_OVER_CONFIRMED = "gameOverConfirmed";
    public static final String MESSAGE = "message";
    public static final String PAUSE = "pause";
    public static final String UNPAUSE = "unpause";
    public static final String NEXT_GAME = "nextGame";
    public static final String TICK = "tick";
    public static final String CONNECTIONS = "connections";
    public static final String STARTED = "started";
    public static final String JOINED = "joined";
    public static final String LEFT = "left";
    public static final String ERROR = "ERROR";
}
