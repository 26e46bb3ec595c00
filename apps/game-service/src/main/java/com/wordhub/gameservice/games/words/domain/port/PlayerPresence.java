package com.wordhub.gameservice.games.words.domain.port;

import java.util.Set;

/**
 * 当前连接在某局上的玩家。
 */
public interface PlayerPresence {

    Set<String> connectedPlayers(String gameKey);
}
