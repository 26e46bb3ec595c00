package com.wordhub.gameservice.platform.ws;

import java.security.Principal;

/**
 * WebSocket 连接上的玩家身份。name 即 playerKey，供 /user 目的地路由使用。
 */
public record PlayerPrincipal(String playerKey, String gameKey) implements Principal {

    @Override
    public String getName() {
        return playerKey;
    }
}
