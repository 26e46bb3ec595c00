package com.wordhub.gameservice.platform.ws;

import com.wordhub.gameservice.games.words.domain.port.GameEvents;
import com.wordhub.gameservice.games.words.domain.port.GameNotifier;
import com.wordhub.gameservice.games.words.domain.port.PlayerPresence;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 记录每个 STOMP 会话连在哪一局、哪位玩家上；连接变化时向该局广播在线名单。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GameConnectionRegistry implements PlayerPresence {

    /** sessionId -> 连接信息 */
    private final Map<String, Connection> sessions = new ConcurrentHashMap<>();

    private final GameNotifier notifier;

    record Connection(String gameKey, String playerKey) {}

    @EventListener
    public void handleSessionConnect(SessionConnectEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        String sessionId = accessor.getSessionId();
        String gameKey = StringUtils.trimToNull(accessor.getFirstNativeHeader(PlayerChannelInterceptor.GAME_HEADER));
        String playerKey = StringUtils.trimToNull(accessor.getFirstNativeHeader(PlayerChannelInterceptor.PLAYER_HEADER));
        if (sessionId == null || gameKey == null || playerKey == null) {
            return;
        }
        connected(sessionId, gameKey, playerKey);
    }

    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        disconnected(event.getSessionId());
    }

    void connected(String sessionId, String gameKey, String playerKey) {
        sessions.put(sessionId, new Connection(gameKey, playerKey));
        log.info("玩家 {} 连接到对局 {}（session={}）", playerKey, gameKey, sessionId);
        broadcast(gameKey);
    }

    void disconnected(String sessionId) {
        if (sessionId == null) return;
        Connection gone = sessions.remove(sessionId);
        if (gone != null) {
            log.info("玩家 {} 断开对局 {}（session={}）", gone.playerKey(), gone.gameKey(), sessionId);
            broadcast(gone.gameKey());
        }
    }

    @Override
    public Set<String> connectedPlayers(String gameKey) {
        return sessions.values().stream()
                .filter(c -> c.gameKey().equals(gameKey))
                .map(Connection::playerKey)
                .collect(Collectors.toUnmodifiableSet());
    }

    private void broadcast(String gameKey) {
        notifier.notifyAll(gameKey, GameEvents.CONNECTIONS, connectedPlayers(gameKey));
    }
}
