package com.wordhub.gameservice.games.words.interfaces.ws;

import com.wordhub.gameservice.games.words.domain.port.GameNotifier;
import com.wordhub.gameservice.games.words.interfaces.ws.dto.WordGameMessages.BroadcastEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * 通过 STOMP 推送对局事件：
 *   - 全体：/topic/game.{gameKey}
 *   - 单人：/user/{playerKey}/queue/words.message
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompGameNotifier implements GameNotifier {

    public static final String USER_QUEUE = "/queue/words.message";

    private final SimpMessagingTemplate messaging;

    public static String topic(String gameKey) {
        return "/topic/game." + gameKey;
    }

    @Override
    public void notifyOne(String gameKey, String playerKey, String event, Object payload) {
        try {
            messaging.convertAndSendToUser(playerKey, USER_QUEUE, new BroadcastEvent(gameKey, event, payload));
        } catch (MessagingException e) {
            log.warn("[{}] 推送 {} 给玩家 {} 失败: {}", gameKey, event, playerKey, e.getMessage());
        }
    }

    @Override
    public void notifyAll(String gameKey, String event, Object payload) {
        try {
            messaging.convertAndSend(topic(gameKey), new BroadcastEvent(gameKey, event, payload));
        } catch (MessagingException e) {
            log.warn("[{}] 广播 {} 失败: {}", gameKey, event, e.getMessage());
        }
    }
}
