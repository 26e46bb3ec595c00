package com.wordhub.gameservice.platform.ws;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.stereotype.Component;

/**
 * STOMP CONNECT 阶段从 header（playerKey / gameKey）取出玩家身份并设置到会话上。
 * 没带 playerKey 的连接只能旁观（订阅 /topic），收不到私有消息。
 */
@Slf4j
@Component
public class PlayerChannelInterceptor implements ChannelInterceptor {

    public static final String PLAYER_HEADER = "playerKey";
    public static final String GAME_HEADER = "gameKey";

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null || !StompCommand.CONNECT.equals(accessor.getCommand())) {
            return message;
        }
        String playerKey = accessor.getFirstNativeHeader(PLAYER_HEADER);
        String gameKey = accessor.getFirstNativeHeader(GAME_HEADER);
        if (StringUtils.isNotBlank(playerKey)) {
            accessor.setUser(new PlayerPrincipal(playerKey.trim(), StringUtils.trimToNull(gameKey)));
        } else {
            log.debug("连接未携带 playerKey，session={}", accessor.getSessionId());
        }
        return message;
    }
}
