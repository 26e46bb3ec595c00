package com.wordhub.gameservice.games.words.application;

import com.wordhub.gameservice.games.words.service.WordGameService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定期扫描全部对局，把长时间无活动的判为超时结束。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleGameSweeper {

    private final WordGameService gameService;

    @Scheduled(fixedDelayString = "${words.game.sweep-interval-ms:3600000}",
            initialDelayString = "${words.game.sweep-initial-delay-ms:60000}")
    public void sweep() {
        int timedOut = 0;
        for (String gameKey : gameService.allGameKeys()) {
            try {
                if (gameService.checkTimeout(gameKey)) {
                    timedOut++;
                }
            } catch (RuntimeException e) {
                log.warn("检查对局 {} 超时失败: {}", gameKey, e.getMessage());
            }
        }
        if (timedOut > 0) {
            log.info("超时扫描完成：{} 局判为超时", timedOut);
        }
    }
}
