package com.wordhub.gameservice.games.words.application;

import com.wordhub.gameservice.clock.scheduler.CountdownScheduler;
import com.wordhub.gameservice.games.words.domain.port.GameEvents;
import com.wordhub.gameservice.games.words.domain.port.GameNotifier;
import com.wordhub.gameservice.games.words.domain.port.TurnClock;
import com.wordhub.gameservice.games.words.service.WordGameService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Lazy;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * TurnClockCoordinator
 * -------------------------------------------------
 * 把通用倒计时引擎接到文字游戏上：
 * 1) 启动时注册 tick 监听（转成对局内的 tick 推送），并恢复 Redis 中未到期的倒计时；
 * 2) 作为 {@link TurnClock} 供回合引擎启动/停止本局计时；
 * 3) 到期回调交给服务层，由服务层判断回调是否已过期。
 */
@Slf4j
@Component
public class TurnClockCoordinator implements TurnClock {

    private static final String KEY_PREFIX = "words:";

    private final CountdownScheduler scheduler;
    private final GameNotifier notifier;
    private final WordGameService gameService;

    public TurnClockCoordinator(CountdownScheduler scheduler,
                                GameNotifier notifier,
                                @Lazy WordGameService gameService) {
        this.scheduler = scheduler;
        this.notifier = notifier;
        this.gameService = gameService;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        scheduler.setTickListener((key, owner, deadlineMs, left) ->
                notifier.notifyAll(gameKeyOf(key), GameEvents.TICK, Map.of(
                        "playerKey", owner,
                        "left", (int) left,
                        "deadlineEpochMs", deadlineMs)));
        int restored = scheduler.restoreAllActive(this::handleTimeout);
        log.info("回合计时协调器就绪，恢复倒计时 {} 个", restored);
    }

    @Override
    public void start(String gameKey, String playerKey, int seconds, long version) {
        long deadline = System.currentTimeMillis() + seconds * 1000L;
        scheduler.startOrResume(key(gameKey), playerKey, deadline, version, this::handleTimeout);
    }

    @Override
    public int stop(String gameKey) {
        long leftMs = scheduler.stop(key(gameKey));
        return leftMs <= 0 ? 0 : (int) ((leftMs + 999) / 1000);
    }

    void handleTimeout(String key, String owner, long version) {
        String gameKey = gameKeyOf(key);
        try {
            gameService.onTurnTimeout(gameKey, owner, version);
        } catch (RuntimeException e) {
            log.error("[{}] 处理回合超时失败 owner={}", gameKey, owner, e);
        }
    }

    private static String key(String gameKey) { return KEY_PREFIX + gameKey; }

    private static String gameKeyOf(String key) {
        return key.startsWith(KEY_PREFIX) ? key.substring(KEY_PREFIX.length()) : key;
    }
}
