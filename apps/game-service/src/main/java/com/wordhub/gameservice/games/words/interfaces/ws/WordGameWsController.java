package com.wordhub.gameservice.games.words.interfaces.ws;

import com.wordhub.gameservice.games.words.domain.model.Move;
import com.wordhub.gameservice.games.words.domain.port.GameEvents;
import com.wordhub.gameservice.games.words.domain.port.GameNotifier;
import com.wordhub.gameservice.games.words.interfaces.ws.dto.WordGameMessages.GameCmd;
import com.wordhub.gameservice.games.words.interfaces.ws.dto.WordGameMessages.MoveCmd;
import com.wordhub.gameservice.games.words.interfaces.ws.dto.WordGameMessages.SwapCmd;
import com.wordhub.gameservice.games.words.service.WordGameService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.security.Principal;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * 文字游戏 WebSocket 控制器
 * ----------------------------------------
 * 接收 /app/words.* 指令并交给服务层；结果由服务层统一广播（turn / gameOverConfirmed ...）。
 * 失败时向该局广播 ERROR 事件（带上发起者 playerKey）。
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class WordGameWsController {

    private final WordGameService gameService;
    private final GameNotifier notifier;

    @MessageMapping("/words.move")
    public void move(MoveCmd cmd, SimpMessageHeaderAccessor sha) {
        run(cmd.getGameKey(), playerOf(sha, cmd.getPlayerKey()), (game, player) ->
                gameService.makeMove(game, player, new Move(cmd.getPlacements(), cmd.getScore(), cmd.getWords())));
    }

    @MessageMapping("/words.swap")
    public void swap(SwapCmd cmd, SimpMessageHeaderAccessor sha) {
        run(cmd.getGameKey(), playerOf(sha, cmd.getPlayerKey()),
                (game, player) -> gameService.swap(game, player, cmd.getTiles()));
    }

    @MessageMapping("/words.pass")
    public void pass(GameCmd cmd, SimpMessageHeaderAccessor sha) {
        run(cmd.getGameKey(), playerOf(sha, cmd.getPlayerKey()), gameService::pass);
    }

    @MessageMapping("/words.challenge")
    public void challenge(GameCmd cmd, SimpMessageHeaderAccessor sha) {
        run(cmd.getGameKey(), playerOf(sha, cmd.getPlayerKey()), gameService::challenge);
    }

    @MessageMapping("/words.takeBack")
    public void takeBack(GameCmd cmd, SimpMessageHeaderAccessor sha) {
        run(cmd.getGameKey(), playerOf(sha, cmd.getPlayerKey()), gameService::takeBack);
    }

    @MessageMapping("/words.confirmGameOver")
    public void confirmGameOver(GameCmd cmd, SimpMessageHeaderAccessor sha) {
        run(cmd.getGameKey(), playerOf(sha, cmd.getPlayerKey()), gameService::confirmGameOver);
    }

    @MessageMapping("/words.pause")
    public void pause(GameCmd cmd, SimpMessageHeaderAccessor sha) {
        run(cmd.getGameKey(), playerOf(sha, cmd.getPlayerKey()), gameService::togglePause);
    }

    @MessageMapping("/words.hint")
    public void hint(GameCmd cmd, SimpMessageHeaderAccessor sha) {
        run(cmd.getGameKey(), playerOf(sha, cmd.getPlayerKey()), gameService::hint);
    }

    @MessageMapping("/words.advice")
    public void advice(GameCmd cmd, SimpMessageHeaderAccessor sha) {
        run(cmd.getGameKey(), playerOf(sha, cmd.getPlayerKey()), gameService::toggleAdvice);
    }

    @MessageMapping("/words.anotherGame")
    public void anotherGame(GameCmd cmd, SimpMessageHeaderAccessor sha) {
        run(cmd.getGameKey(), playerOf(sha, cmd.getPlayerKey()), (game, player) -> gameService.anotherGame(game));
    }

    private void run(String gameKey, String playerKey, BiConsumer<String, String> action) {
        if (StringUtils.isAnyBlank(gameKey, playerKey)) {
            log.warn("丢弃缺少 gameKey/playerKey 的指令");
            return;
        }
        try {
            action.accept(gameKey, playerKey);
        } catch (RuntimeException e) {
            log.info("[{}] 玩家 {} 指令失败: {}", gameKey, playerKey, e.getMessage());
            notifier.notifyAll(gameKey, GameEvents.ERROR,
                    Map.of("playerKey", playerKey, "message", String.valueOf(e.getMessage())));
        }
    }

    private static String playerOf(SimpMessageHeaderAccessor sha, String fallback) {
        Principal user = sha.getUser();
        return user != null ? user.getName() : fallback;
    }
}
