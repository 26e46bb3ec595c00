package com.wordhub.gameservice.games.words.interfaces.http;

import com.wordhub.gameservice.games.words.domain.dto.GameSummary;
import com.wordhub.gameservice.games.words.domain.model.Game;
import com.wordhub.gameservice.games.words.domain.model.Player;
import com.wordhub.gameservice.games.words.domain.model.Turn;
import com.wordhub.gameservice.games.words.interfaces.http.dto.CreateGameRequest;
import com.wordhub.gameservice.games.words.interfaces.http.dto.GameListResponse;
import com.wordhub.gameservice.games.words.interfaces.http.dto.JoinRequest;
import com.wordhub.gameservice.games.words.interfaces.http.dto.MoveRequest;
import com.wordhub.gameservice.games.words.interfaces.http.dto.SwapRequest;
import com.wordhub.gameservice.games.words.service.WordGameService;
import com.wordhub.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 文字游戏 http 接口。
 * 回合类接口与 WebSocket 指令等价，结果同样会广播到 /topic/game.{gameKey}。
 */
@Slf4j
@RestController
@RequestMapping("/api/words")
@RequiredArgsConstructor
public class WordGameRestController {

    private static final int MAX_PAGE = 100;

    private final WordGameService svc;

    // ==================== 对局 ====================

    @PostMapping("/games")
    public ResponseEntity<ApiResponse<String>> create(@RequestBody CreateGameRequest req) {
        return ResponseEntity.ok(ApiResponse.success(svc.createGame(req.toConfig())));
    }

    /**
     * 按创建时间倒序分页列出对局。
     * @param cursor 上一页返回的 nextCursor，首页不传
     */
    @GetMapping("/games")
    public ResponseEntity<ApiResponse<GameListResponse>> list(@RequestParam(name = "cursor", required = false) Long cursor,
                                                              @RequestParam(name = "limit", defaultValue = "20") int limit) {
        int size = Math.max(1, Math.min(limit, MAX_PAGE));
        List<GameSummary> games = svc.listGames(cursor, size);
        return ResponseEntity.ok(ApiResponse.success(GameListResponse.of(games, size)));
    }

    /** 完整对局（含棋盘、牌袋、回合记录） */
    @GetMapping("/games/{gameKey}")
    public ResponseEntity<ApiResponse<Game>> get(@PathVariable String gameKey) {
        return ResponseEntity.ok(ApiResponse.success(svc.getGame(gameKey)));
    }

    @GetMapping("/games/{gameKey}/summary")
    public ResponseEntity<ApiResponse<GameSummary>> summary(@PathVariable String gameKey) {
        return ResponseEntity.ok(ApiResponse.success(svc.summary(gameKey)));
    }

    /**
     * 入座；人数达到下限后自动开局。
     */
    @PostMapping("/games/{gameKey}/players")
    public ResponseEntity<ApiResponse<Player>> join(@PathVariable String gameKey, @RequestBody JoinRequest req) {
        Player player = svc.addPlayer(gameKey, req.getName(), req.isRobot(), req.isCanChallenge());
        svc.playIfReady(gameKey);
        return ResponseEntity.ok(ApiResponse.success(player));
    }

    @DeleteMapping("/games/{gameKey}/players/{playerKey}")
    public ResponseEntity<ApiResponse<Void>> leave(@PathVariable String gameKey, @PathVariable String playerKey) {
        svc.removePlayer(gameKey, playerKey);
        return ResponseEntity.ok(ApiResponse.success());
    }

    // ==================== 回合 ====================

    @PostMapping("/games/{gameKey}/players/{playerKey}/move")
    public ResponseEntity<ApiResponse<Turn>> move(@PathVariable String gameKey, @PathVariable String playerKey,
                                                  @RequestBody MoveRequest req) {
        return ResponseEntity.ok(ApiResponse.success(svc.makeMove(gameKey, playerKey, req.toMove())));
    }

    @PostMapping("/games/{gameKey}/players/{playerKey}/pass")
    public ResponseEntity<ApiResponse<Turn>> pass(@PathVariable String gameKey, @PathVariable String playerKey) {
        return ResponseEntity.ok(ApiResponse.success(svc.pass(gameKey, playerKey)));
    }

    @PostMapping("/games/{gameKey}/players/{playerKey}/swap")
    public ResponseEntity<ApiResponse<Turn>> swap(@PathVariable String gameKey, @PathVariable String playerKey,
                                                  @RequestBody SwapRequest req) {
        return ResponseEntity.ok(ApiResponse.success(svc.swap(gameKey, playerKey, req.getTiles())));
    }

    @PostMapping("/games/{gameKey}/players/{playerKey}/challenge")
    public ResponseEntity<ApiResponse<Turn>> challenge(@PathVariable String gameKey, @PathVariable String playerKey) {
        return ResponseEntity.ok(ApiResponse.success(svc.challenge(gameKey, playerKey)));
    }

    @PostMapping("/games/{gameKey}/players/{playerKey}/takeBack")
    public ResponseEntity<ApiResponse<Turn>> takeBack(@PathVariable String gameKey, @PathVariable String playerKey) {
        return ResponseEntity.ok(ApiResponse.success(svc.takeBack(gameKey, playerKey)));
    }

    @PostMapping("/games/{gameKey}/players/{playerKey}/confirmGameOver")
    public ResponseEntity<ApiResponse<Turn>> confirmGameOver(@PathVariable String gameKey, @PathVariable String playerKey) {
        return ResponseEntity.ok(ApiResponse.success(svc.confirmGameOver(gameKey, playerKey)));
    }

    // ==================== 其他 ====================

    @PostMapping("/games/{gameKey}/players/{playerKey}/pause")
    public ResponseEntity<ApiResponse<Map<String, Boolean>>> pause(@PathVariable String gameKey, @PathVariable String playerKey) {
        return ResponseEntity.ok(ApiResponse.success(Map.of("paused", svc.togglePause(gameKey, playerKey))));
    }

    @PostMapping("/games/{gameKey}/players/{playerKey}/hint")
    public ResponseEntity<ApiResponse<Void>> hint(@PathVariable String gameKey, @PathVariable String playerKey) {
        svc.hint(gameKey, playerKey);
        return ResponseEntity.ok(ApiResponse.success());
    }

    @PostMapping("/games/{gameKey}/players/{playerKey}/advice")
    public ResponseEntity<ApiResponse<Map<String, Boolean>>> advice(@PathVariable String gameKey, @PathVariable String playerKey) {
        return ResponseEntity.ok(ApiResponse.success(Map.of("wantsAdvice", svc.toggleAdvice(gameKey, playerKey))));
    }

    /** 同样配置、同一批玩家再来一局 */
    @PostMapping("/games/{gameKey}/another")
    public ResponseEntity<ApiResponse<String>> anotherGame(@PathVariable String gameKey) {
        String next = svc.anotherGame(gameKey);
        log.info("对局 {} 的下一局：{}", gameKey, next);
        return ResponseEntity.ok(ApiResponse.success(next));
    }
}
