package com.wordhub.gameservice.games.words.domain.rule;

import com.wordhub.gameservice.games.words.domain.ai.BestPlaySolver;
import com.wordhub.gameservice.games.words.domain.ai.PlaySearch;
import com.wordhub.gameservice.games.words.domain.constants.GameMessages;
import com.wordhub.gameservice.games.words.domain.dictionary.Dictionary;
import com.wordhub.gameservice.games.words.domain.dictionary.DictionaryRegistry;
import com.wordhub.gameservice.games.words.domain.dto.AdvisorMessage;
import com.wordhub.gameservice.games.words.domain.enums.GameStatus;
import com.wordhub.gameservice.games.words.domain.enums.SwapPassPolicy;
import com.wordhub.gameservice.games.words.domain.enums.TurnType;
import com.wordhub.gameservice.games.words.domain.exception.GameInvariantException;
import com.wordhub.gameservice.games.words.domain.model.Game;
import com.wordhub.gameservice.games.words.domain.model.Move;
import com.wordhub.gameservice.games.words.domain.model.Placement;
import com.wordhub.gameservice.games.words.domain.model.Player;
import com.wordhub.gameservice.games.words.domain.model.Tile;
import com.wordhub.gameservice.games.words.domain.model.Turn;
import com.wordhub.gameservice.games.words.domain.port.GameEvents;
import com.wordhub.gameservice.games.words.domain.port.GameNotifier;
import com.wordhub.gameservice.games.words.domain.port.TurnClock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 回合引擎：走子、跳过、换牌、质疑、悔棋、终局。
 *
 * 约定：
 * 1) 调用方已持有该局的锁，引擎本身不做并发控制；
 * 2) 每个入口先同步停掉本局计时器，并记下剩余秒数；
 * 3) 所有校验都在第一次修改之前完成，校验失败时恢复计时，状态不变；
 * 4) 每个入口返回一条未打时间戳的 Turn，由服务层统一收尾（打时间戳、追加、落库、推送）。
 */
@Slf4j
@Component
public class TurnEngine {

    private final TurnClock clock;
    private final GameNotifier notifier;
    private final DictionaryRegistry dictionaries;
    private final BestPlaySolver solver;
    /** 人类走子后的词典校验在这里异步执行，只能推送消息 */
    private final Executor dictionaryCheckExecutor;
    private final long solverTimeoutMs;

    public TurnEngine(TurnClock clock,
                      GameNotifier notifier,
                      DictionaryRegistry dictionaries,
                      BestPlaySolver solver,
                      @Qualifier("dictionaryCheckExecutor") Executor dictionaryCheckExecutor,
                      @Value("${words.robot.solver-timeout-ms:5000}") long solverTimeoutMs) {
        this.clock = clock;
        this.notifier = notifier;
        this.dictionaries = dictionaries;
        this.solver = solver;
        this.dictionaryCheckExecutor = dictionaryCheckExecutor;
        this.solverTimeoutMs = solverTimeoutMs;
    }

    // ==================== 走子 ====================

    /**
     * 当前玩家走一手。
     */
    public Turn makeMove(Game game, String playerKey, Move move) {
        Player player = requireActing(game, playerKey);
        int remaining = clock.stop(game.getKey());
        try {
            MoveValidator.validateMove(game.getBoard(), player, move);
        } catch (RuntimeException e) {
            resume(game, player, remaining);
            throw e;
        }

        // 建议基于走子前的棋盘
        if (player.isWantsAdvice()) {
            advise(game, player, move.getScore());
        }

        List<Placement> applied = new ArrayList<>(move.getPlacements().size());
        for (Placement p : move.getPlacements()) {
            Tile fromRack = player.getRack().removeTile(p.getTile())
                    .orElseThrow(() -> new GameInvariantException(GameMessages.TILES_NOT_ON_RACK));
            Tile placed = fromRack.isBlank()
                    ? new Tile(Character.toUpperCase(p.getTile().getLetter()), 0, true)
                    : fromRack;
            game.getBoard().place(p.getCol(), p.getRow(), placed);
            applied.add(new Placement(placed.copy(), p.getCol(), p.getRow()));
        }
        move.setPlacements(applied);
        player.setScore(player.getScore() + move.getScore());

        move.setReplacements(new ArrayList<>());
        for (int i = 0; i < applied.size(); i++) {
            Optional<Tile> drawn = game.getLetterBag().getRandomTile();
            if (drawn.isEmpty()) break;
            player.getRack().addTile(drawn.get());
            move.addReplacement(drawn.get().copy());
        }

        if (game.isCheckDictionary() && !player.isRobot() && game.getDictionary() != null) {
            checkWordsDetached(game, player, move);
        }

        move.setPlayerKey(player.getKey());
        move.setRemainingTime(remaining);
        game.setPreviousMove(move);
        player.setPasses(0);

        Turn.TurnBuilder turn = Turn.builder()
                .gameKey(game.getKey())
                .type(TurnType.MOVE)
                .playerKey(player.getKey())
                .score(move.getScore())
                .placements(Turn.copyPlacements(move.getPlacements()))
                .replacements(Turn.copyTiles(move.getReplacements()))
                .words(Turn.copyWords(move.getWords()));

        if (game.allPassedTwice()) {
            clock.stop(game.getKey());
            game.finish(GameStatus.ALL_PASSED_TWICE);
        } else {
            Player next = game.nextPlayer(player);
            startTurn(game, next, 0);
            turn.nextToGoKey(next.getKey());
        }
        log.debug("[{}] {} 走子得分 {}，补牌 {} 张", game.getKey(), player.getKey(), move.getScore(),
                move.getReplacements().size());
        return turn.build();
    }

    // ==================== 跳过 ====================

    /**
     * @param type passed / timeout / challenge-failed
     */
    public Turn pass(Game game, String playerKey, TurnType type) {
        if (type == null || !type.passLike()) {
            throw new IllegalArgumentException(String.format(GameMessages.INVALID_PASS_TYPE, type));
        }
        Player passing = requireActing(game, playerKey);
        int remaining = clock.stop(game.getKey());
        if (endsOnPass(game, passing)) {
            try {
                requireScorable(game);
            } catch (RuntimeException e) {
                resume(game, passing, remaining);
                throw e;
            }
        }
        return doPass(game, passing, type);
    }

    private Turn doPass(Game game, Player passing, TurnType type) {
        game.setPreviousMove(null);
        passing.setPasses(passing.getPasses() + 1);
        if (game.allPassedTwice()) {
            return confirmGameOver(game, GameStatus.ALL_PASSED_TWICE);
        }
        Player next = game.nextPlayer(passing);
        startTurn(game, next, 0);
        return Turn.builder()
                .gameKey(game.getKey())
                .type(type)
                .playerKey(passing.getKey())
                .nextToGoKey(next.getKey())
                .build();
    }

    // ==================== 换牌 ====================

    /**
     * 换掉牌架上的若干张牌（可以为 0 张），计作一次跳过。
     */
    public Turn swap(Game game, String playerKey, List<Tile> tiles) {
        Player player = requireActing(game, playerKey);
        List<Tile> wanted = tiles == null ? List.of() : tiles;
        int remaining = clock.stop(game.getKey());
        try {
            MoveValidator.validateSwap(game.getLetterBag().remainingTileCount(), player, wanted);
            if (game.getSwapPassPolicy() == SwapPassPolicy.END_GAME && endsOnPass(game, player)) {
                requireScorable(game);
            }
        } catch (RuntimeException e) {
            resume(game, player, remaining);
            throw e;
        }

        game.setPreviousMove(null);
        player.setPasses(player.getPasses() + 1);

        // 先抽后还，避免抽回自己刚换掉的牌
        List<Tile> drawn = new ArrayList<>(wanted.size());
        for (int i = 0; i < wanted.size(); i++) {
            drawn.add(game.getLetterBag().getRandomTile()
                    .orElseThrow(() -> new GameInvariantException(GameMessages.formatInsufficientTiles(wanted.size(), 0))));
        }
        for (Tile t : wanted) {
            Tile removed = player.getRack().removeTile(t)
                    .orElseThrow(() -> new GameInvariantException(GameMessages.SWAP_NOT_ON_RACK));
            game.getLetterBag().returnTile(removed);
        }
        drawn.forEach(player.getRack()::addTile);

        if (game.getSwapPassPolicy() == SwapPassPolicy.END_GAME && game.allPassedTwice()) {
            return confirmGameOver(game, GameStatus.ALL_PASSED_TWICE);
        }
        Player next = game.nextPlayer(player);
        startTurn(game, next, 0);
        return Turn.builder()
                .gameKey(game.getKey())
                .type(TurnType.SWAP)
                .playerKey(player.getKey())
                .nextToGoKey(next.getKey())
                .replacements(Turn.copyTiles(drawn))
                .build();
    }

    // ==================== 质疑 ====================

    /**
     * 当前玩家质疑上一手。词典不可用时质疑直接成立。
     */
    public Turn challenge(Game game, String challengerKey) {
        Player challenger = requireActing(game, challengerKey);
        Move prev = game.getPreviousMove();
        if (prev == null) {
            throw new IllegalStateException(GameMessages.NOTHING_TO_CHALLENGE);
        }
        int remaining = clock.stop(game.getKey());

        Optional<Dictionary> dict = lookup(game.getDictionary());
        if (dict.isEmpty()) {
            return reverse(game, TurnType.CHALLENGE_WON);
        }
        List<String> bad = unknownWords(dict.get(), prev);
        if (!bad.isEmpty()) {
            log.info("[{}] {} 质疑成功，非法单词 {}", game.getKey(), challenger.getKey(), bad);
            return reverse(game, TurnType.CHALLENGE_WON);
        }
        boolean lastTiles = prev.getReplacements().isEmpty();
        if (lastTiles || endsOnPass(game, challenger)) {
            try {
                requireScorable(game);
            } catch (RuntimeException e) {
                resume(game, challenger, remaining);
                throw e;
            }
        }
        // 被质疑的一手已出完最后的牌：直接终局
        if (lastTiles) {
            return confirmGameOver(game, GameStatus.CHALLENGE_FAILED);
        }
        return doPass(game, challenger, TurnType.CHALLENGE_FAILED);
    }

    // ==================== 悔棋 ====================

    /**
     * 撤回上一手。
     * took-back：只能由上一手的玩家发起，且本局允许悔棋；
     * challenge-won：由当前玩家（质疑者）发起。
     */
    public Turn takeBack(Game game, String requesterKey, TurnType type) {
        game.requirePlaying();
        requireNotPaused(game);
        Move prev = game.getPreviousMove();
        if (prev == null) {
            throw new IllegalStateException(GameMessages.NOTHING_TO_TAKE_BACK);
        }
        if (type == TurnType.TOOK_BACK) {
            if (!game.isAllowTakeBack()) {
                throw new IllegalStateException(GameMessages.TAKE_BACK_DISABLED);
            }
            if (!Objects.equals(prev.getPlayerKey(), requesterKey)) {
                throw new IllegalStateException(GameMessages.ONLY_MOVER_CAN_TAKE_BACK);
            }
        } else if (type == TurnType.CHALLENGE_WON) {
            requireActing(game, requesterKey);
        } else {
            throw new IllegalArgumentException(String.format(GameMessages.INVALID_PASS_TYPE, type));
        }
        clock.stop(game.getKey());
        return reverse(game, type);
    }

    /**
     * 精确还原上一手：补牌回袋、落子回牌架、扣回分数。
     */
    private Turn reverse(Game game, TurnType type) {
        Move prev = game.getPreviousMove();
        Player mover = game.requirePlayer(prev.getPlayerKey());
        String challengerKey = game.getCurrentPlayerKey();

        if (!mover.getRack().containsAll(prev.getReplacements())) {
            throw new GameInvariantException(String.format(GameMessages.TAKE_BACK_INCONSISTENT, "replacements"));
        }
        for (Placement p : prev.getPlacements()) {
            if (game.getBoard().isEmptyAt(p.getCol(), p.getRow())) {
                throw new GameInvariantException(String.format(GameMessages.TAKE_BACK_INCONSISTENT,
                        "(" + p.getCol() + "," + p.getRow() + ")"));
            }
        }

        game.setPreviousMove(null);
        for (Tile t : prev.getReplacements()) {
            mover.getRack().removeTile(t).ifPresent(game.getLetterBag()::returnTile);
        }
        for (Placement p : prev.getPlacements()) {
            mover.getRack().addTile(game.getBoard().remove(p.getCol(), p.getRow()));
        }
        mover.setScore(mover.getScore() - prev.getScore());

        if (type == TurnType.TOOK_BACK) {
            startTurn(game, mover, prev.getRemainingTime());
        } else {
            startTurn(game, game.requirePlayer(challengerKey), 0);
        }
        log.debug("[{}] 撤回 {} 的上一手（{}）", game.getKey(), mover.getKey(), type.code());
        return Turn.builder()
                .gameKey(game.getKey())
                .type(type)
                .playerKey(mover.getKey())
                .nextToGoKey(game.getCurrentPlayerKey())
                .challengerKey(challengerKey)
                .score(-prev.getScore())
                .placements(Turn.copyPlacements(prev.getPlacements()))
                .replacements(Turn.copyTiles(prev.getReplacements()))
                .words(Turn.copyWords(prev.getWords()))
                .build();
    }

    // ==================== 终局 ====================

    /**
     * 终局入口：结算牌架罚分并进入终局状态，只会发生一次。
     */
    public Turn confirmGameOver(Game game, GameStatus endState) {
        if (game.hasEnded()) {
            throw new IllegalStateException(GameMessages.GAME_ALREADY_OVER);
        }
        if (endState == null || !endState.terminal()) {
            throw new IllegalArgumentException(String.format(GameMessages.INVALID_END_STATE, endState));
        }
        Map<String, Integer> deltas = requireScorable(game);
        clock.stop(game.getKey());
        String actingKey = game.getCurrentPlayerKey();
        EndGameScorer.apply(game.getPlayers(), deltas);
        game.finish(endState);
        log.info("对局 {} 结束：{}，分值变化 {}", game.getKey(), endState, deltas);
        return Turn.builder()
                .gameKey(game.getKey())
                .type(TurnType.GAME_ENDED)
                .endState(endState)
                .playerKey(actingKey)
                .scoreDeltas(Collections.unmodifiableMap(new LinkedHashMap<>(deltas)))
                .build();
    }

    /**
     * 长时间无活动的对局直接判为超时结束（不产生回合记录）。
     * @return 是否发生了状态变化
     */
    public boolean timeOutStale(Game game, long now, long staleMillis) {
        if (game.hasEnded() || now - game.lastActivity() <= staleMillis) {
            return false;
        }
        clock.stop(game.getKey());
        game.finish(GameStatus.TIMED_OUT);
        log.info("对局 {} 长时间无活动，判为超时", game.getKey());
        return true;
    }

    // ==================== 机器人 ====================

    /**
     * 机器人走一步：先考虑质疑人类的上一手，再求最佳走法，找不到就跳过。
     * 有玩家已出完牌时直接确认终局。
     */
    public Turn autoplay(Game game) {
        game.requirePlaying();
        Player robot = game.current()
                .orElseThrow(() -> new IllegalStateException(GameMessages.NO_CURRENT_PLAYER));
        if (!robot.isRobot()) {
            throw new IllegalStateException(String.format(GameMessages.NOT_A_ROBOT, robot.getKey()));
        }
        if (game.playerWithNoTiles().isPresent()) {
            return confirmGameOver(game, GameStatus.GAME_OVER);
        }

        Move prev = game.getPreviousMove();
        if (robot.isCanChallenge() && game.getDictionary() != null && prev != null) {
            boolean byHuman = game.getPlayer(prev.getPlayerKey()).map(p -> !p.isRobot()).orElse(false);
            if (byHuman) {
                Optional<Dictionary> dict = lookup(game.getDictionary());
                if (dict.isPresent() && !unknownWords(dict.get(), prev).isEmpty()) {
                    log.info("[{}] 机器人 {} 质疑成功", game.getKey(), robot.getKey());
                    clock.stop(game.getKey());
                    return reverse(game, TurnType.CHALLENGE_WON);
                }
            }
        }

        Optional<Move> best = findBestPlay(game, robot);
        if (best.isPresent()) {
            try {
                return makeMove(game, robot.getKey(), best.get());
            } catch (IllegalArgumentException e) {
                log.warn("[{}] 机器人 {} 的走法不合法，改为跳过: {}", game.getKey(), robot.getKey(), e.getMessage());
            }
        }
        return pass(game, robot.getKey(), TurnType.PASSED);
    }

    // ==================== 暂停 / 提示 / 建议 ====================

    /**
     * 切换暂停。暂停时把剩余秒数记在当前玩家身上，恢复时按这个秒数重新计时。
     * @return 切换后是否处于暂停
     */
    public boolean togglePause(Game game, String requesterKey) {
        game.requirePlaying();
        Player by = game.getPlayer(requesterKey)
                .orElseThrow(() -> new IllegalStateException(GameMessages.formatPlayerNotFound(requesterKey)));
        if (game.isPaused()) {
            game.setPausedBy(null);
            game.current().ifPresent(p -> startTurn(game, p, p.getSecondsToPlay()));
            log.info("[{}] {} 恢复对局", game.getKey(), by.getName());
            return false;
        }
        int remaining = clock.stop(game.getKey());
        game.current().ifPresent(p -> p.setSecondsToPlay(remaining));
        game.setPausedBy(by.getName());
        log.info("[{}] {} 暂停对局", game.getKey(), by.getName());
        return true;
    }

    /**
     * 提示：不算一手，只推送消息。
     */
    public void hint(Game game, String playerKey) {
        game.requirePlaying();
        Player player = game.getPlayer(playerKey)
                .orElseThrow(() -> new IllegalStateException(GameMessages.formatPlayerNotFound(playerKey)));
        String text = findBestPlay(game, player)
                .map(best -> describe(GameMessages.HINT_PLAY, best))
                .orElse(GameMessages.HINT_NONE);
        notifier.notifyOne(game.getKey(), player.getKey(), GameEvents.MESSAGE, AdvisorMessage.advisor(text));
        notifier.notifyAll(game.getKey(), GameEvents.MESSAGE,
                AdvisorMessage.advisor(GameMessages.formatName(GameMessages.HINT_ASKED, player.getName())));
    }

    /**
     * @return 切换后的 wantsAdvice
     */
    public boolean toggleAdvice(Game game, String playerKey) {
        Player player = game.getPlayer(playerKey)
                .orElseThrow(() -> new IllegalStateException(GameMessages.formatPlayerNotFound(playerKey)));
        boolean on = player.toggleAdvice();
        notifier.notifyOne(game.getKey(), player.getKey(), GameEvents.MESSAGE,
                AdvisorMessage.advisor(on ? GameMessages.ADVICE_ON : GameMessages.ADVICE_OFF));
        if (on) {
            notifier.notifyAll(game.getKey(), GameEvents.MESSAGE,
                    AdvisorMessage.advisor(GameMessages.formatName(GameMessages.ADVICE_ENABLED_BY, player.getName())));
        }
        return on;
    }

    private void advise(Game game, Player player, int theirScore) {
        findBestPlay(game, player)
                .filter(best -> best.getScore() > theirScore)
                .ifPresent(best -> {
                    notifier.notifyOne(game.getKey(), player.getKey(), GameEvents.MESSAGE,
                            AdvisorMessage.advisor(describe(GameMessages.ADVICE_BETTER, best)));
                    notifier.notifyAll(game.getKey(), GameEvents.MESSAGE,
                            AdvisorMessage.advisor(GameMessages.formatName(GameMessages.ADVICE_RECEIVED, player.getName())));
                });
    }

    private static String describe(String template, Move best) {
        Placement first = best.getPlacements().get(0);
        return GameMessages.formatPlay(template, best.describeWords(), best.getScore(), first.getCol(), first.getRow());
    }

    // ==================== 计时 ====================

    /**
     * 把回合交给 player，并按需启动计时。
     * @param seconds 大于 0 时使用该秒数，否则使用整回合时长
     */
    public void startTurn(Game game, Player player, int seconds) {
        game.setCurrentPlayerKey(player.getKey());
        if (game.getSecondsPerPlay() <= 0 || player.isRobot() || !game.isPlaying() || game.isPaused()) {
            return;
        }
        int allotment = seconds > 0 ? seconds : game.getSecondsPerPlay();
        player.setSecondsToPlay(allotment);
        clock.start(game.getKey(), player.getKey(), allotment, game.nextClockVersion());
    }

    /** 校验失败后，把刚停掉的计时按剩余秒数接上 */
    private void resume(Game game, Player player, int remaining) {
        if (remaining > 0) {
            startTurn(game, player, remaining);
        }
    }

    // ==================== 内部 ====================

    /** 这一次跳过之后是否所有人都已连续跳过两次 */
    private static boolean endsOnPass(Game game, Player passing) {
        if (game.getPlayers().isEmpty()) return false;
        for (Player p : game.getPlayers()) {
            int passes = p == passing ? p.getPasses() + 1 : p.getPasses();
            if (passes < 2) return false;
        }
        return true;
    }

    /** 先算一遍终局分值变化，结算不了时在任何修改之前失败 */
    private Map<String, Integer> requireScorable(Game game) {
        try {
            return EndGameScorer.computeDeltas(game.getPlayers());
        } catch (GameInvariantException e) {
            log.error("[{}] 终局结算失败: {}", game.getKey(), e.getMessage());
            throw e;
        }
    }

    private Player requireActing(Game game, String playerKey) {
        game.requirePlaying();
        requireNotPaused(game);
        if (playerKey == null || !playerKey.equals(game.getCurrentPlayerKey())) {
            throw new IllegalStateException(GameMessages.formatNotYourTurn(game.getCurrentPlayerKey()));
        }
        return game.requirePlayer(playerKey);
    }

    private static void requireNotPaused(Game game) {
        if (game.isPaused()) {
            throw new IllegalStateException(GameMessages.formatGamePaused(game.getPausedBy()));
        }
    }

    private Optional<Move> findBestPlay(Game game, Player player) {
        PlaySearch search = new PlaySearch(game.getBoard().copy(), game.getDictionary(), player.getRack().snapshot());
        String gameKey = game.getKey();
        CompletableFuture<Optional<Move>> future = null;
        try {
            future = solver.findBestPlay(search, msg -> log.debug("[{}] solver: {}", gameKey, msg));
            Optional<Move> best = future.get(solverTimeoutMs, TimeUnit.MILLISECONDS);
            return best == null ? Optional.empty() : best;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] 求解被中断", gameKey);
            return Optional.empty();
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[{}] 求解超时（{}ms）", gameKey, solverTimeoutMs);
            return Optional.empty();
        } catch (ExecutionException | RejectedExecutionException e) {
            log.warn("[{}] 求解失败: {}", gameKey, e.toString());
            return Optional.empty();
        }
    }

    private Optional<Dictionary> lookup(String name) {
        if (name == null) return Optional.empty();
        try {
            Optional<Dictionary> dict = dictionaries.find(name);
            if (dict.isEmpty()) {
                log.warn("词典 {} 不可用", name);
            }
            return dict;
        } catch (RuntimeException e) {
            log.warn("加载词典 {} 失败: {}", name, e.getMessage());
            return Optional.empty();
        }
    }

    private static List<String> unknownWords(Dictionary dict, Move move) {
        return move.wordList().stream().filter(w -> !dict.hasWord(w)).toList();
    }

    /**
     * 人类走子后的词典校验：只拿单词副本，只推送给走子玩家，绝不修改对局。
     */
    private void checkWordsDetached(Game game, Player player, Move move) {
        String gameKey = game.getKey();
        String playerKey = player.getKey();
        String dictName = game.getDictionary();
        List<String> words = List.copyOf(move.wordList());
        try {
            dictionaryCheckExecutor.execute(() -> lookup(dictName).ifPresent(dict -> {
                for (String w : words) {
                    if (!dict.hasWord(w)) {
                        notifier.notifyOne(gameKey, playerKey, GameEvents.MESSAGE,
                                AdvisorMessage.advisor(GameMessages.formatWordNotFound(dictName, w)));
                    }
                }
            }));
        } catch (RejectedExecutionException e) {
            log.warn("[{}] 词典校验任务被拒绝: {}", gameKey, e.getMessage());
        }
    }
}
