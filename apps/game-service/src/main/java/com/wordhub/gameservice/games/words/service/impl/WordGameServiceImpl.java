package com.wordhub.gameservice.games.words.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wordhub.gameservice.games.words.application.GameLockRegistry;
import com.wordhub.gameservice.games.words.domain.constants.GameMessages;
import com.wordhub.gameservice.games.words.domain.dto.GameSummary;
import com.wordhub.gameservice.games.words.domain.dto.PlayerSummary;
import com.wordhub.gameservice.games.words.domain.enums.GameStatus;
import com.wordhub.gameservice.games.words.domain.enums.TurnType;
import com.wordhub.gameservice.games.words.domain.model.Game;
import com.wordhub.gameservice.games.words.domain.model.GameConfig;
import com.wordhub.gameservice.games.words.domain.model.Move;
import com.wordhub.gameservice.games.words.domain.model.Player;
import com.wordhub.gameservice.games.words.domain.model.Tile;
import com.wordhub.gameservice.games.words.domain.model.Turn;
import com.wordhub.gameservice.games.words.domain.port.GameEvents;
import com.wordhub.gameservice.games.words.domain.port.GameNotifier;
import com.wordhub.gameservice.games.words.domain.port.PlayerPresence;
import com.wordhub.gameservice.games.words.domain.port.TurnClock;
import com.wordhub.gameservice.games.words.domain.repository.EditionRepository;
import com.wordhub.gameservice.games.words.domain.repository.GameRepository;
import com.wordhub.gameservice.games.words.domain.rule.TurnEngine;
import com.wordhub.gameservice.games.words.service.WordGameService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

@Slf4j
@Service
@RequiredArgsConstructor
public class WordGameServiceImpl implements WordGameService {

    // ====== 内存对局表（未命中时回源 Redis，已结束的对局不常驻） ======
    private final Map<String, Game> games = new ConcurrentHashMap<>();

    private final GameRepository gameRepo;
    private final EditionRepository editions;
    private final TurnEngine engine;
    private final TurnClock clock;
    private final GameNotifier notifier;
    private final PlayerPresence presence;
    private final GameLockRegistry locks;
    /** 机器人回合延迟执行 */
    private final ScheduledExecutorService robotScheduler;
    private final ObjectMapper objectMapper;

    /** 对局文档在 Redis 中的保留时长 */
    @Value("${words.game.ttl-hours:48}")
    private long ttlHours = 48;

    /** 超过这么多天无活动的对局判为超时 */
    @Value("${words.game.stale-days:14}")
    private long staleDays = 14;

    /** 机器人“思考”延迟（毫秒） */
    @Value("${words.robot.delay-ms:800}")
    private long robotDelayMs = 800;

    // ==================== 对局 ====================

    @Override
    public String createGame(GameConfig config) {
        Game game = new Game(config).create(editions.load(config.edition()));
        games.put(game.getKey(), game);
        save(game);
        log.info("创建对局 {}：版本 {}，词典 {}，每手 {} 秒", game.getKey(), game.getEdition(),
                game.getDictionary(), game.getSecondsPerPlay());
        return game.getKey();
    }

    @Override
    public Game getGame(String gameKey) {
        return locked(gameKey, () -> snapshot(load(gameKey)));
    }

    @Override
    public GameSummary summary(String gameKey) {
        return locked(gameKey, () -> GameSummary.from(load(gameKey), presence.connectedPlayers(gameKey)));
    }

    @Override
    public List<GameSummary> listGames(Long cursor, int limit) {
        List<GameSummary> out = new ArrayList<>();
        for (String key : gameRepo.listKeys(cursor, limit)) {
            locked(key, () -> find(key).map(g -> GameSummary.from(g, presence.connectedPlayers(key))))
                    .ifPresent(out::add);
        }
        return out;
    }

    @Override
    public Player addPlayer(String gameKey, String name, boolean robot, boolean canChallenge) {
        return locked(gameKey, () -> {
            Game game = load(gameKey);
            String display = StringUtils.defaultIfBlank(name,
                    (robot ? "Robot " : "Player ") + (game.getPlayers().size() + 1));
            Player player = new Player(UUID.randomUUID().toString().replace("-", ""), display, robot, canChallenge);
            game.addPlayer(player);
            save(game);
            notifier.notifyAll(gameKey, GameEvents.JOINED, PlayerSummary.from(player, false));
            log.info("[{}] {} 入座（robot={}），当前 {} 人", gameKey, display, robot, game.getPlayers().size());
            return player;
        });
    }

    @Override
    public void removePlayer(String gameKey, String playerKey) {
        locked(gameKey, () -> {
            Game game = load(gameKey);
            boolean current = playerKey.equals(game.getCurrentPlayerKey());
            if (current) {
                clock.stop(gameKey);
            }
            if (game.getPreviousMove() != null && playerKey.equals(game.getPreviousMove().getPlayerKey())) {
                game.setPreviousMove(null);
            }
            game.removePlayer(playerKey);
            save(game);
            notifier.notifyAll(gameKey, GameEvents.LEFT, Map.of("playerKey", playerKey));
            log.info("[{}] 玩家 {} 离座", gameKey, playerKey);
            // 轮到的人走了：同一把锁内交给下一位
            if (current) {
                playIfReady(gameKey);
            }
            return null;
        });
    }

    @Override
    public boolean playIfReady(String gameKey) {
        boolean ready = locked(gameKey, () -> {
            Game game = load(gameKey);
            if (game.hasEnded()) {
                return false;
            }
            List<Player> players = game.getPlayers();
            if (players.size() < game.getMinPlayers()) {
                log.debug("[{}] 人数不足：{}/{}", gameKey, players.size(), game.getMinPlayers());
                return false;
            }
            Player first = null;
            if (game.getCurrentPlayerKey() == null) {
                first = players.get(ThreadLocalRandom.current().nextInt(players.size()));
            } else if (game.current().isEmpty()) {
                first = players.get(0);
            }
            if (first != null) {
                engine.startTurn(game, first, 0);
                save(game);
                notifier.notifyAll(gameKey, GameEvents.STARTED, Map.of("currentPlayerKey", first.getKey()));
                log.info("[{}] 由 {} 开始", gameKey, first.getName());
            }
            return true;
        });
        if (ready) {
            scheduleRobotsIfNeeded(gameKey);
        }
        return ready;
    }

    // ==================== 回合 ====================

    @Override
    public Turn makeMove(String gameKey, String playerKey, Move move) {
        return play(gameKey, game -> engine.makeMove(game, playerKey, move));
    }

    @Override
    public Turn pass(String gameKey, String playerKey) {
        return play(gameKey, game -> engine.pass(game, playerKey, TurnType.PASSED));
    }

    @Override
    public Turn swap(String gameKey, String playerKey, List<Tile> tiles) {
        return play(gameKey, game -> engine.swap(game, playerKey, tiles));
    }

    @Override
    public Turn challenge(String gameKey, String playerKey) {
        return play(gameKey, game -> engine.challenge(game, playerKey));
    }

    @Override
    public Turn takeBack(String gameKey, String playerKey) {
        return play(gameKey, game -> engine.takeBack(game, playerKey, TurnType.TOOK_BACK));
    }

    @Override
    public Turn confirmGameOver(String gameKey, String playerKey) {
        return play(gameKey, game -> {
            if (game.getPlayer(playerKey).isEmpty()) {
                throw new IllegalStateException(GameMessages.formatPlayerNotFound(playerKey));
            }
            return engine.confirmGameOver(game, GameStatus.GAME_OVER);
        });
    }

    /**
     * 锁内执行一次回合操作并收尾，锁外再决定是否交给机器人。
     */
    private Turn play(String gameKey, Function<Game, Turn> action) {
        Turn turn = locked(gameKey, () -> {
            Game game = load(gameKey);
            return finishTurn(game, action.apply(game));
        });
        scheduleRobotsIfNeeded(gameKey);
        return turn;
    }

    /**
     * 收尾：打时间戳、追加回合、落库、推送；终局时额外推送 gameOverConfirmed。
     */
    private Turn finishTurn(Game game, Turn turn) {
        Turn stamped = turn.withTimestamp(System.currentTimeMillis());
        game.appendTurn(stamped);
        save(game);
        notifier.notifyAll(game.getKey(), GameEvents.TURN, stamped);
        if (game.hasEnded()) {
            notifier.notifyAll(game.getKey(), GameEvents.GAME_OVER_CONFIRMED,
                    Map.of("key", game.getKey(), "state", game.getState()));
        }
        return stamped;
    }

    // ==================== 机器人 ====================

    private static boolean robotToMove(Game game) {
        return game.isPlaying() && !game.isPaused()
                && game.current().map(Player::isRobot).orElse(false);
    }

    private void scheduleRobotsIfNeeded(String gameKey) {
        Game game = games.get(gameKey);
        if (game == null || !robotToMove(game)) {
            return;
        }
        try {
            robotScheduler.schedule(() -> runRobots(gameKey), robotDelayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("[{}] 机器人回合调度被拒绝: {}", gameKey, e.getMessage());
        }
    }

    /**
     * 只要轮到机器人就一直走下去（循环而非递归）。
     */
    void runRobots(String gameKey) {
        try {
            locked(gameKey, () -> {
                Optional<Game> found = find(gameKey);
                if (found.isEmpty()) {
                    return null;
                }
                Game game = found.get();
                while (robotToMove(game)) {
                    finishTurn(game, engine.autoplay(game));
                }
                return null;
            });
        } catch (RuntimeException e) {
            log.error("[{}] 机器人回合失败", gameKey, e);
        }
    }

    // ==================== 其他 ====================

    @Override
    public boolean togglePause(String gameKey, String playerKey) {
        boolean paused = locked(gameKey, () -> {
            Game game = load(gameKey);
            String name = game.getPlayer(playerKey).map(Player::getName).orElse(playerKey);
            boolean nowPaused = engine.togglePause(game, playerKey);
            save(game);
            notifier.notifyAll(gameKey, nowPaused ? GameEvents.PAUSE : GameEvents.UNPAUSE,
                    Map.of("key", gameKey, "name", name));
            return nowPaused;
        });
        if (!paused) {
            scheduleRobotsIfNeeded(gameKey);
        }
        return paused;
    }

    @Override
    public void hint(String gameKey, String playerKey) {
        locked(gameKey, () -> {
            engine.hint(load(gameKey), playerKey);
            return null;
        });
    }

    @Override
    public boolean toggleAdvice(String gameKey, String playerKey) {
        return locked(gameKey, () -> {
            Game game = load(gameKey);
            boolean on = engine.toggleAdvice(game, playerKey);
            save(game);
            return on;
        });
    }

    @Override
    public String anotherGame(String gameKey) {
        String nextKey = locked(gameKey, () -> {
            Game old = load(gameKey);
            if (old.getNextGameKey() != null) {
                throw new IllegalStateException(GameMessages.formatNextGameExists(old.getNextGameKey()));
            }
            Game next = new Game(GameConfig.of(old)).create(editions.load(old.getEdition()));
            List<Player> seats = new ArrayList<>(old.getPlayers());
            Collections.shuffle(seats);
            seats.forEach(p -> next.addPlayer(Player.seatedCopy(p)));
            games.put(next.getKey(), next);
            if (!next.getPlayers().isEmpty() && next.getPlayers().size() >= next.getMinPlayers()) {
                engine.startTurn(next, next.getPlayers().get(0), 0);
            }
            save(next);
            old.setNextGameKey(next.getKey());
            save(old);
            notifier.notifyAll(gameKey, GameEvents.NEXT_GAME, Map.of("gameKey", next.getKey()));
            log.info("[{}] 开始下一局 {}", gameKey, next.getKey());
            return next.getKey();
        });
        scheduleRobotsIfNeeded(nextKey);
        return nextKey;
    }

    @Override
    public void onTurnTimeout(String gameKey, String playerKey, long version) {
        boolean acted = locked(gameKey, () -> {
            Optional<Game> found = find(gameKey);
            if (found.isEmpty()) {
                return false;
            }
            Game game = found.get();
            if (!game.isPlaying() || game.isPaused()
                    || !playerKey.equals(game.getCurrentPlayerKey())
                    || game.getClockVersion() != version) {
                log.debug("[{}] 忽略过期的超时回调 player={} version={}（当前 {} / {}）", gameKey, playerKey,
                        version, game.getCurrentPlayerKey(), game.getClockVersion());
                return false;
            }
            log.info("[{}] 玩家 {} 回合超时", gameKey, playerKey);
            finishTurn(game, engine.pass(game, playerKey, TurnType.TIMEOUT));
            return true;
        });
        if (acted) {
            scheduleRobotsIfNeeded(gameKey);
        }
    }

    @Override
    public boolean checkTimeout(String gameKey) {
        return locked(gameKey, () -> {
            Optional<Game> found = gameRepo.exists(gameKey) ? find(gameKey) : Optional.empty();
            if (found.isEmpty()) {
                // 文档已过期：清掉索引和内存中的副本
                gameRepo.delete(gameKey);
                if (games.remove(gameKey) != null) {
                    clock.stop(gameKey);
                }
                return false;
            }
            Game game = found.get();
            if (!engine.timeOutStale(game, System.currentTimeMillis(), Duration.ofDays(staleDays).toMillis())) {
                return false;
            }
            save(game);
            notifier.notifyAll(gameKey, GameEvents.GAME_OVER_CONFIRMED,
                    Map.of("key", gameKey, "state", game.getState()));
            return true;
        });
    }

    @Override
    public List<String> allGameKeys() {
        return gameRepo.allKeys();
    }

    // ==================== 内部 ====================

    private Optional<Game> find(String gameKey) {
        Game cached = games.get(gameKey);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<Game> loaded = gameRepo.get(gameKey);
        if (loaded.isEmpty() || loaded.get().hasEnded()) {
            return loaded;
        }
        games.putIfAbsent(gameKey, loaded.get());
        return Optional.of(games.get(gameKey));
    }

    private Game load(String gameKey) {
        return find(gameKey).orElseThrow(() -> new NoSuchElementException(GameMessages.formatGameNotFound(gameKey)));
    }

    private void save(Game game) {
        gameRepo.save(game, Duration.ofHours(ttlHours));
    }

    /**
     * 锁内执行，出锁后把已结束或已不在内存的对局连同锁对象一起释放。
     */
    private <T> T locked(String gameKey, Supplier<T> action) {
        try {
            return locks.withLock(gameKey, action);
        } finally {
            evictIfDone(gameKey);
        }
    }

    private void evictIfDone(String gameKey) {
        boolean gone = locks.withLock(gameKey, () -> {
            Game cached = games.get(gameKey);
            if (cached != null && cached.hasEnded()) {
                games.remove(gameKey);
                log.debug("[{}] 对局已结束（{}），移出内存", gameKey, cached.getState());
            }
            return !games.containsKey(gameKey);
        });
        if (gone) {
            locks.forget(gameKey);
        }
    }

    /** 锁内做一份深拷贝，调用方拿到的对象与内存对局互不影响 */
    private Game snapshot(Game game) {
        try {
            return objectMapper.readValue(objectMapper.writeValueAsBytes(game), Game.class);
        } catch (IOException e) {
            throw new IllegalStateException("对局快照失败: " + game.getKey(), e);
        }
    }

    /** 内存中的对局实例，未缓存时为 null */
    Game cached(String gameKey) {
        return games.get(gameKey);
    }
}
