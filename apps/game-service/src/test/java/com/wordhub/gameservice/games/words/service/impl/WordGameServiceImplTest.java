package com.wordhub.gameservice.games.words.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wordhub.gameservice.games.words.application.GameLockRegistry;
import com.wordhub.gameservice.games.words.domain.enums.GameStatus;
import com.wordhub.gameservice.games.words.domain.enums.TurnType;
import com.wordhub.gameservice.games.words.domain.model.Game;
import com.wordhub.gameservice.games.words.domain.model.Player;
import com.wordhub.gameservice.games.words.domain.model.Turn;
import com.wordhub.gameservice.games.words.domain.port.GameEvents;
import com.wordhub.gameservice.games.words.domain.port.GameNotifier;
import com.wordhub.gameservice.games.words.domain.repository.EditionRepository;
import com.wordhub.gameservice.games.words.domain.repository.GameRepository;
import com.wordhub.gameservice.games.words.domain.rule.TurnEngine;
import com.wordhub.gameservice.games.words.support.RecordingTurnClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static com.wordhub.gameservice.games.words.support.WordGameFixtures.EDITION;
import static com.wordhub.gameservice.games.words.support.WordGameFixtures.across;
import static com.wordhub.gameservice.games.words.support.WordGameFixtures.config;
import static com.wordhub.gameservice.games.words.support.WordGameFixtures.edition;
import static com.wordhub.gameservice.games.words.support.WordGameFixtures.game;
import static com.wordhub.gameservice.games.words.support.WordGameFixtures.seat;
import static com.wordhub.gameservice.games.words.support.WordGameFixtures.setRack;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WordGameServiceImplTest {

    @Mock
    private GameRepository gameRepo;
    @Mock
    private EditionRepository editions;
    @Mock
    private GameNotifier notifier;
    @Mock
    private ScheduledExecutorService robotScheduler;

    private RecordingTurnClock clock;
    private GameLockRegistry locks;
    private WordGameServiceImpl service;

    @BeforeEach
    void setUp() {
        clock = new RecordingTurnClock();
        TurnEngine engine = new TurnEngine(clock, notifier, name -> Optional.empty(),
                (search, progress) -> CompletableFuture.completedFuture(Optional.empty()), Runnable::run, 1000);
        locks = spy(new GameLockRegistry());
        service = new WordGameServiceImpl(gameRepo, editions, engine, clock, notifier,
                gameKey -> Set.of(), locks, robotScheduler, new ObjectMapper());
    }

    private String newGame(int secondsPerPlay) {
        when(editions.load(EDITION)).thenReturn(edition());
        return service.createGame(config().secondsPerPlay(secondsPerPlay).build());
    }

    private String startedGame(String... names) {
        String key = newGame(60);
        for (String name : names) {
            service.addPlayer(key, name, false, false);
        }
        service.playIfReady(key);
        return key;
    }

    private Runnable capturedRobotTask() {
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(robotScheduler).schedule(task.capture(), anyLong(), eq(TimeUnit.MILLISECONDS));
        return task.getValue();
    }

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("creating a game saves it with the configured TTL")
        void create() {
            String key = newGame(60);

            assertThat(service.getGame(key).getEdition()).isEqualTo(EDITION);
            verify(gameRepo).save(any(Game.class), eq(Duration.ofHours(48)));
        }

        @Test
        @DisplayName("the game starts once enough players are seated")
        void playIfReady() {
            String key = newGame(60);
            service.addPlayer(key, "Ann", false, false);
            assertThat(service.playIfReady(key)).isFalse();

            service.addPlayer(key, "Bob", false, false);
            assertThat(service.playIfReady(key)).isTrue();

            Game game = service.getGame(key);
            assertThat(game.current()).isPresent();
            assertThat(clock.lastStart().playerKey()).isEqualTo(game.getCurrentPlayerKey());
            verify(notifier).notifyAll(eq(key), eq(GameEvents.STARTED), any());
            verify(notifier, never()).notifyAll(eq(key), eq(GameEvents.TURN), any());
        }

        @Test
        @DisplayName("blank names get a default display name")
        void defaultName() {
            String key = newGame(0);

            Player p = service.addPlayer(key, " ", true, true);

            assertThat(p.getName()).isEqualTo("Robot 1");
            verify(notifier).notifyAll(eq(key), eq(GameEvents.JOINED), any());
        }

        @Test
        @DisplayName("an unknown game is reported as not found")
        void unknownGame() {
            when(gameRepo.get("nope")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.getGame("nope")).isInstanceOf(NoSuchElementException.class);
        }

        @Test
        @DisplayName("another game re-seats the same players once")
        void anotherGame() {
            String key = newGame(60);
            service.addPlayer(key, "Ann", false, false);
            service.addPlayer(key, "Bob", false, false);

            String next = service.anotherGame(key);

            Game nextGame = service.getGame(next);
            assertThat(service.getGame(key).getNextGameKey()).isEqualTo(next);
            assertThat(nextGame.getPlayers()).extracting(Player::getName).containsExactlyInAnyOrder("Ann", "Bob");
            assertThat(nextGame.getPlayers()).allMatch(p -> p.getScore() == 0 && p.getRack().size() == 7);
            assertThat(nextGame.getCurrentPlayerKey()).isEqualTo(nextGame.getPlayers().get(0).getKey());
            verify(notifier).notifyAll(eq(key), eq(GameEvents.NEXT_GAME), any());

            assertThatThrownBy(() -> service.anotherGame(key)).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("removing the current player stops the clock")
        void removeCurrent() {
            String key = newGame(60);
            service.addPlayer(key, "Ann", false, false);
            service.addPlayer(key, "Bob", false, false);
            service.playIfReady(key);
            String current = service.getGame(key).getCurrentPlayerKey();

            service.removePlayer(key, current);

            assertThat(clock.isRunning(key)).isFalse();
            assertThat(service.getGame(key).getPlayers()).hasSize(1);
            verify(notifier).notifyAll(eq(key), eq(GameEvents.LEFT), any());
        }

        @Test
        @DisplayName("when the current player leaves, the first remaining seat takes the turn")
        void currentLeavesTurnMovesOn() {
            String key = startedGame("Ann", "Bob", "Cid");
            Game game = service.cached(key);
            String leaving = game.getCurrentPlayerKey();

            service.removePlayer(key, leaving);

            String next = game.getPlayers().get(0).getKey();
            assertThat(game.getPlayers()).extracting(Player::getKey).doesNotContain(leaving);
            assertThat(game.getCurrentPlayerKey()).isEqualTo(next);
            assertThat(clock.isRunning(key)).isTrue();
            assertThat(clock.lastStart().playerKey()).isEqualTo(next);

            Turn turn = service.pass(key, next);

            assertThat(turn.getType()).isEqualTo(TurnType.PASSED);
            assertThat(turn.getNextToGoKey()).isEqualTo(game.getPlayers().get(1).getKey());
        }

        @Test
        @DisplayName("getGame hands out a copy that does not share state with the live game")
        void getGameIsACopy() {
            String key = startedGame("Ann", "Bob");
            Game live = service.cached(key);

            Game copy = service.getGame(key);

            assertThat(copy).isNotSameAs(live);
            assertThat(copy.getCurrentPlayerKey()).isEqualTo(live.getCurrentPlayerKey());
            assertThat(copy.tileCount()).isEqualTo(live.tileCount());

            copy.getPlayers().get(0).setScore(99);
            copy.getPlayers().get(0).getRack().getTiles().clear();
            copy.setCurrentPlayerKey(null);

            assertThat(live.getPlayers().get(0).getScore()).isZero();
            assertThat(live.getPlayers().get(0).getRack().size()).isEqualTo(7);
            assertThat(live.getCurrentPlayerKey()).isNotNull();
        }
    }

    @Nested
    @DisplayName("turns")
    class TurnTests {

        @Test
        @DisplayName("a finished turn is stamped, appended, saved and broadcast")
        void finishTurn() {
            String key = newGame(60);
            service.addPlayer(key, "Ann", false, false);
            service.addPlayer(key, "Bob", false, false);
            service.playIfReady(key);
            Game game = service.cached(key);
            Player current = game.current().orElseThrow();
            setRack(game, current, "CABTEAE");

            Turn turn = service.makeMove(key, current.getKey(), across("CAB", 7, 7));

            assertThat(turn.getTimestamp()).isPositive();
            assertThat(game.getTurns()).containsExactly(turn);
            verify(notifier).notifyAll(key, GameEvents.TURN, turn);
        }

        @Test
        @DisplayName("a failed action appends nothing")
        void failedAction() {
            String key = newGame(60);
            service.addPlayer(key, "Ann", false, false);
            service.addPlayer(key, "Bob", false, false);
            service.playIfReady(key);
            Game game = service.cached(key);
            String waiting = game.nextPlayer(game.current().orElseThrow()).getKey();

            assertThatThrownBy(() -> service.pass(key, waiting)).isInstanceOf(IllegalStateException.class);
            assertThat(game.getTurns()).isEmpty();
        }

        @Test
        @DisplayName("confirming game over requires a seated player")
        void confirmGameOverUnknownPlayer() {
            String key = newGame(60);
            service.addPlayer(key, "Ann", false, false);

            assertThatThrownBy(() -> service.confirmGameOver(key, "ghost")).isInstanceOf(IllegalStateException.class);
            assertThat(service.getGame(key).isPlaying()).isTrue();
        }
    }

    @Nested
    @DisplayName("robots")
    class RobotTests {

        @Test
        @DisplayName("a robot moves after a delay and stops at the human")
        void robotThenHuman() {
            String key = newGame(60);
            Player human = service.addPlayer(key, "Ann", false, false);
            Player robot = service.addPlayer(key, null, true, false);
            Game game = service.cached(key);
            game.setCurrentPlayerKey(robot.getKey());
            service.playIfReady(key);

            capturedRobotTask().run();

            assertThat(game.getTurns()).hasSize(1);
            assertThat(game.getTurns().get(0).getType()).isEqualTo(TurnType.PASSED);
            assertThat(game.getCurrentPlayerKey()).isEqualTo(human.getKey());
        }

        @Test
        @DisplayName("robots keep playing each other in a loop until the game ends")
        void robotsOnly() {
            String key = newGame(0);
            service.addPlayer(key, null, true, false);
            service.addPlayer(key, null, true, false);
            service.playIfReady(key);
            Game game = service.cached(key);

            capturedRobotTask().run();

            assertThat(game.getState()).isEqualTo(GameStatus.ALL_PASSED_TWICE);
            assertThat(game.getTurns()).extracting(Turn::getType)
                    .containsExactly(TurnType.PASSED, TurnType.PASSED, TurnType.PASSED, TurnType.GAME_ENDED);
            verify(notifier).notifyAll(eq(key), eq(GameEvents.GAME_OVER_CONFIRMED), any());
        }
    }

    @Nested
    @DisplayName("timeouts")
    class TimeoutTests {

        private String key;
        private Game game;

        @BeforeEach
        void started() {
            key = newGame(60);
            service.addPlayer(key, "Ann", false, false);
            service.addPlayer(key, "Bob", false, false);
            service.playIfReady(key);
            game = service.cached(key);
        }

        @Test
        @DisplayName("a current timeout passes the player with type timeout")
        void timeout() {
            String current = game.getCurrentPlayerKey();

            service.onTurnTimeout(key, current, game.getClockVersion());

            assertThat(game.getTurns()).extracting(Turn::getType).containsExactly(TurnType.TIMEOUT);
            assertThat(game.getCurrentPlayerKey()).isNotEqualTo(current);
        }

        @Test
        @DisplayName("stale timeouts are ignored")
        void stale() {
            String current = game.getCurrentPlayerKey();
            String other = game.nextPlayer(game.current().orElseThrow()).getKey();

            service.onTurnTimeout(key, current, game.getClockVersion() - 1);
            service.onTurnTimeout(key, other, game.getClockVersion());

            assertThat(game.getTurns()).isEmpty();
            assertThat(game.getCurrentPlayerKey()).isEqualTo(current);
        }

        @Test
        @DisplayName("timeouts while paused are ignored")
        void paused() {
            String current = game.getCurrentPlayerKey();
            service.togglePause(key, current);

            service.onTurnTimeout(key, current, game.getClockVersion());

            assertThat(game.getTurns()).isEmpty();
            verify(notifier).notifyAll(eq(key), eq(GameEvents.PAUSE), any());
        }

        @Test
        @DisplayName("an inactive game is timed out by the sweep check")
        void inactive() {
            game.setCreationTimestamp(0);
            when(gameRepo.exists(key)).thenReturn(true);

            assertThat(service.checkTimeout(key)).isTrue();
            assertThat(game.getState()).isEqualTo(GameStatus.TIMED_OUT);
            assertThat(clock.isRunning(key)).isFalse();
            verify(notifier).notifyAll(eq(key), eq(GameEvents.GAME_OVER_CONFIRMED), any());
            assertThat(service.cached(key)).isNull();
        }

        @Test
        @DisplayName("an expired game document is dropped from the index")
        void expired() {
            when(gameRepo.exists("gone")).thenReturn(false);

            assertThat(service.checkTimeout("gone")).isFalse();
            verify(gameRepo).delete("gone");
            verify(gameRepo, never()).get("gone");
        }
    }

    @Nested
    @DisplayName("in-memory cache")
    class CacheTests {

        @Test
        @DisplayName("a game that ends leaves memory and releases its lock")
        void endedGameEvicted() {
            String key = startedGame("Ann", "Bob");
            Game game = service.cached(key);

            service.confirmGameOver(key, game.getPlayers().get(0).getKey());

            assertThat(game.getState()).isEqualTo(GameStatus.GAME_OVER);
            assertThat(service.cached(key)).isNull();
            verify(locks).forget(key);
            assertThat(locks.isTracked(key)).isFalse();
        }

        @Test
        @DisplayName("an ended game read back from Redis is served but not cached")
        void endedGameFromRedisNotCached() {
            Game ended = game(config().build());
            seat(ended, "ann", false);
            seat(ended, "bob", false);
            ended.finish(GameStatus.GAME_OVER);
            when(gameRepo.get(ended.getKey())).thenReturn(Optional.of(ended));

            assertThat(service.summary(ended.getKey())).isNotNull();
            assertThat(service.cached(ended.getKey())).isNull();
            assertThat(locks.isTracked(ended.getKey())).isFalse();
        }

        @Test
        @DisplayName("the sweep drops a cached game whose document has expired")
        void expiredCachedGameDropped() {
            String key = startedGame("Ann", "Bob");
            when(gameRepo.exists(key)).thenReturn(false);

            assertThat(service.checkTimeout(key)).isFalse();

            verify(gameRepo).delete(key);
            assertThat(service.cached(key)).isNull();
            assertThat(clock.isRunning(key)).isFalse();
            assertThat(locks.isTracked(key)).isFalse();
        }

        @Test
        @DisplayName("an active game stays cached and keeps its lock")
        void activeGameKept() {
            String key = startedGame("Ann", "Bob");

            service.getGame(key);

            assertThat(service.cached(key)).isNotNull();
            assertThat(locks.isTracked(key)).isTrue();
            verify(locks, never()).forget(key);
        }
    }
}
