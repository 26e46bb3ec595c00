package com.wordhub.gameservice.games.words.domain.model;

import com.wordhub.gameservice.games.words.domain.enums.GameStatus;
import com.wordhub.gameservice.games.words.domain.exception.GameConfigurationException;
import com.wordhub.gameservice.games.words.domain.exception.GameInvariantException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.wordhub.gameservice.games.words.support.WordGameFixtures.config;
import static com.wordhub.gameservice.games.words.support.WordGameFixtures.edition;
import static com.wordhub.gameservice.games.words.support.WordGameFixtures.game;
import static com.wordhub.gameservice.games.words.support.WordGameFixtures.seat;
import static com.wordhub.gameservice.games.words.support.WordGameFixtures.tile;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GameRosterTest {

    private Game game;

    @BeforeEach
    void setUp() {
        game = game(config().maxPlayers(3).build());
    }

    @Nested
    @DisplayName("addPlayer()")
    class AddPlayerTests {

        @Test
        @DisplayName("deals a full rack from the bag")
        void dealsRack() {
            int total = edition().totalTiles();

            Player a = seat(game, "A", false);

            assertThat(a.getRack().size()).isEqualTo(7);
            assertThat(game.getLetterBag().remainingTileCount()).isEqualTo(total - 7);
            assertThat(game.tileCount()).isEqualTo(total);
        }

        @Test
        @DisplayName("refuses a player beyond maxPlayers without touching the bag")
        void full() {
            seat(game, "A", false);
            seat(game, "B", false);
            seat(game, "C", false);
            int bag = game.getLetterBag().remainingTileCount();

            assertThatThrownBy(() -> seat(game, "D", false)).isInstanceOf(GameConfigurationException.class);
            assertThat(game.getPlayers()).hasSize(3);
            assertThat(game.getLetterBag().remainingTileCount()).isEqualTo(bag);
        }

        @Test
        @DisplayName("refuses when the bag cannot fill a rack")
        void bagTooSmall() {
            game.getLetterBag().setTiles(new ArrayList<>(List.of(tile('A'), tile('B'))));

            assertThatThrownBy(() -> seat(game, "A", false)).isInstanceOf(GameConfigurationException.class);
            assertThat(game.getPlayers()).isEmpty();
            assertThat(game.getLetterBag().remainingTileCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("refuses the same key twice")
        void duplicate() {
            seat(game, "A", false);

            assertThatThrownBy(() -> seat(game, "A", false)).isInstanceOf(GameConfigurationException.class);
        }

        @Test
        @DisplayName("refuses players once the game has ended")
        void ended() {
            game.finish(GameStatus.GAME_OVER);

            assertThatThrownBy(() -> seat(game, "A", false)).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("rotation")
    class RotationTests {

        @Test
        @DisplayName("next and previous wrap around the seating order")
        void wraps() {
            Player a = seat(game, "A", false);
            Player b = seat(game, "B", false);
            Player c = seat(game, "C", true);

            assertThat(game.nextPlayer(a)).isSameAs(b);
            assertThat(game.nextPlayer(c)).isSameAs(a);
            assertThat(game.previousPlayer(a)).isSameAs(c);
        }

        @Test
        @DisplayName("an unknown player key is an invariant violation")
        void unknownPlayer() {
            seat(game, "A", false);

            assertThatThrownBy(() -> game.requirePlayer("Z")).isInstanceOf(GameInvariantException.class);
            assertThatThrownBy(() -> game.nextPlayer(new Player("Z", "Z", false, false)))
                    .isInstanceOf(GameInvariantException.class);
        }

        @Test
        @DisplayName("removing a player returns their tiles to the bag")
        void removeReturnsTiles() {
            seat(game, "A", false);
            seat(game, "B", false);
            int total = game.tileCount();

            game.removePlayer("A");

            assertThat(game.getPlayers()).extracting(Player::getKey).containsExactly("B");
            assertThat(game.tileCount()).isEqualTo(total);
            assertThat(game.getLetterBag().remainingTileCount()).isEqualTo(total - 7);
        }
    }

    @Test
    @DisplayName("all passed twice needs every player at two passes")
    void allPassedTwice() {
        Player a = seat(game, "A", false);
        Player b = seat(game, "B", false);
        a.setPasses(2);
        b.setPasses(1);
        assertThat(game.allPassedTwice()).isFalse();

        b.setPasses(2);
        assertThat(game.allPassedTwice()).isTrue();
    }

    @Test
    @DisplayName("creating with a different edition is a configuration error")
    void editionMismatch() {
        Edition other = edition();
        other.setName("Other");

        assertThatThrownBy(() -> new Game(config().build()).create(other))
                .isInstanceOf(GameConfigurationException.class);
    }

    @Test
    @DisplayName("finish clears the current player and previous move")
    void finishClears() {
        Player a = seat(game, "A", false);
        game.setCurrentPlayerKey(a.getKey());
        game.setPreviousMove(new Move());

        game.finish(GameStatus.TIMED_OUT);

        assertThat(game.hasEnded()).isTrue();
        assertThat(game.getCurrentPlayerKey()).isNull();
        assertThat(game.getPreviousMove()).isNull();
        assertThatThrownBy(game::requirePlaying).isInstanceOf(IllegalStateException.class);
    }
}
