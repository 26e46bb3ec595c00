package com.wordhub.gameservice.games.words.domain.model;

import com.wordhub.gameservice.games.words.domain.enums.SwapPassPolicy;
import com.wordhub.gameservice.games.words.domain.exception.GameConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.wordhub.gameservice.games.words.support.WordGameFixtures.EDITION;
import static com.wordhub.gameservice.games.words.support.WordGameFixtures.game;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GameConfigTest {

    @Test
    @DisplayName("fills defaults")
    void defaults() {
        GameConfig c = GameConfig.builder().edition(EDITION).dictionary("none").secondsPerPlay(-5).build();

        assertThat(c.dictionary()).isNull();
        assertThat(c.secondsPerPlay()).isZero();
        assertThat(c.minPlayers()).isEqualTo(GameConfig.DEFAULT_MIN_PLAYERS);
        assertThat(c.maxPlayers()).isZero();
        assertThat(c.swapPassPolicy()).isEqualTo(SwapPassPolicy.COUNT_ONLY);
    }

    @Test
    @DisplayName("maxPlayers below minPlayers means unlimited")
    void maxBelowMin() {
        GameConfig c = GameConfig.builder().edition(EDITION).minPlayers(3).maxPlayers(2).build();

        assertThat(c.maxPlayers()).isZero();
    }

    @Test
    @DisplayName("edition is required")
    void editionRequired() {
        assertThatThrownBy(() -> GameConfig.builder().edition(" ").build())
                .isInstanceOf(GameConfigurationException.class);
    }

    @Test
    @DisplayName("projects the configuration of an existing game")
    void ofGame() {
        GameConfig original = GameConfig.builder()
                .edition(EDITION).dictionary("Test").secondsPerPlay(90)
                .minPlayers(2).maxPlayers(4).allowTakeBack(true).checkDictionary(true)
                .swapPassPolicy(SwapPassPolicy.END_GAME)
                .build();

        assertThat(GameConfig.of(game(original))).isEqualTo(original);
    }
}
