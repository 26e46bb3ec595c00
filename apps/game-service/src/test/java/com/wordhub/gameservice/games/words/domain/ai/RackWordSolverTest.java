package com.wordhub.gameservice.games.words.domain.ai;

import com.wordhub.gameservice.games.words.domain.dictionary.Dictionary;
import com.wordhub.gameservice.games.words.domain.dictionary.WordListDictionary;
import com.wordhub.gameservice.games.words.domain.model.Board;
import com.wordhub.gameservice.games.words.domain.model.Move;
import com.wordhub.gameservice.games.words.domain.model.Placement;
import com.wordhub.gameservice.games.words.domain.model.Tile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.wordhub.gameservice.games.words.support.WordGameFixtures.tile;
import static org.assertj.core.api.Assertions.assertThat;

class RackWordSolverTest {

    private Dictionary dict;
    private RackWordSolver solver;

    @BeforeEach
    void setUp() {
        dict = new WordListDictionary("Test", List.of("CAB", "AT", "BEAT", "TEA"));
        solver = new RackWordSolver(name -> "Test".equals(name) ? Optional.of(dict) : Optional.empty(), Runnable::run);
    }

    private static List<Tile> rack(String letters) {
        return letters.chars().mapToObj(c -> tile((char) c)).toList();
    }

    @Test
    @DisplayName("opens across the centre with the highest scoring word")
    void opening() {
        Board board = new Board(15, 15);

        Optional<Move> best = solver.bestPlay(board, dict, rack("CABTE"), msg -> {});

        assertThat(best).isPresent();
        Move move = best.get();
        // BEAT 3+1+1+1=6 < CAB 3+1+3=7
        assertThat(move.wordList()).containsExactly("CAB");
        assertThat(move.getScore()).isEqualTo(7);
        assertThat(move.getPlacements()).extracting(Placement::getRow).containsOnly(7);
        assertThat(move.getPlacements()).anyMatch(p -> p.getCol() == 7);
    }

    @Test
    @DisplayName("plays through a letter already on the board")
    void throughAnchor() {
        Board board = new Board(15, 15);
        board.place(7, 7, tile('A'));

        Optional<Move> best = solver.bestPlay(board, dict, rack("CB"), msg -> {});

        assertThat(best).isPresent();
        assertThat(best.get().wordList()).containsExactly("CAB");
        assertThat(best.get().getPlacements()).hasSize(2);
        assertThat(best.get().getPlacements())
                .allMatch(p -> board.isEmptyAt(p.getCol(), p.getRow()));
    }

    @Test
    @DisplayName("uses a blank for a missing letter at zero score")
    void blank() {
        Optional<Move> best = solver.bestPlay(new Board(15, 15), dict, rack("C_B"), msg -> {});

        assertThat(best).isPresent();
        assertThat(best.get().getScore()).isEqualTo(6);
        assertThat(best.get().getPlacements()).anyMatch(p -> p.getTile().isBlank() && p.getTile().getLetter() == 'A');
    }

    @Test
    @DisplayName("finds nothing when no word fits the rack")
    void nothing() {
        assertThat(solver.bestPlay(new Board(15, 15), dict, rack("ZZ"), msg -> {})).isEmpty();
    }

    @Test
    @DisplayName("an unknown dictionary yields an empty result")
    void unknownDictionary() throws Exception {
        PlaySearch search = new PlaySearch(new Board(15, 15), "Missing", rack("CAB"));

        assertThat(solver.findBestPlay(search, msg -> {}).get()).isEmpty();
    }
}
