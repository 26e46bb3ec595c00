package com.wordhub.gameservice.games.words.domain.rule;

import com.wordhub.gameservice.games.words.domain.exception.GameInvariantException;
import com.wordhub.gameservice.games.words.domain.model.Player;
import com.wordhub.gameservice.games.words.domain.model.Rack;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.wordhub.gameservice.games.words.support.WordGameFixtures.tile;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EndGameScorerTest {

    private static Player player(String key, String letters) {
        Player p = new Player(key, key, false, false);
        Rack rack = new Rack();
        for (char c : letters.toCharArray()) rack.addTile(tile(c));
        p.setRack(rack);
        return p;
    }

    @Test
    @DisplayName("the player who went out collects everyone else's rack points")
    void zeroSumWithOneEmptyRack() {
        List<Player> players = List.of(player("A", ""), player("B", "CB"), player("C", "E_"));

        Map<String, Integer> deltas = EndGameScorer.computeDeltas(players);

        assertThat(deltas).containsExactly(Map.entry("A", 7), Map.entry("B", -6), Map.entry("C", -1));
        assertThat(deltas.values().stream().mapToInt(Integer::intValue).sum()).isZero();
    }

    @Test
    @DisplayName("with nobody out every rack is only penalised")
    void nobodyOut() {
        Map<String, Integer> deltas = EndGameScorer.computeDeltas(List.of(player("A", "A"), player("B", "T")));

        assertThat(deltas).containsEntry("A", -1).containsEntry("B", -1);
        assertThat(deltas.values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(-2);
    }

    @Test
    @DisplayName("more than one empty rack is an invariant violation and nothing is applied")
    void twoEmptyRacks() {
        Player a = player("A", "");
        Player b = player("B", "");
        a.setScore(10);

        assertThatThrownBy(() -> EndGameScorer.computeDeltas(List.of(a, b, player("C", "C"))))
                .isInstanceOf(GameInvariantException.class);
        assertThat(a.getScore()).isEqualTo(10);
    }

    @Test
    @DisplayName("apply adds the deltas to the running scores")
    void apply() {
        Player a = player("A", "");
        Player b = player("B", "BB");
        a.setScore(20);
        b.setScore(30);

        EndGameScorer.apply(List.of(a, b), EndGameScorer.computeDeltas(List.of(a, b)));

        assertThat(a.getScore()).isEqualTo(26);
        assertThat(b.getScore()).isEqualTo(24);
    }
}
