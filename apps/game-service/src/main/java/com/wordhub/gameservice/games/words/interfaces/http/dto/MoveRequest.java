package com.wordhub.gameservice.games.words.interfaces.http.dto;

import com.wordhub.gameservice.games.words.domain.model.Move;
import com.wordhub.gameservice.games.words.domain.model.Placement;
import com.wordhub.gameservice.games.words.domain.model.WordPlay;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class MoveRequest {
    private List<Placement> placements = new ArrayList<>();
    private List<WordPlay> words = new ArrayList<>();
    private int score;

    public Move toMove() {
        return new Move(placements, score, words);
    }
}
