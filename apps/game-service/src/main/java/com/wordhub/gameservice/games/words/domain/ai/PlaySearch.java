package com.wordhub.gameservice.games.words.domain.ai;

import com.wordhub.gameservice.games.words.domain.model.Board;
import com.wordhub.gameservice.games.words.domain.model.Tile;

import java.util.List;

/**
 * 一次最佳走法搜索的输入。board 与 rack 都是副本，求解器可以随意读取。
 */
public record PlaySearch(Board board, String dictionary, List<Tile> rack) {

    public PlaySearch {
        rack = List.copyOf(rack);
    }
}
