package com.wordhub.gameservice.games.words.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一张牌落在 (col,row)。空白牌的 tile.letter 为玩家指定的字母。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Placement {
    private Tile tile;
    private int col;
    private int row;

    public Placement copy() {
        return new Placement(tile == null ? null : tile.copy(), col, row);
    }
}
