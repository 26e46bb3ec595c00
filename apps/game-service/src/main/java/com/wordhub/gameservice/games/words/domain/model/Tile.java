package com.wordhub.gameservice.games.words.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一张字母牌。空白牌分值为 0，落到棋盘上时才被指定字母。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Tile {

    /** 未指定字母的空白牌 */
    public static final char BLANK = ' ';

    private char letter;
    private int score;
    private boolean blank;

    public static Tile of(char letter, int score) {
        return new Tile(Character.toUpperCase(letter), score, false);
    }

    public static Tile blankTile() {
        return new Tile(BLANK, 0, true);
    }

    /**
     * 是否同一种牌：空白牌只与空白牌相同，其余按字母比较。
     */
    public boolean sameFace(Tile other) {
        if (other == null) return false;
        if (blank || other.blank) return blank && other.blank;
        return letter == other.letter;
    }

    public Tile copy() {
        return new Tile(letter, score, blank);
    }
}
