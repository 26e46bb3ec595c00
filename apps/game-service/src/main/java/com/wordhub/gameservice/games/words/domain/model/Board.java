package com.wordhub.gameservice.games.words.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 棋盘：cells[col][row]，空格为 null。
 * 只负责存放，不计算分值和成词。
 */
@Data
@NoArgsConstructor
public class Board {

    private int cols;
    private int rows;
    private Tile[][] cells;

    public Board(int cols, int rows) {
        this.cols = cols;
        this.rows = rows;
        this.cells = new Tile[cols][rows];
    }

    public boolean inBounds(int col, int row) {
        return col >= 0 && col < cols && row >= 0 && row < rows;
    }

    public Tile at(int col, int row) {
        return inBounds(col, row) ? cells[col][row] : null;
    }

    public boolean isEmptyAt(int col, int row) {
        return at(col, row) == null;
    }

    public void place(int col, int row, Tile tile) {
        if (!inBounds(col, row)) {
            throw new IndexOutOfBoundsException("(" + col + "," + row + ")");
        }
        cells[col][row] = tile;
    }

    /**
     * 拿走一格上的牌，返回原牌（可能为 null）。
     */
    public Tile remove(int col, int row) {
        Tile t = at(col, row);
        if (t != null) cells[col][row] = null;
        return t;
    }

    public int occupiedCount() {
        int n = 0;
        for (int c = 0; c < cols; c++) {
            for (int r = 0; r < rows; r++) {
                if (cells[c][r] != null) n++;
            }
        }
        return n;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return occupiedCount() == 0;
    }

    public int middleCol() {
        return cols / 2;
    }

    public int middleRow() {
        return rows / 2;
    }

    public Board copy() {
        Board b = new Board(cols, rows);
        for (int c = 0; c < cols; c++) {
            for (int r = 0; r < rows; r++) {
                if (cells[c][r] != null) b.cells[c][r] = cells[c][r].copy();
            }
        }
        return b;
    }
}
