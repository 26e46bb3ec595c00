package com.wordhub.gameservice.games.words.domain.rule;

import com.wordhub.gameservice.games.words.domain.constants.GameMessages;
import com.wordhub.gameservice.games.words.domain.exception.GameConfigurationException;
import com.wordhub.gameservice.games.words.domain.exception.InsufficientTilesException;
import com.wordhub.gameservice.games.words.domain.model.Board;
import com.wordhub.gameservice.games.words.domain.model.Move;
import com.wordhub.gameservice.games.words.domain.model.Placement;
import com.wordhub.gameservice.games.words.domain.model.Player;
import com.wordhub.gameservice.games.words.domain.model.Tile;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 走子/换牌的纯校验（不修改任何状态）。
 * 只检查牌是否在牌架上、目标格是否可放；单词合法性由质疑流程裁决。
 */
public final class MoveValidator {

    private MoveValidator() {}

    public static void validateMove(Board board, Player player, Move move) {
        if (move == null || move.getPlacements() == null || move.getPlacements().isEmpty()) {
            throw new GameConfigurationException(GameMessages.formatIllegalMove(GameMessages.EMPTY_MOVE));
        }
        Set<Long> seen = new HashSet<>();
        for (Placement p : move.getPlacements()) {
            if (p.getTile() == null) {
                throw new GameConfigurationException(GameMessages.formatIllegalMove(GameMessages.TILES_NOT_ON_RACK));
            }
            if (!board.inBounds(p.getCol(), p.getRow())) {
                throw new GameConfigurationException(GameMessages.formatCell(GameMessages.OUT_OF_BOARD, p.getCol(), p.getRow()));
            }
            if (!board.isEmptyAt(p.getCol(), p.getRow())) {
                throw new GameConfigurationException(GameMessages.formatCell(GameMessages.CELL_OCCUPIED, p.getCol(), p.getRow()));
            }
            if (!seen.add(((long) p.getCol() << 32) | p.getRow())) {
                throw new GameConfigurationException(GameMessages.formatCell(GameMessages.DUPLICATE_CELL, p.getCol(), p.getRow()));
            }
        }
        if (!player.getRack().containsAll(move.placedTiles())) {
            throw new GameConfigurationException(GameMessages.formatIllegalMove(GameMessages.TILES_NOT_ON_RACK));
        }
    }

    /**
     * 换牌：先看袋中是否够，再看牌架上是否有这些牌。
     */
    public static void validateSwap(int bagRemaining, Player player, List<Tile> tiles) {
        if (tiles.size() > bagRemaining) {
            throw new InsufficientTilesException(tiles.size(), bagRemaining);
        }
        if (!player.getRack().containsAll(tiles)) {
            throw new GameConfigurationException(GameMessages.SWAP_NOT_ON_RACK);
        }
    }
}
