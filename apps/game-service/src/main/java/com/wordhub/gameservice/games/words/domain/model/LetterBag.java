package com.wordhub.gameservice.games.words.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 牌袋：按版本的字母分布初始化，随机抽取。
 */
@Data
@NoArgsConstructor
public class LetterBag {

    private List<Tile> tiles = new ArrayList<>();

    public static LetterBag fromEdition(Edition edition) {
        LetterBag bag = new LetterBag();
        for (Edition.LetterSpec spec : edition.getLetters()) {
            for (int i = 0; i < spec.getCount(); i++) {
                bag.tiles.add(spec.blank() ? Tile.blankTile() : Tile.of(spec.getLetter().charAt(0), spec.getScore()));
            }
        }
        return bag;
    }

    /**
     * 随机取出一张；袋空时返回 empty。
     */
    @JsonIgnore
    public Optional<Tile> getRandomTile() {
        if (tiles.isEmpty()) return Optional.empty();
        int idx = ThreadLocalRandom.current().nextInt(tiles.size());
        return Optional.of(tiles.remove(idx));
    }

    public void returnTile(Tile tile) {
        tiles.add(tile.isBlank() ? Tile.blankTile() : tile);
    }

    public int remainingTileCount() {
        return tiles.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return tiles.isEmpty();
    }
}
