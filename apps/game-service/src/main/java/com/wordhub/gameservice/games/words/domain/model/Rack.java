package com.wordhub.gameservice.games.words.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * 玩家手中的牌架。按“牌面”做多重集合匹配。
 */
@Data
@NoArgsConstructor
public class Rack {

    private List<Tile> tiles = new ArrayList<>();

    public Rack(Collection<Tile> tiles) {
        tiles.forEach(this::addTile);
    }

    /**
     * 放入一张牌；空白牌回到牌架时恢复成未指定字母。
     */
    public void addTile(Tile tile) {
        tiles.add(tile.isBlank() ? Tile.blankTile() : tile);
    }

    /**
     * 取走一张与 like 同牌面的牌。
     */
    public Optional<Tile> removeTile(Tile like) {
        Iterator<Tile> it = tiles.iterator();
        while (it.hasNext()) {
            Tile t = it.next();
            if (t.sameFace(like)) {
                it.remove();
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    /**
     * 多重集合包含：wanted 中每张牌都能在牌架上找到各自不同的一张。
     */
    public boolean containsAll(Collection<Tile> wanted) {
        List<Tile> pool = new ArrayList<>(tiles);
        for (Tile w : wanted) {
            boolean found = false;
            for (Iterator<Tile> it = pool.iterator(); it.hasNext(); ) {
                if (it.next().sameFace(w)) {
                    it.remove();
                    found = true;
                    break;
                }
            }
            if (!found) return false;
        }
        return true;
    }

    /** 牌面分值之和（终局扣分用） */
    public int score() {
        int sum = 0;
        for (Tile t : tiles) sum += t.getScore();
        return sum;
    }

    public int size() {
        return tiles.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return tiles.isEmpty();
    }

    /** 牌架内容的深拷贝（交给求解器等外部协作者） */
    public List<Tile> snapshot() {
        List<Tile> out = new ArrayList<>(tiles.size());
        tiles.forEach(t -> out.add(t.copy()));
        return out;
    }
}
