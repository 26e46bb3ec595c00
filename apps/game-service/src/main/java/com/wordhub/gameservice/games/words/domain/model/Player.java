package com.wordhub.gameservice.games.words.domain.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 对局中的一名玩家（人类或机器人）。
 */
@Data
@NoArgsConstructor
public class Player {

    private String key;
    private String name;
    private boolean robot;
    /** 机器人是否会质疑人类的上一手 */
    private boolean canChallenge;
    private int score;
    /** 连续 pass 次数，走子后清零 */
    private int passes;
    private Rack rack = new Rack();
    /** 本回合剩余秒数（暂停或撤回时使用） */
    private int secondsToPlay;
    private boolean wantsAdvice;

    public Player(String key, String name, boolean robot, boolean canChallenge) {
        this.key = key;
        this.name = name;
        this.robot = robot;
        this.canChallenge = canChallenge;
    }

    /**
     * 开下一局用：保留身份与偏好，分数和牌架清空。
     */
    public static Player seatedCopy(Player source) {
        Player p = new Player(source.key, source.name, source.robot, source.canChallenge);
        p.wantsAdvice = source.wantsAdvice;
        return p;
    }

    /**
     * 从袋中补牌直到牌架满或袋空。
     */
    public void fillRack(LetterBag bag, int rackSize) {
        while (rack.size() < rackSize) {
            Tile t = bag.getRandomTile().orElse(null);
            if (t == null) return;
            rack.addTile(t);
        }
    }

    /**
     * 把牌架上的牌全部还回袋中。
     */
    public List<Tile> returnTiles(LetterBag bag) {
        List<Tile> returned = new ArrayList<>(rack.getTiles());
        returned.forEach(bag::returnTile);
        rack.getTiles().clear();
        return returned;
    }

    public boolean toggleAdvice() {
        wantsAdvice = !wantsAdvice;
        return wantsAdvice;
    }
}
