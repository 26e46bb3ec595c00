package com.wordhub.gameservice.games.words.support;

import com.wordhub.gameservice.games.words.domain.model.Edition;
import com.wordhub.gameservice.games.words.domain.model.Game;
import com.wordhub.gameservice.games.words.domain.model.GameConfig;
import com.wordhub.gameservice.games.words.domain.model.Move;
import com.wordhub.gameservice.games.words.domain.model.Placement;
import com.wordhub.gameservice.games.words.domain.model.Player;
import com.wordhub.gameservice.games.words.domain.model.Rack;
import com.wordhub.gameservice.games.words.domain.model.Tile;
import com.wordhub.gameservice.games.words.domain.model.WordPlay;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 测试用的版本、对局和牌架构造工具。
 */
public final class WordGameFixtures {

    public static final String EDITION = "Test_Edition";

    private WordGameFixtures() {}

    /** 15x15，牌架 7 张，共 86 张牌 */
    public static Edition edition() {
        Edition ed = new Edition();
        ed.setName(EDITION);
        ed.setCols(15);
        ed.setRows(15);
        ed.setRackCount(7);
        ed.getLetters().add(spec("_", 2, 0));
        ed.getLetters().add(spec("A", 20, 1));
        ed.getLetters().add(spec("B", 10, 3));
        ed.getLetters().add(spec("C", 10, 3));
        ed.getLetters().add(spec("E", 24, 1));
        ed.getLetters().add(spec("T", 20, 1));
        return ed;
    }

    private static Edition.LetterSpec spec(String letter, int count, int score) {
        Edition.LetterSpec s = new Edition.LetterSpec();
        s.setLetter(letter);
        s.setCount(count);
        s.setScore(score);
        return s;
    }

    public static GameConfig.GameConfigBuilder config() {
        return GameConfig.builder().edition(EDITION).secondsPerPlay(60).minPlayers(2);
    }

    public static Game game(GameConfig config) {
        return new Game(config).create(edition());
    }

    public static Player seat(Game game, String key, boolean robot) {
        Player p = new Player(key, key, robot, robot);
        game.addPlayer(p);
        return p;
    }

    /**
     * 把玩家牌架换成指定字母（'_' 为空白牌）。旧牌还回袋中，新牌从袋中取，总数不变。
     */
    public static void setRack(Game game, Player player, String letters) {
        player.returnTiles(game.getLetterBag());
        for (char c : letters.toCharArray()) {
            player.getRack().addTile(takeFromBag(game, c));
        }
    }

    private static Tile takeFromBag(Game game, char c) {
        Tile like = c == '_' ? Tile.blankTile() : Tile.of(c, 0);
        for (Iterator<Tile> it = game.getLetterBag().getTiles().iterator(); it.hasNext(); ) {
            Tile t = it.next();
            if (t.sameFace(like)) {
                it.remove();
                return t;
            }
        }
        throw new IllegalStateException("bag has no " + c);
    }

    public static Tile tile(char c) {
        if (c == '_') return Tile.blankTile();
        return Tile.of(c, edition().scoreOf(c));
    }

    /**
     * 从 (col,row) 起横向放一个单词，得分取牌面之和。
     */
    public static Move across(String word, int col, int row) {
        List<Placement> placements = new ArrayList<>();
        int score = 0;
        for (int i = 0; i < word.length(); i++) {
            Tile t = tile(word.charAt(i));
            placements.add(new Placement(t, col + i, row));
            score += t.getScore();
        }
        return new Move(placements, score, List.of(new WordPlay(word, score)));
    }

    /** 牌架字母排序后拼成的字符串，空白牌记为 '_' */
    public static String letters(Rack rack) {
        return rack.getTiles().stream()
                .map(t -> t.isBlank() ? "_" : String.valueOf(t.getLetter()))
                .sorted()
                .collect(Collectors.joining());
    }
}
