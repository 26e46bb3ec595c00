package com.wordhub.gameservice.games.words.domain.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 游戏版本：棋盘尺寸、牌架容量、字母分布与分值。
 * 由 classpath:editions/{name}.json 加载。
 */
@Data
@NoArgsConstructor
public class Edition {

    /** 版本文件中表示空白牌的字母 */
    public static final String BLANK_LETTER = "_";

    private String name;
    private int cols;
    private int rows;
    private int rackCount;
    private List<LetterSpec> letters = new ArrayList<>();

    @Data
    @NoArgsConstructor
    public static class LetterSpec {
        private String letter;
        private int count;
        private int score;

        public boolean blank() {
            return letter == null || letter.isBlank() || BLANK_LETTER.equals(letter);
        }
    }

    public int totalTiles() {
        return letters.stream().mapToInt(LetterSpec::getCount).sum();
    }

    /** 字母的标准分值，未知字母（含空白牌）为 0 */
    public int scoreOf(char letter) {
        for (LetterSpec spec : letters) {
            if (!spec.blank() && Character.toUpperCase(spec.getLetter().charAt(0)) == Character.toUpperCase(letter)) {
                return spec.getScore();
            }
        }
        return 0;
    }
}
