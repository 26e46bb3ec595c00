package com.wordhub.gameservice.games.words.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一手所成的单词及其得分。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WordPlay {
    private String word;
    private int score;
}
