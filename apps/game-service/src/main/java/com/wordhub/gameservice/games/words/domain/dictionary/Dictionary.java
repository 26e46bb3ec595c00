package com.wordhub.gameservice.games.words.domain.dictionary;

import java.util.stream.Stream;

/**
 * 词典：判断单词是否合法。单词按大写比较。
 */
public interface Dictionary {

    String name();

    boolean hasWord(String word);

    /** 全部单词（求解器遍历用） */
    Stream<String> words();
}
