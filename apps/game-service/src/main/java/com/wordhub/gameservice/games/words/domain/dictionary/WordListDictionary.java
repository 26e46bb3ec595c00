package com.wordhub.gameservice.games.words.domain.dictionary;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 基于内存单词表的词典。
 */
public class WordListDictionary implements Dictionary {

    private final String name;
    private final Set<String> words;

    public WordListDictionary(String name, Collection<String> words) {
        this.name = name;
        this.words = words.stream()
                .map(String::trim)
                .filter(w -> !w.isEmpty())
                .map(w -> w.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean hasWord(String word) {
        return word != null && words.contains(word.toUpperCase(Locale.ROOT));
    }

    @Override
    public Stream<String> words() {
        return words.stream();
    }

    public int size() {
        return words.size();
    }
}
