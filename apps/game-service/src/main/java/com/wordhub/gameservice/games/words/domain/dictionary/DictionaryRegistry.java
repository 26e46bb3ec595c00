package com.wordhub.gameservice.games.words.domain.dictionary;

import java.util.Optional;

/**
 * 按名称查找词典；找不到表示词典不可用，调用方自行降级。
 */
public interface DictionaryRegistry {

    Optional<Dictionary> find(String name);
}
