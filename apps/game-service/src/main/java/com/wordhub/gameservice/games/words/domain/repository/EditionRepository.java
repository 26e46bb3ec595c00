package com.wordhub.gameservice.games.words.domain.repository;

import com.wordhub.gameservice.games.words.domain.model.Edition;

/**
 * 游戏版本加载。版本不存在时抛出 GameConfigurationException。
 */
public interface EditionRepository {

    Edition load(String name);
}
