package com.wordhub.gameservice.games.words.infrastructure.classpath;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wordhub.gameservice.games.words.domain.constants.GameMessages;
import com.wordhub.gameservice.games.words.domain.exception.GameConfigurationException;
import com.wordhub.gameservice.games.words.domain.model.Edition;
import com.wordhub.gameservice.games.words.domain.repository.EditionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 从 classpath:editions/{name}.json 读取版本定义，读到后缓存。
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class ClasspathEditionRepository implements EditionRepository {

    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9_-]+");

    private final ObjectMapper objectMapper;
    private final Map<String, Edition> cache = new ConcurrentHashMap<>();

    @Override
    public Edition load(String name) {
        if (name == null || !SAFE_NAME.matcher(name).matches()) {
            throw new GameConfigurationException(GameMessages.formatEditionNotFound(name));
        }
        return cache.computeIfAbsent(name, this::read);
    }

    private Edition read(String name) {
        ClassPathResource res = new ClassPathResource("editions/" + name + ".json");
        if (!res.exists()) {
            throw new GameConfigurationException(GameMessages.formatEditionNotFound(name));
        }
        try (InputStream in = res.getInputStream()) {
            Edition ed = objectMapper.readValue(in, Edition.class);
            if (ed.getName() == null) ed.setName(name);
            log.info("加载版本 {}：{}x{}，牌架 {}，共 {} 张牌", name, ed.getCols(), ed.getRows(),
                    ed.getRackCount(), ed.totalTiles());
            return ed;
        } catch (IOException e) {
            throw new UncheckedIOException("读取版本文件失败: " + name, e);
        }
    }
}
