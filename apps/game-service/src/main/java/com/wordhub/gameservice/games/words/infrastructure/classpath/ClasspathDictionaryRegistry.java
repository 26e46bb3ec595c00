package com.wordhub.gameservice.games.words.infrastructure.classpath;

import com.wordhub.gameservice.games.words.domain.dictionary.Dictionary;
import com.wordhub.gameservice.games.words.domain.dictionary.DictionaryRegistry;
import com.wordhub.gameservice.games.words.domain.dictionary.WordListDictionary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 从 classpath:dictionaries/{name}.txt 懒加载单词表（每行一个词，# 开头为注释）。
 * 文件不存在或读取失败视为词典不可用，结果同样缓存。
 */
@Slf4j
@Component
public class ClasspathDictionaryRegistry implements DictionaryRegistry {

    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9_-]+");

    private final Map<String, Optional<Dictionary>> cache = new ConcurrentHashMap<>();

    @Override
    public Optional<Dictionary> find(String name) {
        if (name == null || !SAFE_NAME.matcher(name).matches()) {
            return Optional.empty();
        }
        return cache.computeIfAbsent(name, this::read);
    }

    private Optional<Dictionary> read(String name) {
        ClassPathResource res = new ClassPathResource("dictionaries/" + name + ".txt");
        if (!res.exists()) {
            log.warn("词典 {} 不存在", name);
            return Optional.empty();
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            List<String> words = reader.lines()
                    .map(String::trim)
                    .filter(l -> !l.isEmpty() && !l.startsWith("#"))
                    .toList();
            WordListDictionary dict = new WordListDictionary(name, words);
            log.info("加载词典 {}，共 {} 个单词", name, dict.size());
            return Optional.of(dict);
        } catch (IOException e) {
            log.warn("读取词典 {} 失败: {}", name, e.getMessage());
            return Optional.empty();
        }
    }
}
