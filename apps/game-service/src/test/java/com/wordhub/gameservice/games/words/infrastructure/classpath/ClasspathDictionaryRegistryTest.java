package com.wordhub.gameservice.games.words.infrastructure.classpath;

import com.wordhub.gameservice.games.words.domain.dictionary.Dictionary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClasspathDictionaryRegistryTest {

    private final ClasspathDictionaryRegistry registry = new ClasspathDictionaryRegistry();

    @Test
    @DisplayName("the sample word list loads without its comment line")
    void sample() {
        Dictionary dict = registry.find("SOWPODS_Sample").orElseThrow();

        assertThat(dict.hasWord("able")).isTrue();
        assertThat(dict.hasWord("AA")).isTrue();
        assertThat(dict.hasWord("QZX")).isFalse();
        assertThat(dict.words()).noneMatch(w -> w.startsWith("#"));
    }

    @Test
    @DisplayName("a missing dictionary is reported as unavailable")
    void missing() {
        assertThat(registry.find("Nope")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
        assertThat(registry.find("../x")).isEmpty();
    }
}
