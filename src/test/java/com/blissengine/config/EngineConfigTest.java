package com.blissengine.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class EngineConfigTest {

    @Test
    void testDefaults() {
        EngineConfig config = EngineConfig.defaults();

        assertNotNull(config);
        assertEquals(Path.of(Constants.DEFAULT_DICTIONARY_PATH), config.getDictionaryPath());
        assertNull(config.getSemanticsPath());
        assertEquals(Constants.DEFAULT_LANGUAGE, config.getLanguage());
        assertEquals(Constants.MAX_COMPOSITION_TOKENS, config.getMaxCompositionTokens());
    }

    @Test
    void testSetters() {
        EngineConfig config = new EngineConfig();
        Path dictionaryPath = Path.of("./custom-dict.json");
        Path semanticsPath = Path.of("./custom-semantics.json");

        config.setDictionaryPath(dictionaryPath);
        config.setSemanticsPath(semanticsPath);
        config.setLanguage("sv");
        config.setMaxCompositionTokens(8);

        assertEquals(dictionaryPath, config.getDictionaryPath());
        assertEquals(semanticsPath, config.getSemanticsPath());
        assertEquals("sv", config.getLanguage());
        assertEquals(8, config.getMaxCompositionTokens());
    }
}
