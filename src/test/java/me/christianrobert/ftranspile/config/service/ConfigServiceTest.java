package me.christianrobert.ftranspile.config.service;

import me.christianrobert.ftranspile.codegen.CodegenOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for typed access to configuration values and the derived settings objects.
 */
class ConfigServiceTest {

    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
    }

    @Test
    void defaultsAreLenientWithStandardLayout() {
        assertFalse(configService.getFrontendConfig().isStrictMode());

        CodegenOptions options = configService.getCodegenOptions();
        assertEquals(CodegenOptions.DEFAULT_LINEWIDTH, options.getLinewidth());
        assertEquals(CodegenOptions.DEFAULT_CHUNKING, options.getChunking());
        assertFalse(options.isConservative());
        assertEquals(List.of("macro-marker"),
                configService.getConfigValueAsStringList(ConfigService.PREPROCESSING_RULES));
    }

    @Test
    void stringValuesAreConverted() {
        // Given
        configService.updateConfiguration(Map.of(
                ConfigService.STRICT_MODE, "true",
                ConfigService.LINEWIDTH, " 72 ",
                ConfigService.CONSERVATIVE, true));

        // Then
        assertTrue(configService.getFrontendConfig().isStrictMode());
        assertEquals(72, configService.getCodegenOptions().getLinewidth());
        assertTrue(configService.getCodegenOptions().isConservative());
    }

    @Test
    void invalidNumberFallsBackToDefault() {
        configService.setConfigValue(ConfigService.CHUNKING, "many");

        assertNull(configService.getConfigValueAsInteger(ConfigService.CHUNKING));
        assertEquals(CodegenOptions.DEFAULT_CHUNKING, configService.getCodegenOptions().getChunking());
    }

    @Test
    void stringListTrimsAndDropsEmptyEntries() {
        configService.setConfigValue("custom.list", " a, ,b ,, c");

        assertEquals(List.of("a", "b", "c"), configService.getConfigValueAsStringList("custom.list"));
        assertTrue(configService.getConfigValueAsStringList("missing.key").isEmpty());
    }

    @Test
    void stringListAcceptsNonStringValues() {
        configService.setConfigValue("custom.number", 42);

        assertEquals(List.of("42"), configService.getConfigValueAsStringList("custom.number"));
    }

    @Test
    void resetRestoresDefaults() {
        // Given
        configService.setConfigValue(ConfigService.STRICT_MODE, true);
        configService.setConfigValue("custom.key", "x");

        // When
        configService.resetToDefaults();

        // Then
        assertFalse(configService.hasConfigKey("custom.key"));
        assertFalse(configService.getConfigValueAsBoolean(ConfigService.STRICT_MODE));
    }

    @Test
    void allConfigurationIsACopy() {
        Map<String, Object> all = configService.getAllConfiguration();
        all.put(ConfigService.LINEWIDTH, 10);

        assertEquals(CodegenOptions.DEFAULT_LINEWIDTH, configService.getConfigValueAsInteger(ConfigService.LINEWIDTH));
    }
}
