package me.christianrobert.pyibackport.config.service;

import me.christianrobert.pyibackport.transformer.model.PythonVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
    }

    @Test
    void defaults() {
        assertEquals(PythonVersion.PY310, configService.getDefaultTarget());
        assertFalse(configService.isIncludeAst());
        assertEquals(List.of("builtins", "typing", "typing_extensions"), configService.getWildcardDenylist());
        assertEquals(3, configService.getAllConfiguration().size());
    }

    @Test
    void denylistIsTrimmedAndSkipsEmptyEntries() {
        configService.setConfigValue(ConfigService.WILDCARD_DENYLIST, " os , ,typing ");
        assertEquals(List.of("os", "typing"), configService.getWildcardDenylist());

        configService.setConfigValue(ConfigService.WILDCARD_DENYLIST, List.of("os", "sys"));
        assertEquals(List.of("os", "sys"), configService.getWildcardDenylist());

        configService.setConfigValue(ConfigService.WILDCARD_DENYLIST, "");
        assertTrue(configService.getWildcardDenylist().isEmpty());
    }

    @Test
    void valuesAreNormalized() {
        assertEquals(Boolean.TRUE, configService.setConfigValue(ConfigService.INCLUDE_AST, "TRUE"));
        assertTrue(configService.isIncludeAst());

        assertEquals("3.12", configService.setConfigValue(ConfigService.DEFAULT_TARGET, " 3.12 "));
        assertEquals(PythonVersion.PY312, configService.getDefaultTarget());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> configService.setConfigValue(ConfigService.DEFAULT_TARGET, "3.9"));
        assertThrows(IllegalArgumentException.class,
                () -> configService.setConfigValue(ConfigService.INCLUDE_AST, "yes"));
        assertThrows(IllegalArgumentException.class, () -> configService.setConfigValue("custom.key", 7));
        assertThrows(IllegalArgumentException.class,
                () -> configService.setConfigValue(ConfigService.INCLUDE_AST, null));

        assertEquals(PythonVersion.PY310, configService.getDefaultTarget());
        assertFalse(configService.isIncludeAst());
    }

    @Test
    void updateIsAllOrNothing() {
        assertThrows(IllegalArgumentException.class, () -> configService.updateConfiguration(
                Map.of(ConfigService.DEFAULT_TARGET, "3.12", ConfigService.INCLUDE_AST, "maybe")));

        assertEquals(PythonVersion.PY310, configService.getDefaultTarget());
    }

    @Test
    void updateAndReset() {
        configService.updateConfiguration(Map.of(ConfigService.DEFAULT_TARGET, "3.12", ConfigService.INCLUDE_AST, true));

        assertEquals(PythonVersion.PY312, configService.getDefaultTarget());
        assertTrue(configService.isIncludeAst());

        configService.resetToDefaults();

        assertEquals(PythonVersion.PY310, configService.getDefaultTarget());
        assertFalse(configService.isIncludeAst());
    }
}
