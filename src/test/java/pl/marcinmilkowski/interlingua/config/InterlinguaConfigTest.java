package pl.marcinmilkowski.interlingua.config;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class InterlinguaConfigTest {

    @Test
    @DisplayName("Bundled configuration should carry the tuned defaults")
    void testDefaults() {
        InterlinguaConfig config = InterlinguaConfig.defaults();
        assertEquals("1.0", config.getVersion());
        assertEquals(1000, config.vsa().dimension());
        assertEquals(0.6, config.lexer().fuzzyThreshold(), 1e-9);
        assertEquals(0.8, config.parser().ungroundedQuality(), 1e-9);
        assertEquals(10, config.discourse().focusBonus());
        assertEquals(3, config.discourse().conciseLimit());
        assertEquals(0.9, config.preprocess().defaultClaimConfidence(), 1e-9);
        assertSame(config, InterlinguaConfig.defaults());
    }

    @Test
    @DisplayName("Partial file should override only the values it names")
    void testPartialOverride() throws IOException {
        InterlinguaConfig config = InterlinguaConfig.load(Paths.get("src/test/resources/test-config.json"));
        assertEquals("test-1", config.getVersion());
        assertEquals(256, config.vsa().dimension());
        assertEquals(16, config.vsa().annMaxConnections());
        assertEquals(0.5, config.parser().ungroundedQuality(), 1e-9);
        assertEquals(1.0, config.parser().groundedQuality(), 1e-9);
        assertEquals(2, config.preprocess().batchWorkers());
        assertEquals(3, config.grounding().rounds());
    }

    @Test
    @DisplayName("Missing file should raise IOException")
    void testMissingFile() {
        Path missing = Paths.get("src/test/resources/no-such-config.json");
        IOException e = assertThrows(IOException.class, () -> InterlinguaConfig.load(missing));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    @DisplayName("Invalid values should be rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> InterlinguaConfig.fromJson("{}"));
        assertThrows(IllegalArgumentException.class, () -> InterlinguaConfig.fromJson("{not json"));
        assertThrows(IllegalArgumentException.class,
            () -> InterlinguaConfig.fromJson("{\"version\": \"x\", \"vsa\": {\"dimension\": 4096}}"));
        assertThrows(IllegalArgumentException.class,
            () -> InterlinguaConfig.fromJson("{\"version\": \"x\", \"grounding\": {\"neighbor_weight\": 1.5}}"));
        assertThrows(IllegalArgumentException.class,
            () -> InterlinguaConfig.fromJson("{\"version\": \"x\", \"lexer\": {\"compound_min_window\": 1}}"));
    }

    @Test
    @DisplayName("toJson() should reproduce an equivalent configuration")
    void testToJson() {
        InterlinguaConfig original = InterlinguaConfig.fromJson(
            "{\"version\": \"2.0\", \"discourse\": {\"normal_limit\": 12}}");
        InterlinguaConfig copy = InterlinguaConfig.fromJson(original.toJson().toJSONString());
        assertEquals("2.0", copy.getVersion());
        assertEquals(original.discourse(), copy.discourse());
        assertEquals(original.lexer(), copy.lexer());
        assertEquals(12, copy.discourse().normalLimit());
    }

    @Test
    @DisplayName("Exported configuration should load back from disk")
    void testSaveAndLoad(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("config.json");
        Files.writeString(file, InterlinguaConfig.defaults().toJson().toJSONString());
        InterlinguaConfig loaded = InterlinguaConfig.load(file);
        assertEquals(InterlinguaConfig.defaults().grounding(), loaded.grounding());
        assertEquals(InterlinguaConfig.defaults().preprocess(), loaded.preprocess());
    }
}
