package component.config;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import component.ColorPalette;
import component.GameConfig;

import static org.junit.Assert.*;

public class LevelConfigLoaderTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static void assertInvalid(String json, String fragment) {
        try {
            LevelConfigLoader.fromJson(json);
            fail("accepted: " + json);
        } catch (LevelConfigException e) {
            assertTrue(e.getMessage(), e.getMessage().contains(fragment));
        }
    }

    @Test
    public void testDefaultLevel() {
        GameConfig config = LevelConfigLoader.loadDefault();
        assertEquals(8, config.columns());
        assertEquals(10, config.rows());
        assertEquals(4, config.palette().size());
        assertEquals("RED", config.palette().nameOf(2));
        assertEquals(2, config.minGroupSize());
        assertEquals(1, config.guaranteedColorCount());
        assertEquals(4, config.palette().thresholdA());
        assertEquals(7, config.palette().thresholdB());
        assertEquals(9, config.palette().thresholdC());
        assertFalse(config.hasLayout());
        assertFalse(config.animated());
    }

    @Test
    public void testMissingFieldsUseDefaults() {
        GameConfig config = LevelConfigLoader.fromJson(
                "{\"columns\": 3, \"rows\": 2, \"colors\": [{\"id\": 0}, {\"id\": 5, \"name\": \"ORANGE\"}]}");
        assertEquals(ColorPalette.DEFAULT_MIN_GROUP_SIZE, config.minGroupSize());
        assertEquals(GameConfig.DEFAULT_GUARANTEED_COLORS, config.guaranteedColorCount());
        assertEquals(ColorPalette.DEFAULT_THRESHOLD_C, config.palette().thresholdC());
        assertEquals("COLOR_0", config.palette().nameOf(0));
        assertEquals("ORANGE", config.palette().nameOf(5));
        assertTrue(config.palette().isAvailable(5));
    }

    @Test
    public void testLayoutAndAnimatedFlag() {
        GameConfig config = LevelConfigLoader.fromJson("{\"columns\": 2, \"rows\": 2, \"animated\": true,"
                + " \"colors\": [{\"id\": 0}, {\"id\": 1}], \"layout\": [0, 1, 1, 0]}");
        assertTrue(config.animated());
        assertEquals(1, config.layoutColorAt(0, 1));
    }

    @Test
    public void testValidationMessages() {
        assertInvalid("{\"rows\": 2, \"colors\": [{\"id\": 0}]}", "columns");
        assertInvalid("{\"columns\": 2, \"rows\": 0, \"colors\": [{\"id\": 0}]}", "rows");
        assertInvalid("{\"columns\": 2, \"rows\": 2, \"colors\": []}", "colors");
        assertInvalid("{\"columns\": 2, \"rows\": 2, \"colors\": [{\"id\": 1}, {\"id\": 1}]}", "duplicated");
        assertInvalid("{\"columns\": 2, \"rows\": 2, \"colors\": [{\"name\": \"X\"}]}", "colors[0].id");
        assertInvalid("{\"columns\": 2, \"rows\": 2, \"minGroupSize\": 0, \"colors\": [{\"id\": 0}]}", "minGroupSize");
        assertInvalid("{\"columns\": 2, \"rows\": 2, \"thresholds\": {\"b\": 3}, \"colors\": [{\"id\": 0}]}",
                "thresholds");
        assertInvalid("{\"columns\": 2, \"rows\": 2, \"guaranteedColorCount\": -1, \"colors\": [{\"id\": 0}]}",
                "guaranteedColorCount");
        assertInvalid("{\"columns\": 2, \"rows\": 2, \"colors\": [{\"id\": 0}], \"layout\": [0, 0, 0]}", "layout");
    }

    @Test
    public void testMalformedJson() {
        assertInvalid("{\"columns\": ", "malformed");
        assertInvalid("{\"columns\": \"wide\"}", "malformed");
        assertInvalid("  ", "empty");
    }

    @Test
    public void testWrittenConfigLoadsBack() {
        GameConfig original = new GameConfig(2, 3, ColorPalette.defaultPalette(3), 2,
                new int[] { 0, 1, 2, 2, 1, 0 }, false);

        GameConfig loaded = LevelConfigLoader.fromJson(LevelConfigLoader.toJson(original));

        assertEquals(2, loaded.columns());
        assertEquals(3, loaded.rows());
        assertEquals(2, loaded.guaranteedColorCount());
        assertEquals("GREEN", loaded.palette().nameOf(1));
        assertArrayEquals(original.layout(), loaded.layout());
    }

    @Test
    public void testLoadFile() throws IOException {
        Path file = tmp.newFile("level.json").toPath();
        Files.write(file, "{\"columns\": 4, \"rows\": 5, \"colors\": [{\"id\": 0}, {\"id\": 1}]}"
                .getBytes(StandardCharsets.UTF_8));

        GameConfig config = LevelConfigLoader.loadFile(file);
        assertEquals(4, config.columns());
        assertEquals(5, config.rows());
    }

    @Test
    public void testMissingFileAndResource() {
        try {
            LevelConfigLoader.loadFile(tmp.getRoot().toPath().resolve("nope.json"));
            fail("missing file accepted");
        } catch (LevelConfigException e) {
            assertTrue(e.getCause() instanceof IOException);
        }
        try {
            LevelConfigLoader.loadResource("levels/nope.json");
            fail("missing resource accepted");
        } catch (LevelConfigException e) {
            assertTrue(e.getMessage().contains("not found"));
        }
    }
}
