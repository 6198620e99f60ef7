package component.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import component.ColorPalette;
import component.GameConfig;

/**
 * LevelConfigLoader
 * -----------------------
 * - reads / writes a level description as JSON (Gson)
 * - missing fields fall back to defaults, broken ones raise LevelConfigException
 *
 * <pre>
 * {
 *   "columns": 8, "rows": 10, "minGroupSize": 2, "guaranteedColorCount": 1,
 *   "thresholds": { "a": 4, "b": 7, "c": 9 },
 *   "colors": [ { "id": 0, "name": "BLUE" }, ... ],
 *   "layout": [ 0, 1, 2, ... ]          // optional, row-major, bottom row first
 * }
 * </pre>
 */
public final class LevelConfigLoader {

    public static final String DEFAULT_LEVEL = "levels/default-level.json";

    private static final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    // === JSON shape ===
    static class LevelFile {
        Integer columns;
        Integer rows;
        Integer minGroupSize;
        Integer guaranteedColorCount;
        Thresholds thresholds;
        List<ColorEntry> colors;
        int[] layout;
        Boolean animated;
    }

    static class Thresholds {
        Integer a;
        Integer b;
        Integer c;
    }

    static class ColorEntry {
        Integer id;
        String name;
    }

    private LevelConfigLoader() {
    }

    public static GameConfig loadDefault() {
        return loadResource(DEFAULT_LEVEL);
    }

    public static GameConfig loadResource(String resourcePath) {
        InputStream in = LevelConfigLoader.class.getClassLoader().getResourceAsStream(resourcePath);
        if (in == null) {
            throw new LevelConfigException("level resource not found: " + resourcePath);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return load(reader);
        } catch (IOException e) {
            throw new LevelConfigException("cannot read level resource " + resourcePath, e);
        }
    }

    public static GameConfig loadFile(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return load(reader);
        } catch (IOException e) {
            throw new LevelConfigException("cannot read level file " + file, e);
        }
    }

    public static GameConfig fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new LevelConfigException("level json is empty");
        }
        try {
            return toConfig(gson.fromJson(json, LevelFile.class));
        } catch (JsonParseException e) {
            throw new LevelConfigException("malformed level json: " + e.getMessage(), e);
        }
    }

    public static GameConfig load(Reader reader) {
        try {
            return toConfig(gson.fromJson(reader, LevelFile.class));
        } catch (JsonParseException e) {
            throw new LevelConfigException("malformed level json: " + e.getMessage(), e);
        }
    }

    public static String toJson(GameConfig config) {
        ColorPalette palette = config.palette();

        LevelFile file = new LevelFile();
        file.columns = config.columns();
        file.rows = config.rows();
        file.minGroupSize = palette.minGroupSize();
        file.guaranteedColorCount = config.guaranteedColorCount();
        file.thresholds = new Thresholds();
        file.thresholds.a = palette.thresholdA();
        file.thresholds.b = palette.thresholdB();
        file.thresholds.c = palette.thresholdC();
        file.colors = new ArrayList<>();
        for (ColorPalette.TileColor c : palette.colors()) {
            ColorEntry e = new ColorEntry();
            e.id = c.id;
            e.name = c.name;
            file.colors.add(e);
        }
        file.layout = config.layout();
        file.animated = config.animated();
        return gson.toJson(file);
    }

    // ============================================
    // validation
    // ============================================
    private static GameConfig toConfig(LevelFile file) {
        if (file == null) {
            throw new LevelConfigException("level json is empty");
        }
        if (file.columns == null || file.columns <= 0) {
            throw new LevelConfigException("columns must be a positive number, got " + file.columns);
        }
        if (file.rows == null || file.rows <= 0) {
            throw new LevelConfigException("rows must be a positive number, got " + file.rows);
        }
        if (file.colors == null || file.colors.isEmpty()) {
            throw new LevelConfigException("colors must list at least one color");
        }

        List<ColorPalette.TileColor> colors = new ArrayList<>();
        for (int i = 0; i < file.colors.size(); i++) {
            ColorEntry e = file.colors.get(i);
            if (e == null || e.id == null || e.id < 0) {
                throw new LevelConfigException("colors[" + i + "].id must be a non-negative number");
            }
            for (ColorPalette.TileColor existing : colors) {
                if (existing.id == e.id) {
                    throw new LevelConfigException("colors[" + i + "].id " + e.id + " is duplicated");
                }
            }
            colors.add(new ColorPalette.TileColor(e.id, e.name != null ? e.name : "COLOR_" + e.id));
        }

        int minGroup = file.minGroupSize != null ? file.minGroupSize : ColorPalette.DEFAULT_MIN_GROUP_SIZE;
        if (minGroup < 1) {
            throw new LevelConfigException("minGroupSize must be >= 1, got " + minGroup);
        }

        int a = ColorPalette.DEFAULT_THRESHOLD_A;
        int b = ColorPalette.DEFAULT_THRESHOLD_B;
        int c = ColorPalette.DEFAULT_THRESHOLD_C;
        if (file.thresholds != null) {
            if (file.thresholds.a != null) a = file.thresholds.a;
            if (file.thresholds.b != null) b = file.thresholds.b;
            if (file.thresholds.c != null) c = file.thresholds.c;
        }
        if (!(a < b && b < c)) {
            throw new LevelConfigException("thresholds must increase (a < b < c), got " + a + ", " + b + ", " + c);
        }

        int guaranteed = file.guaranteedColorCount != null
                ? file.guaranteedColorCount : GameConfig.DEFAULT_GUARANTEED_COLORS;
        if (guaranteed < 0) {
            throw new LevelConfigException("guaranteedColorCount must be >= 0, got " + guaranteed);
        }

        if (file.layout != null && file.layout.length != file.columns * file.rows) {
            throw new LevelConfigException("layout has " + file.layout.length + " cells, expected "
                    + (file.columns * file.rows));
        }

        ColorPalette palette = new ColorPalette(colors, minGroup, a, b, c);
        boolean animated = file.animated != null && file.animated;
        GameConfig config = new GameConfig(file.columns, file.rows, palette, guaranteed, file.layout, animated);
        System.out.println("[LevelConfigLoader] loaded " + config);
        return config;
    }
}
