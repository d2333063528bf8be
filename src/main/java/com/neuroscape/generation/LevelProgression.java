package com.neuroscape.generation;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.neuroscape.util.JsonResourceLoader;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Difficulty curve across levels.
 *
 * <p>Early levels are hand-tuned entries of {@code levels.json}. Past the end of that table
 * the contents are derived from the level index:
 * <ul>
 *   <li>obstacles: {@code 20 + level}</li>
 *   <li>items: 5</li>
 *   <li>enemies: {@code min(5, 1 + level / 3)}</li>
 *   <li>main block health: {@code floor(10 * 1.2^(level - tableSize + 1))}</li>
 *   <li>enemy types: a suffix of basic, strong, fire starting at {@code level % 3}</li>
 * </ul>
 */
@Slf4j
@Singleton
public class LevelProgression {

    public static final String DEFAULT_RESOURCE = "/levels.json";

    /** Grid side used by the arena game. */
    public static final int DEFAULT_GRID_SIZE = 36;

    private static final List<String> ENEMY_TYPE_CYCLE = Arrays.asList("basic", "strong", "fire");

    private final List<LevelConfig> table;

    /**
     * Load the table from {@link #DEFAULT_RESOURCE}.
     *
     * @throws JsonResourceLoader.JsonLoadException if the resource is missing or malformed
     */
    @Inject
    public LevelProgression(Gson gson) {
        this(JsonResourceLoader.loadAndParse(gson, DEFAULT_RESOURCE, LevelProgression::parseTable));
        log.info("Loaded {} level entries from {}", table.size(), DEFAULT_RESOURCE);
    }

    public LevelProgression(List<LevelConfig> table) {
        this.table = Collections.unmodifiableList(new ArrayList<>(table));
    }

    /**
     * Parse the {@code levels} array of a level table document.
     */
    public static List<LevelConfig> parseTable(JsonObject root) {
        List<LevelConfig> levels = new ArrayList<>();
        for (JsonElement entry : JsonResourceLoader.getRequiredArray(root, "levels")) {
            levels.add(LevelConfig.fromJson(entry.getAsJsonObject()));
        }
        return levels;
    }

    public int getTableSize() {
        return table.size();
    }

    /**
     * Contents of a level.
     *
     * @param level zero-based level index
     * @return the table entry, or the derived configuration past the table
     * @throws IllegalArgumentException if the index is negative
     */
    public LevelConfig forLevel(int level) {
        if (level < 0) {
            throw new IllegalArgumentException("Level index must not be negative, got " + level);
        }
        if (level < table.size()) {
            return table.get(level);
        }
        int beyond = level - table.size() + 1;
        return LevelConfig.builder()
                .obstacleCount(20 + level)
                .itemCount(5)
                .enemyCount(Math.min(5, 1 + level / 3))
                .blockHealth((int) (10 * Math.pow(1.2, beyond)))
                .enemyTypes(ENEMY_TYPE_CYCLE.subList(level % 3, ENEMY_TYPE_CYCLE.size()))
                .reward("enemy_special_" + level)
                .build();
    }
}
