package com.neuroscape.generation;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.neuroscape.util.JsonResourceLoader;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Contents of one level in the progression: what to generate and what clearing it awards.
 */
@Value
@Builder
public class LevelConfig {

    int obstacleCount;

    int itemCount;

    int enemyCount;

    /** Health of the main block. */
    int blockHealth;

    /** Enemy kinds that may appear, e.g. "basic", "strong", "fire". */
    @Singular
    List<String> enemyTypes;

    /** Identifier of the card awarded for clearing the level. */
    String reward;

    /**
     * Generation request for this level on a grid of the given size.
     *
     * @throws IllegalArgumentException if the resulting parameters are invalid
     */
    public LevelParameters toParameters(int gridSize) {
        return LevelParameters.builder()
                .gridSize(gridSize)
                .obstacleCount(obstacleCount)
                .itemCount(itemCount)
                .enemyCount(enemyCount)
                .baseObstacleHealth(blockHealth)
                .build();
    }

    /**
     * Parse one entry of the level table.
     *
     * @throws JsonResourceLoader.JsonLoadException if a required field is missing
     */
    static LevelConfig fromJson(JsonObject obj) {
        List<String> types = new ArrayList<>();
        for (JsonElement type : JsonResourceLoader.getRequiredArray(obj, "enemyTypes")) {
            types.add(type.getAsString());
        }
        return LevelConfig.builder()
                .obstacleCount(JsonResourceLoader.getRequiredInt(obj, "obstacleCount"))
                .itemCount(JsonResourceLoader.getRequiredInt(obj, "itemCount"))
                .enemyCount(JsonResourceLoader.getRequiredInt(obj, "enemyCount"))
                .blockHealth(JsonResourceLoader.getRequiredInt(obj, "blockHealth"))
                .enemyTypes(types)
                .reward(obj.has("reward") ? obj.get("reward").getAsString() : null)
                .build();
    }
}
