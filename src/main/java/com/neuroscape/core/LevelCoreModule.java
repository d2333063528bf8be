package com.neuroscape.core;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.neuroscape.config.GeneratorConfig;
import com.neuroscape.util.Randomization;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;

/**
 * Guice module for the level core.
 *
 * <p>Components are {@code @Singleton} annotated on the classes themselves; this module
 * supplies the configuration, the shared random source and the Gson instance used to read
 * the level table.
 */
@Slf4j
public class LevelCoreModule extends AbstractModule {

    private final GeneratorConfig config;

    @Nullable
    private final Long seed;

    public LevelCoreModule() {
        this(GeneratorConfig.DEFAULT, null);
    }

    /**
     * @param config generator configuration
     * @param seed   random seed for reproducible levels, or null for an unseeded source
     */
    public LevelCoreModule(GeneratorConfig config, @Nullable Long seed) {
        config.validate();
        this.config = config;
        this.seed = seed;
    }

    @Override
    protected void configure() {
        // Bindings come from @Singleton classes and the providers below
    }

    @Provides
    @Singleton
    GeneratorConfig provideGeneratorConfig() {
        return config;
    }

    @Provides
    @Singleton
    Randomization provideRandomization() {
        if (seed != null) {
            log.info("Level generation seeded with {}", seed);
            return new Randomization(seed);
        }
        return new Randomization();
    }

    @Provides
    @Singleton
    Gson provideGson() {
        return new GsonBuilder().create();
    }
}
