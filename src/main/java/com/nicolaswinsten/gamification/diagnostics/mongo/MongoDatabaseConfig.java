package com.nicolaswinsten.gamification.diagnostics.mongo;

import com.nicolaswinsten.gamification.config.GamificationProperties;
import com.nicolaswinsten.gamification.diagnostics.DatabaseModule;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the MongoDB {@link DatabaseModule} when {@code gamification.database.enabled=true}.
 * Otherwise no module exists and {@code /test} reports it as not found.
 */
@Configuration
@ConditionalOnProperty(prefix = "gamification.database", name = "enabled", havingValue = "true")
public class MongoDatabaseConfig {

    @Bean
    public MongoDatabaseModule mongoDatabaseModule(GamificationProperties properties) {
        return new MongoDatabaseModule(properties.database());
    }
}
