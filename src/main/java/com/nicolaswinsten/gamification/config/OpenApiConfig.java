package com.nicolaswinsten.gamification.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI document served at {@code /v3/api-docs}, with the interactive UI at
 * {@code /swagger-ui.html}. Title and version follow {@link GamificationProperties}.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI gamificationOpenApi(GamificationProperties properties) {
        return new OpenAPI()
            .info(new Info()
                .title(properties.title())
                .version(properties.version())
                .description("Read-only demo data: users, badges, leaderboard and user summaries."));
    }
}
