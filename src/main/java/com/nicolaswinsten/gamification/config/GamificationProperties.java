package com.nicolaswinsten.gamification.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings bound from the {@code gamification.*} namespace.
 *
 * @param title    human-readable API name, echoed by {@code GET /}
 * @param version  reported by {@code GET /api/health}
 * @param database optional database probe settings
 */
@ConfigurationProperties(prefix = "gamification")
public record GamificationProperties(
    @DefaultValue("Gamification Demo API") String title,
    @DefaultValue("1.0") String version,
    @DefaultValue Database database
) {

    /**
     * @param enabled                whether the database module is wired at all
     * @param url                    connection string, usually {@code DATABASE_URL}
     * @param name                   database name, usually {@code DATABASE_NAME}
     * @param connectTimeout         socket connect bound for the probe
     * @param serverSelectionTimeout how long the probe waits for a reachable server
     */
    public record Database(
        @DefaultValue("false") boolean enabled,
        String url,
        String name,
        @DefaultValue("2s") Duration connectTimeout,
        @DefaultValue("2s") Duration serverSelectionTimeout
    ) {}
}
