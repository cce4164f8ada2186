package com.nicolaswinsten.gamification;

import com.nicolaswinsten.gamification.config.GamificationProperties;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Entry point for the gamification demo API.
 *
 * <p>This Spring Boot application serves a fixed, read-only sample of users, badges and
 * leaderboard standings over plain JSON endpoints.
 * There is no database: every record lives in memory for the lifetime of the process.
 * Boot's own Mongo auto-configuration is excluded; the optional database probe behind
 * {@code /test} builds its client only when explicitly enabled.
 *
 * @see com.nicolaswinsten.gamification.demo.DemoDataset  the sample data
 * @see com.nicolaswinsten.gamification.web.DemoController  demo endpoints
 * @see com.nicolaswinsten.gamification.diagnostics.DatabaseDiagnostics  database probe
 */
@SpringBootApplication(exclude = MongoAutoConfiguration.class)
@EnableConfigurationProperties(GamificationProperties.class)
public class GamificationDemoServer {
    public static void main(String[] args) {
        SpringApplication.run(GamificationDemoServer.class, args);
    }
}
