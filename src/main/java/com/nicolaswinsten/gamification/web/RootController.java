package com.nicolaswinsten.gamification.web;

import java.util.Map;

import com.nicolaswinsten.gamification.config.GamificationProperties;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness endpoints.
 *
 * <p>Not part of the demo data, just a quick way to verify the server is running.
 */
@RestController
public class RootController {
    private final GamificationProperties properties;

    public RootController(GamificationProperties properties) {
        this.properties = properties;
    }

    /** Returns {@code {"message": "Gamification Demo API running"}}. */
    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("message", properties.title() + " running");
    }

    @GetMapping("/api/health")
    public HealthStatus health() {
        return new HealthStatus("ok", DemoController.MODE, properties.version());
    }

    public record HealthStatus(String status, String mode, String version) {}
}
