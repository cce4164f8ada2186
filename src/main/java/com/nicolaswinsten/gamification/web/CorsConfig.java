package com.nicolaswinsten.gamification.web;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Opens every endpoint to cross-origin callers: any origin, method and header, with
 * credentials. The demo frontend may be hosted anywhere.
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    /**
     * Origin patterns rather than {@code allowedOrigins("*")}, which Spring rejects
     * together with {@code allowCredentials(true)}.
     */
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
            .allowedOriginPatterns("*")
            .allowedMethods("*")
            .allowedHeaders("*")
            .allowCredentials(true);
    }
}
