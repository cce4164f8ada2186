package com.nicolaswinsten.gamification.diagnostics.mongo;

import com.nicolaswinsten.gamification.config.GamificationProperties;
import com.nicolaswinsten.gamification.diagnostics.DatabaseHandle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MongoDatabaseModuleTest {

    private MongoDatabaseModule module;

    @AfterEach
    void tearDown() {
        if (module != null) {
            module.destroy();
        }
    }

    private static GamificationProperties.Database settings(String url, String name) {
        return new GamificationProperties.Database(true, url, name, Duration.ofSeconds(1), Duration.ofSeconds(1));
    }

    @Test
    void blankUrlLeavesModuleUninitialized() {
        module = new MongoDatabaseModule(settings("", "demo"));
        assertThat(module.handle()).isNull();
    }

    @Test
    void missingNameLeavesModuleUninitialized() {
        module = new MongoDatabaseModule(settings("mongodb://localhost:27017", null));
        assertThat(module.handle()).isNull();
    }

    @Test
    void malformedUrlFailsOnHandleNotOnConstruction() {
        module = new MongoDatabaseModule(settings("not-a-mongo-url", "demo"));
        assertThatThrownBy(module::handle).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void handleIsCreatedOnceAndNamedAfterDatabase() {
        module = new MongoDatabaseModule(settings("mongodb://localhost:27017", "gamification"));

        DatabaseHandle first = module.handle();

        assertThat(first).isNotNull();
        assertThat(first.name()).isEqualTo("gamification");
        assertThat(module.handle()).isSameAs(first);
    }
}
