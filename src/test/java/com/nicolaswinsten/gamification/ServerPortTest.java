package com.nicolaswinsten.gamification;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.env.Environment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assumptions.assumeThat;

class ServerPortTest {

    @Nested
    @SpringBootTest
    class WithoutPortVariable {

        @Autowired
        Environment environment;

        @Test
        void listensOn8000ByDefault() {
            assumeThat(System.getenv("PORT")).isNull();
            assertThat(environment.getProperty("server.port")).isEqualTo("8000");
        }
    }

    @Nested
    @SpringBootTest(properties = "PORT=9123")
    class WithPortVariable {

        @Autowired
        Environment environment;

        @Test
        void portVariableOverridesDefault() {
            assertThat(environment.getProperty("server.port")).isEqualTo("9123");
            assertThat(environment.getProperty("server.port", Integer.class)).isEqualTo(9123);
        }
    }
}
