package com.nicolaswinsten.gamification.web;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.empty;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DatabaseTestControllerTest {

    @Nested
    @SpringBootTest(properties = {"DATABASE_URL=", "DATABASE_NAME="})
    @AutoConfigureMockMvc
    class WithoutDatabaseModule {

        @Autowired
        MockMvc mockMvc;

        @Test
        void reportsModuleNotFound() throws Exception {
            mockMvc.perform(get("/test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.backend").value("✅ Running"))
                .andExpect(jsonPath("$.database").value("❌ Database module not found"))
                .andExpect(jsonPath("$.database_url").value("❌ Not Set"))
                .andExpect(jsonPath("$.database_name").value("❌ Not Set"))
                .andExpect(jsonPath("$.connection_status").value("Not Connected"))
                .andExpect(jsonPath("$.collections", empty()));
        }
    }

    @Nested
    @SpringBootTest(properties = {
        "gamification.database.enabled=true",
        "DATABASE_URL=mongodb://localhost:27017",
        "DATABASE_NAME="
    })
    @AutoConfigureMockMvc
    class WithUninitializedDatabaseModule {

        @Autowired
        MockMvc mockMvc;

        @Test
        void reportsNotInitializedAndVariablePresence() throws Exception {
            mockMvc.perform(get("/test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.database").value("⚠️  Available but not initialized"))
                .andExpect(jsonPath("$.database_url").value("✅ Set"))
                .andExpect(jsonPath("$.database_name").value("❌ Not Set"))
                .andExpect(jsonPath("$.connection_status").value("Not Connected"));
        }
    }
}
