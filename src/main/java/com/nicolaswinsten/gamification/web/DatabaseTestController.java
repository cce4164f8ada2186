package com.nicolaswinsten.gamification.web;

import com.nicolaswinsten.gamification.diagnostics.DatabaseDiagnostics;
import com.nicolaswinsten.gamification.diagnostics.DatabaseStatus;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Exposes the database probe. Always answers 200; problems are described in the body. */
@RestController
public class DatabaseTestController {
    private final DatabaseDiagnostics diagnostics;

    public DatabaseTestController(DatabaseDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    @GetMapping("/test")
    public DatabaseStatus test() {
        return diagnostics.probe();
    }
}
