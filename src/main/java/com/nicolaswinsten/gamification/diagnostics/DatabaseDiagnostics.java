package com.nicolaswinsten.gamification.diagnostics;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

/**
 * Best-effort report on whether a database integration would be usable.
 *
 * <p>The probe walks through these states, stopping at the first that applies:
 * <ol>
 *   <li>no {@link DatabaseModule} bean: "module not found";</li>
 *   <li>module without a handle: "available but not initialized";</li>
 *   <li>handle present: "available", then up to {@value #MAX_COLLECTIONS} collection names are
 *       listed, upgrading to "connected &amp; working" or degrading to an error line.</li>
 * </ol>
 * Independently, {@code DATABASE_URL} and {@code DATABASE_NAME} are reported as set or not set.
 * {@link #probe()} never throws; every failure is folded into the returned text.
 */
@Service
public class DatabaseDiagnostics {
    private static final Logger LOGGER = LoggerFactory.getLogger(DatabaseDiagnostics.class);

    public static final int MAX_COLLECTIONS = 10;
    static final int MAX_ERROR_LENGTH = 50;

    static final String URL_VARIABLE = "DATABASE_URL";
    static final String NAME_VARIABLE = "DATABASE_NAME";

    static final String BACKEND_RUNNING = "✅ Running";
    static final String DB_NOT_AVAILABLE = "❌ Not Available";
    static final String DB_MODULE_NOT_FOUND = "❌ Database module not found";
    static final String DB_NOT_INITIALIZED = "⚠️  Available but not initialized";
    static final String DB_AVAILABLE = "✅ Available";
    static final String DB_WORKING = "✅ Connected & Working";
    static final String DB_LIST_ERROR_PREFIX = "⚠️  Connected but Error: ";
    static final String DB_ERROR_PREFIX = "❌ Error: ";
    static final String CONNECTED = "Connected";
    static final String NOT_CONNECTED = "Not Connected";
    static final String VARIABLE_SET = "✅ Set";
    static final String VARIABLE_NOT_SET = "❌ Not Set";

    private final ObjectProvider<DatabaseModule> databaseModule;
    private final Environment environment;

    public DatabaseDiagnostics(ObjectProvider<DatabaseModule> databaseModule, Environment environment) {
        this.databaseModule = databaseModule;
        this.environment = environment;
    }

    public DatabaseStatus probe() {
        String database = DB_NOT_AVAILABLE;
        String connectionStatus = NOT_CONNECTED;
        List<String> collections = List.of();

        try {
            DatabaseModule module = databaseModule.getIfAvailable();
            if (module == null) {
                database = DB_MODULE_NOT_FOUND;
            } else {
                DatabaseHandle handle = module.handle();
                if (handle == null) {
                    database = DB_NOT_INITIALIZED;
                } else {
                    database = DB_AVAILABLE;
                    connectionStatus = CONNECTED;
                    try {
                        collections = firstCollections(handle.listCollectionNames(MAX_COLLECTIONS));
                        database = DB_WORKING;
                        LOGGER.debug("Database probe listed {} collections from {}", collections.size(), handle.name());
                    } catch (RuntimeException e) {
                        LOGGER.warn("Database probe could not list collections: {}", e.toString());
                        database = DB_LIST_ERROR_PREFIX + truncate(describe(e));
                    }
                }
            }
        } catch (RuntimeException e) {
            LOGGER.warn("Database probe failed: {}", e.toString());
            database = DB_ERROR_PREFIX + truncate(describe(e));
        }

        return new DatabaseStatus(
            BACKEND_RUNNING,
            database,
            presence(URL_VARIABLE),
            presence(NAME_VARIABLE),
            connectionStatus,
            collections
        );
    }

    private String presence(String variable) {
        String value = environment.getProperty(variable);
        return value == null || value.isEmpty() ? VARIABLE_NOT_SET : VARIABLE_SET;
    }

    /** Drops null names and keeps at most {@link #MAX_COLLECTIONS}. */
    private static List<String> firstCollections(List<String> names) {
        if (names == null) {
            return List.of();
        }
        return names.stream()
            .filter(Objects::nonNull)
            .limit(MAX_COLLECTIONS)
            .collect(Collectors.toUnmodifiableList());
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /** Keeps the first {@link #MAX_ERROR_LENGTH} code points, never splitting a surrogate pair. */
    static String truncate(String message) {
        if (message.codePointCount(0, message.length()) <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, message.offsetByCodePoints(0, MAX_ERROR_LENGTH));
    }
}
