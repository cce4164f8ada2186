package com.nicolaswinsten.gamification.diagnostics;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of the {@code /test} probe. Every field is descriptive text meant for a human
 * looking at the response; failures show up here rather than as error statuses.
 *
 * @param collections at most {@value DatabaseDiagnostics#MAX_COLLECTIONS} names, empty unless
 *                    enumeration succeeded
 */
public record DatabaseStatus(
    String backend,
    String database,
    @JsonProperty("database_url") String databaseUrl,
    @JsonProperty("database_name") String databaseName,
    @JsonProperty("connection_status") String connectionStatus,
    List<String> collections
) {

    public DatabaseStatus {
        collections = collections == null ? List.of() : List.copyOf(collections);
    }
}
