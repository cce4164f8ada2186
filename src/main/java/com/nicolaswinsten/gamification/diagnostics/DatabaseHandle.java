package com.nicolaswinsten.gamification.diagnostics;

import java.util.List;

/** A live handle on a database, as far as the {@code /test} probe needs to see it. */
public interface DatabaseHandle {

    /** Name of the database the handle points at, or {@code null} if the backend has none. */
    String name();

    /**
     * Lists up to {@code limit} collection (table, container) names.
     *
     * @throws RuntimeException whatever the backend raises when it cannot be reached
     */
    List<String> listCollectionNames(int limit);
}
