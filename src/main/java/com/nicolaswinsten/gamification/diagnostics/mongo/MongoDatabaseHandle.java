package com.nicolaswinsten.gamification.diagnostics.mongo;

import java.util.ArrayList;
import java.util.List;

import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import com.nicolaswinsten.gamification.diagnostics.DatabaseHandle;

/** {@link DatabaseHandle} over a MongoDB database. */
public class MongoDatabaseHandle implements DatabaseHandle {
    private final MongoDatabase database;

    public MongoDatabaseHandle(MongoDatabase database) {
        this.database = database;
    }

    @Override
    public String name() {
        return database.getName();
    }

    /** Reads names off the server cursor until {@code limit} is reached, then closes it. */
    @Override
    public List<String> listCollectionNames(int limit) {
        List<String> names = new ArrayList<>();
        try (MongoCursor<String> cursor = database.listCollectionNames().iterator()) {
            while (names.size() < limit && cursor.hasNext()) {
                names.add(cursor.next());
            }
        }
        return names;
    }
}
