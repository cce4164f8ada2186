package com.nicolaswinsten.gamification.diagnostics.mongo;

import java.util.concurrent.TimeUnit;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.nicolaswinsten.gamification.config.GamificationProperties;
import com.nicolaswinsten.gamification.diagnostics.DatabaseHandle;
import com.nicolaswinsten.gamification.diagnostics.DatabaseModule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

/**
 * MongoDB-backed {@link DatabaseModule}.
 *
 * <p>The client is built on the first {@link #handle()} call, not at startup, so a malformed
 * connection string surfaces through the probe instead of stopping the application.
 * Connect and server-selection timeouts come from configuration and bound every probe.
 * Without both a URL and a database name the module stays uninitialised.
 */
public class MongoDatabaseModule implements DatabaseModule, DisposableBean {
    private static final Logger LOGGER = LoggerFactory.getLogger(MongoDatabaseModule.class);

    private final GamificationProperties.Database settings;
    private MongoClient client;
    private DatabaseHandle handle;

    public MongoDatabaseModule(GamificationProperties.Database settings) {
        this.settings = settings;
    }

    @Override
    public synchronized DatabaseHandle handle() {
        if (handle != null) {
            return handle;
        }
        if (isBlank(settings.url()) || isBlank(settings.name())) {
            return null;
        }
        MongoClientSettings clientSettings = MongoClientSettings.builder()
            .applyConnectionString(new ConnectionString(settings.url()))
            .applyToSocketSettings(socket -> socket.connectTimeout(
                settings.connectTimeout().toMillis(), TimeUnit.MILLISECONDS))
            .applyToClusterSettings(cluster -> cluster.serverSelectionTimeout(
                settings.serverSelectionTimeout().toMillis(), TimeUnit.MILLISECONDS))
            .build();
        client = MongoClients.create(clientSettings);
        handle = new MongoDatabaseHandle(client.getDatabase(settings.name()));
        LOGGER.info("MongoDB client created for database {}", settings.name());
        return handle;
    }

    @Override
    public synchronized void destroy() {
        if (client != null) {
            client.close();
            client = null;
            handle = null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
