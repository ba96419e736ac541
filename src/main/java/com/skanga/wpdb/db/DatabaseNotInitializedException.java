package com.skanga.wpdb.db;

import com.skanga.wpdb.config.ResourceManager;

/**
 * Thrown when the database context is requested before startup completed or after shutdown.
 */
public class DatabaseNotInitializedException extends IllegalStateException {
    public DatabaseNotInitializedException() {
        super(ResourceManager.getErrorMessage("database.not.initialized"));
    }
}
