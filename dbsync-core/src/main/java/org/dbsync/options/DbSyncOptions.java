package org.dbsync.options;

/**
 * Configuration keys and defaults shared by the configuration loader and the CLI.
 */
public final class DbSyncOptions {

    private DbSyncOptions() {
    }

    /**
     * Profile-related settings.
     */
    public static final class Profile {
        private Profile() {}

        public static final String DEFAULT = "dev";

        public static final String ENV_VAR = "DBSYNC_PROFILE";

        /**
         * Looked up from the working directory upward.
         */
        public static final String CONFIG_FILE = "dbsync.yaml";
    }

    /**
     * Connection settings, one set per side.
     */
    public static final class Connection {
        private Connection() {}

        public static final String SOURCE = "source";
        public static final String TARGET = "target";

        public static final String HOST = "host";
        public static final String PORT = "port";
        public static final String USERNAME = "username";
        public static final String PASSWORD = "password";
        public static final String DATABASE = "database";
        public static final String URL = "url";

        public static final String HOST_DEFAULT = "localhost";
        public static final int PORT_DEFAULT = 3306;

        /**
         * e.g. {@code dbsync.source.host}
         */
        public static String key(String side, String field) {
            return "dbsync." + side + "." + field;
        }
    }

    /**
     * Script output settings.
     */
    public static final class Output {
        private Output() {}

        public static final String DIRECTORY_KEY = "dbsync.output.directory";
        public static final String DIRECTORY_DEFAULT = ".";

        public static final String BASE_FILENAME_KEY = "dbsync.output.baseFilename";
        public static final String BASE_FILENAME_DEFAULT = "sync_database";

        public static final String STRUCTURE_SUFFIX = "_structure.sql";
        public static final String DATA_SUFFIX = "_data.sql";
    }
}
