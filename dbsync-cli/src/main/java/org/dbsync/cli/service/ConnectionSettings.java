package org.dbsync.cli.service;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import org.dbsync.options.DbSyncOptions;

import java.util.Map;

import static org.dbsync.options.DbSyncOptions.Connection.key;

/**
 * Connection parameters of one side.
 */
@Value
@Builder(toBuilder = true)
public class ConnectionSettings {
    @Builder.Default String host = DbSyncOptions.Connection.HOST_DEFAULT;
    @Builder.Default int port = DbSyncOptions.Connection.PORT_DEFAULT;
    String username;
    @ToString.Exclude String password;
    String database;
    /** Overrides host, port and database when set. */
    String url;

    public String jdbcUrl() {
        if (url != null && !url.isBlank()) {
            return url;
        }
        return "jdbc:mariadb://" + host + ":" + port + "/" + (database == null ? "" : database);
    }

    public String describe() {
        return (username == null ? "" : username + "@") + host + ":" + port + "/" + database;
    }

    /**
     * Reads the {@code dbsync.<side>.*} keys produced by the configuration loader.
     */
    public static ConnectionSettings fromConfig(Map<String, String> config, String side) {
        ConnectionSettings.ConnectionSettingsBuilder b = ConnectionSettings.builder();
        String host = config.get(key(side, DbSyncOptions.Connection.HOST));
        if (host != null) b.host(host);
        String port = config.get(key(side, DbSyncOptions.Connection.PORT));
        if (port != null) {
            try {
                b.port(Integer.parseInt(port.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + side + " port in configuration: " + port, e);
            }
        }
        return b.username(config.get(key(side, DbSyncOptions.Connection.USERNAME)))
                .password(config.get(key(side, DbSyncOptions.Connection.PASSWORD)))
                .database(config.get(key(side, DbSyncOptions.Connection.DATABASE)))
                .url(config.get(key(side, DbSyncOptions.Connection.URL)))
                .build();
    }
}
