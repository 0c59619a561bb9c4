package org.dbsync.cli.service;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

@FunctionalInterface
public interface ConnectionFactory {
    Connection open(ConnectionSettings settings) throws SQLException;

    static ConnectionFactory driverManager() {
        return s -> DriverManager.getConnection(s.jdbcUrl(), s.getUsername(), s.getPassword());
    }
}
