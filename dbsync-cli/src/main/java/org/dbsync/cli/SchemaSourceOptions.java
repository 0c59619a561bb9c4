package org.dbsync.cli;

import org.dbsync.cli.service.ConnectionSettings;
import org.dbsync.cli.service.SchemaSpec;
import org.dbsync.config.ConfigurationLoader;
import org.dbsync.options.DbSyncOptions;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.Map;

/**
 * Connection and snapshot options shared by the commands.
 * Values given on the command line override the active configuration profile.
 */
public class SchemaSourceOptions {

    @CommandLine.Option(names = "--profile", description = "사용할 설정 프로파일 (dev, prod, test 등)")
    String profile;

    @CommandLine.Option(names = "--source-host", description = "기준 DB 호스트")
    String sourceHost;
    @CommandLine.Option(names = "--source-port", description = "기준 DB 포트")
    Integer sourcePort;
    @CommandLine.Option(names = "--source-user", description = "기준 DB 사용자")
    String sourceUser;
    @CommandLine.Option(names = "--source-password", description = "기준 DB 비밀번호")
    String sourcePassword;
    @CommandLine.Option(names = "--source-db", description = "기준 데이터베이스 이름")
    String sourceDatabase;
    @CommandLine.Option(names = "--source-url", description = "기준 DB JDBC URL (host/port 대신 사용)")
    String sourceUrl;
    @CommandLine.Option(names = "--source-snapshot", description = "기준 스키마 JSON 스냅샷 (접속 대신 사용)")
    Path sourceSnapshot;

    @CommandLine.Option(names = "--target-host", description = "대상 DB 호스트")
    String targetHost;
    @CommandLine.Option(names = "--target-port", description = "대상 DB 포트")
    Integer targetPort;
    @CommandLine.Option(names = "--target-user", description = "대상 DB 사용자")
    String targetUser;
    @CommandLine.Option(names = "--target-password", description = "대상 DB 비밀번호")
    String targetPassword;
    @CommandLine.Option(names = "--target-db", description = "대상 데이터베이스 이름")
    String targetDatabase;
    @CommandLine.Option(names = "--target-url", description = "대상 DB JDBC URL (host/port 대신 사용)")
    String targetUrl;
    @CommandLine.Option(names = "--target-snapshot", description = "대상 스키마 JSON 스냅샷 (접속 대신 사용)")
    Path targetSnapshot;

    private Map<String, String> config;

    /**
     * 설정 파일을 한 번만 읽는다.
     */
    Map<String, String> configuration() {
        if (config == null) {
            config = new ConfigurationLoader().loadConfiguration(profile);
        }
        return config;
    }

    SchemaSpec sourceSpec() {
        if (sourceSnapshot != null) return SchemaSpec.snapshot("source", sourceSnapshot);
        return SchemaSpec.live("source", sourceSettings());
    }

    SchemaSpec targetSpec() {
        if (targetSnapshot != null) return SchemaSpec.snapshot("target", targetSnapshot);
        return SchemaSpec.live("target", targetSettings());
    }

    ConnectionSettings sourceSettings() {
        return override(ConnectionSettings.fromConfig(configuration(), DbSyncOptions.Connection.SOURCE),
                sourceHost, sourcePort, sourceUser, sourcePassword, sourceDatabase, sourceUrl);
    }

    ConnectionSettings targetSettings() {
        return override(ConnectionSettings.fromConfig(configuration(), DbSyncOptions.Connection.TARGET),
                targetHost, targetPort, targetUser, targetPassword, targetDatabase, targetUrl);
    }

    private static ConnectionSettings override(ConnectionSettings base, String host, Integer port, String user,
                                               String password, String database, String url) {
        ConnectionSettings.ConnectionSettingsBuilder b = base.toBuilder();
        if (host != null) b.host(host);
        if (port != null) b.port(port);
        if (user != null) b.username(user);
        if (password != null) b.password(password);
        if (database != null) b.database(database);
        if (url != null) b.url(url);
        return b.build();
    }
}
