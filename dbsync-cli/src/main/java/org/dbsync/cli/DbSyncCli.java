package org.dbsync.cli;

import picocli.CommandLine;

/**
 * Main CLI entry point for dbsync.
 * Compares two MySQL/MariaDB schemas and generates synchronization scripts.
 */
@CommandLine.Command(
        name = "dbsync",
        mixinStandardHelpOptions = true,
        version = "dbsync 1.0",
        description = "두 데이터베이스 스키마를 비교하여 동기화 SQL을 생성하는 툴",
        subcommands = {
                CompareCommand.class,
                SyncCommand.class,
                SnapshotCommand.class
        }
)
public class DbSyncCli {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new DbSyncCli()).execute(args);
        System.exit(exitCode);
    }
}
