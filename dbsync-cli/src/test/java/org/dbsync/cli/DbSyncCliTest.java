package org.dbsync.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

class DbSyncCliTest {

    @Test
    @DisplayName("--help는 하위 명령 목록을 보여준다")
    void helpListsSubcommands() {
        StringWriter sw = new StringWriter();
        CommandLine cmd = new CommandLine(new DbSyncCli());
        cmd.setOut(new PrintWriter(sw));

        int exit = cmd.execute("--help");

        assertThat(exit).isZero();
        assertThat(sw.toString()).contains("compare", "sync", "snapshot");
    }

    @Test
    void versionOption() {
        StringWriter sw = new StringWriter();
        CommandLine cmd = new CommandLine(new DbSyncCli());
        cmd.setOut(new PrintWriter(sw));

        assertThat(cmd.execute("--version")).isZero();
        assertThat(sw.toString()).contains("dbsync 1.0");
    }

    @Test
    @DisplayName("알 수 없는 하위 명령은 사용법 오류(2)")
    void unknownSubcommand() {
        StringWriter err = new StringWriter();
        CommandLine cmd = new CommandLine(new DbSyncCli());
        cmd.setErr(new PrintWriter(err));

        assertThat(cmd.execute("migrate")).isEqualTo(2);
        assertThat(err.toString()).contains("migrate");
    }
}
