package org.dbsync.extract;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JdbcMetadataSourceTest {

    @Mock Connection connection;
    @Mock PreparedStatement prepared;
    @Mock Statement statement;
    @Mock ResultSet resultSet;
    @Mock ResultSetMetaData meta;

    private JdbcMetadataSource source;

    @BeforeEach
    void setUp() {
        source = new JdbcMetadataSource(connection);
    }

    @Test
    @DisplayName("INFORMATION_SCHEMA 조회는 파라미터 바인딩을 사용한다")
    void columnsQueryBindsParameters() throws Exception {
        when(connection.prepareStatement(JdbcMetadataSource.COLUMNS_SQL)).thenReturn(prepared);
        when(prepared.executeQuery()).thenReturn(resultSet);
        when(resultSet.getMetaData()).thenReturn(meta);
        when(meta.getColumnCount()).thenReturn(2);
        when(meta.getColumnLabel(1)).thenReturn("COLUMN_NAME");
        when(meta.getColumnLabel(2)).thenReturn("COLUMN_TYPE");
        when(resultSet.next()).thenReturn(true, true, false);
        when(resultSet.getObject(1)).thenReturn("id", "name");
        when(resultSet.getObject(2)).thenReturn("int(11)", "varchar(50)");

        List<MetadataRow> rows = source.listColumns("shop", "users");

        verify(prepared).setObject(1, "shop");
        verify(prepared).setObject(2, "users");
        assertThat(rows).hasSize(2);
        assertThat(rows.get(1).getString("column_name")).isEqualTo("name");
        assertThat(rows.get(1).getString("COLUMN_TYPE")).isEqualTo("varchar(50)");
        verify(prepared).close();
        verify(resultSet).close();
    }

    @Test
    @DisplayName("SHOW 문에서는 식별자를 백틱으로 감싼다")
    void showIndexQuotesIdentifier() throws Exception {
        when(connection.createStatement()).thenReturn(statement);
        when(statement.executeQuery(anyString())).thenReturn(resultSet);
        when(resultSet.getMetaData()).thenReturn(meta);
        when(meta.getColumnCount()).thenReturn(0);
        when(resultSet.next()).thenReturn(false);

        source.listIndexes("odd`name");

        verify(statement).executeQuery("SHOW INDEX FROM `odd``name`");
    }

    @Test
    void showCreateTableReadsCreateTableColumn() throws Exception {
        when(connection.createStatement()).thenReturn(statement);
        when(statement.executeQuery("SHOW CREATE TABLE `users`")).thenReturn(resultSet);
        when(resultSet.getMetaData()).thenReturn(meta);
        when(meta.getColumnCount()).thenReturn(2);
        when(meta.getColumnLabel(1)).thenReturn("Table");
        when(meta.getColumnLabel(2)).thenReturn("Create Table");
        when(resultSet.next()).thenReturn(true, false);
        when(resultSet.getObject(1)).thenReturn("users");
        when(resultSet.getObject(2)).thenReturn("CREATE TABLE `users` (`id` int)");

        assertThat(source.showCreateTable("users")).isEqualTo("CREATE TABLE `users` (`id` int)");
    }

    @Test
    void showCreateTableWithoutRowsFails() throws Exception {
        when(connection.createStatement()).thenReturn(statement);
        when(statement.executeQuery(anyString())).thenReturn(resultSet);
        when(resultSet.getMetaData()).thenReturn(meta);
        when(meta.getColumnCount()).thenReturn(0);
        when(resultSet.next()).thenReturn(false);

        assertThatThrownBy(() -> source.showCreateTable("ghost"))
                .isInstanceOf(SQLException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void currentDatabaseMayBeAbsent() throws Exception {
        when(connection.prepareStatement(JdbcMetadataSource.CURRENT_DATABASE_SQL)).thenReturn(prepared);
        when(prepared.executeQuery()).thenReturn(resultSet);
        when(resultSet.getMetaData()).thenReturn(meta);
        when(meta.getColumnCount()).thenReturn(1);
        when(meta.getColumnLabel(1)).thenReturn("current_db");
        when(resultSet.next()).thenReturn(true, false);
        when(resultSet.getObject(1)).thenReturn(null);

        assertThat(source.currentDatabase()).isEmpty();
    }
}
