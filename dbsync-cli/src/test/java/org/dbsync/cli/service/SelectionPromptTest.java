package org.dbsync.cli.service;

import org.dbsync.migration.differs.SchemaDiffer;
import org.dbsync.model.Classification;
import org.dbsync.model.ColumnDef;
import org.dbsync.model.SchemaModel;
import org.dbsync.model.Selection;
import org.dbsync.model.SyncAction;
import org.dbsync.model.TableModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SelectionPromptTest {

    private final SchemaDiffer differ = new SchemaDiffer();
    private SchemaModel source;
    private SchemaModel target;
    private Classification classification;
    private ByteArrayOutputStream buffer;

    private static TableModel table(String name, String statusType) {
        return TableModel.builder().name(name).createStatement("CREATE TABLE `" + name + "` (`id` int)")
                .column(ColumnDef.builder().name("id").type("int").nullable(false).ordinalPosition(1).build())
                .column(ColumnDef.builder().name("status").type(statusType).ordinalPosition(2).build())
                .build();
    }

    @BeforeEach
    void setUp() {
        source = SchemaModel.builder().database("a")
                .table("alpha", table("alpha", "int"))
                .table("orders", table("orders", "varchar(20)"))
                .build();
        target = SchemaModel.builder().database("b")
                .table("orders", table("orders", "varchar(10)"))
                .table("old", table("old", "int"))
                .build();
        classification = differ.classify(source, target);
        buffer = new ByteArrayOutputStream();
    }

    private Optional<Selection> prompt(String answers) throws IOException {
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        SelectionPrompt prompt = new SelectionPrompt(
                new BufferedReader(new StringReader(answers)), out, new DiffReportPrinter(out, differ));
        return prompt.prompt(classification, source, target);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("답변 순서대로 선택이 기록된다")
    void recordsChoicesInOrder() throws IOException {
        Optional<Selection> selection = prompt("2\n s \nN\n");

        assertThat(selection).isPresent();
        assertThat(selection.get().asMap()).containsExactly(
                java.util.Map.entry("alpha", SyncAction.STRUCTURE_AND_DATA),
                java.util.Map.entry("orders", SyncAction.SKIP),
                java.util.Map.entry("old", SyncAction.SKIP));
        assertThat(output()).contains("TABLE DETAILS: alpha", "NEW TABLE (does not exist in target)",
                "TABLES FOR REMOVAL (1 tables)");
    }

    @Test
    @DisplayName("d는 상세를 다시 보여주고 같은 테이블을 다시 묻는다")
    void detailsRepeatsQuestion() throws IOException {
        Optional<Selection> selection = prompt("1\nd\n1\ny\n");

        assertThat(selection.orElseThrow().tablesWith(SyncAction.STRUCTURE_ONLY)).containsExactly("alpha", "orders");
        assertThat(selection.get().tablesWith(SyncAction.DROP)).containsExactly("old");
        assertThat(output().split("TABLE DETAILS: orders", -1)).hasSize(3);
    }

    @Test
    void invalidAnswersAreRejected() throws IOException {
        Optional<Selection> selection = prompt("3\n1\n1\nmaybe\ny\n");

        assertThat(selection).isPresent();
        assertThat(output()).contains("Invalid choice. Use 1, 2, s, d, or q", "Invalid choice. Use y/n/q");
    }

    @Test
    @DisplayName("q는 전체 선택을 취소한다")
    void quitAborts() throws IOException {
        assertThat(prompt("1\nq\n")).isEmpty();
        assertThat(output()).contains("Operation cancelled by user.");
    }

    @Test
    void endOfInputAborts() throws IOException {
        assertThat(prompt("")).isEmpty();
        assertThat(output()).contains("Input closed, cancelling.");
    }
}
