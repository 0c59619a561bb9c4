package org.dbsync.migration.differs;

import org.dbsync.model.ColumnDef;
import org.dbsync.model.ColumnDiff;
import org.dbsync.model.FieldDelta;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.dbsync.testing.Schemas.col;
import static org.dbsync.testing.Schemas.notNull;
import static org.dbsync.testing.Schemas.table;

class ColumnDifferTest {

    private final ColumnDiffer differ = new ColumnDiffer();

    @Test
    @DisplayName("added/removed/changed는 모두 이름순이다")
    void sortedByName() {
        ColumnDiff diff = differ.diff(
                table("t", col("zeta", "int"), col("id", "int"), col("beta", "int"), col("m", "int")),
                table("t", col("id", "int"), col("y_old", "int"), col("a_old", "int"), col("m", "bigint")));

        assertThat(diff.getAdded()).containsExactly("beta", "zeta");
        assertThat(diff.getRemoved()).containsExactly("a_old", "y_old");
        assertThat(diff.getChanged()).extracting(ColumnDiff.ChangedColumn::name).containsExactly("m");
    }

    @Test
    @DisplayName("필드 변화는 target 값 -> source 값으로 기록된다")
    void deltasReadTargetToSource() {
        ColumnDef source = ColumnDef.builder().name("c").type("varchar(20)").nullable(false)
                .defaultValue("'x'").extra("").build();
        ColumnDef target = ColumnDef.builder().name("c").type("varchar(10)").nullable(true)
                .defaultValue(null).extra("").build();

        List<FieldDelta> deltas = differ.fieldDeltas(source, target);

        assertThat(deltas).containsExactly(
                new FieldDelta(FieldDelta.Field.TYPE, "varchar(10)", "varchar(20)"),
                new FieldDelta(FieldDelta.Field.NULLABLE, "NULL", "NOT NULL"),
                new FieldDelta(FieldDelta.Field.DEFAULT, "(none)", "'x'"));
        assertThat(deltas.get(0).describe()).isEqualTo("Type: varchar(10) -> varchar(20)");
    }

    @Test
    void identicalColumnsProduceEmptyDiff() {
        ColumnDiff diff = differ.diff(table("t", notNull("id", "int")), table("t", notNull("id", "int")));
        assertThat(diff.isEmpty()).isTrue();
        assertThat(differ.unsafeChanges(diff)).isEmpty();
    }

    @Test
    @DisplayName("NULL 허용으로 완화되는 변경은 경고하지 않는다")
    void relaxingNullabilityIsSafe() {
        ColumnDiff diff = differ.diff(table("t", col("c", "int")), table("t", notNull("c", "int")));
        assertThat(diff.getChanged()).singleElement()
                .satisfies(c -> assertThat(c.has(FieldDelta.Field.NULLABLE)).isTrue());
        assertThat(differ.unsafeChanges(diff)).isEmpty();
    }
}
