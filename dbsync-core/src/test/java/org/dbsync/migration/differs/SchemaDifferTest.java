package org.dbsync.migration.differs;

import org.dbsync.model.Classification;
import org.dbsync.model.ColumnDiff;
import org.dbsync.model.FieldDelta;
import org.dbsync.model.ForeignKeyDef;
import org.dbsync.model.ForeignKeyDiff;
import org.dbsync.model.MetadataPart;
import org.dbsync.model.SchemaModel;
import org.dbsync.model.TableModel;
import org.dbsync.model.TableStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.dbsync.testing.Schemas.col;
import static org.dbsync.testing.Schemas.index;
import static org.dbsync.testing.Schemas.notNull;
import static org.dbsync.testing.Schemas.schema;
import static org.dbsync.testing.Schemas.table;

class SchemaDifferTest {

    private final SchemaDiffer differ = new SchemaDiffer();

    private static SchemaModel sample() {
        return schema("a",
                table("users", notNull("id", "int(11)"), notNull("name", "varchar(50)")),
                table("orders", notNull("id", "int(11)"), col("status", "varchar(20)")),
                table("audit", col("id", "bigint(20)")));
    }

    @Nested
    @DisplayName("분류 법칙")
    class Laws {

        @Test
        @DisplayName("자기 자신과 비교하면 모든 테이블이 identical")
        void identity() {
            SchemaModel a = sample();
            Classification c = differ.classify(a, a);

            assertThat(c.getNewTables()).isEmpty();
            assertThat(c.getRemovedTables()).isEmpty();
            assertThat(c.getModifiedTables()).isEmpty();
            assertThat(c.getIdenticalTables()).containsExactly("audit", "orders", "users");
            assertThat(c.getWarnings()).isEmpty();
        }

        @Test
        @DisplayName("classify(A,B).new == classify(B,A).removed")
        void symmetry() {
            SchemaModel a = sample();
            SchemaModel b = schema("b",
                    table("users", notNull("id", "int(11)"), notNull("name", "varchar(50)")),
                    table("legacy_logs", col("msg", "text")));

            assertThat(differ.classify(a, b).getNewTables())
                    .isEqualTo(differ.classify(b, a).getRemovedTables())
                    .containsExactly("audit", "orders");
            assertThat(differ.classify(a, b).getRemovedTables())
                    .isEqualTo(differ.classify(b, a).getNewTables());
        }

        @Test
        @DisplayName("모든 테이블은 정확히 하나의 분류에 속한다")
        void partition() {
            SchemaModel a = sample();
            SchemaModel b = schema("b",
                    table("users", notNull("id", "int(11)"), col("name", "varchar(50)")),
                    table("audit", col("id", "bigint(20)")),
                    table("legacy_logs", col("msg", "text")));

            Classification c = differ.classify(a, b);
            List<String> all = new java.util.ArrayList<>();
            all.addAll(c.getNewTables());
            all.addAll(c.getRemovedTables());
            all.addAll(c.getModifiedTables());
            all.addAll(c.getIdenticalTables());

            Set<String> expected = new HashSet<>(a.getTableNames());
            expected.addAll(b.getTableNames());
            assertThat(all).doesNotHaveDuplicates().containsExactlyInAnyOrderElementsOf(expected);
            assertThat(c.statusOf("users")).contains(TableStatus.MODIFIED);
            assertThat(c.statusOf("nope")).isEmpty();
        }

        @Test
        @DisplayName("테이블 이름 비교는 대소문자를 구분한다")
        void caseSensitiveNames() {
            Classification c = differ.classify(
                    schema("a", table("Users", col("id", "int"))),
                    schema("b", table("users", col("id", "int"))));
            assertThat(c.getNewTables()).containsExactly("Users");
            assertThat(c.getRemovedTables()).containsExactly("users");
        }
    }

    @Test
    @DisplayName("extra만 바뀌어도 modified로 분류되고 changed에 나타난다")
    void extraOnlyChange() {
        SchemaModel source = schema("a", table("t", notNull("id", "int(11)").toBuilder().extra("auto_increment").build()));
        SchemaModel target = schema("b", table("t", notNull("id", "int(11)")));

        assertThat(differ.classify(source, target).getModifiedTables()).containsExactly("t");

        ColumnDiff diff = differ.columnDiff("t", source, target);
        assertThat(diff.getChanged()).singleElement().satisfies(c -> {
            assertThat(c.name()).isEqualTo("id");
            assertThat(c.deltas()).containsExactly(
                    new FieldDelta(FieldDelta.Field.EXTRA, "(none)", "auto_increment"));
        });
    }

    @Test
    @DisplayName("orders.status VARCHAR(10) -> VARCHAR(20)")
    void typeChangeScenario() {
        SchemaModel source = schema("a", table("orders", notNull("id", "int"), col("status", "VARCHAR(20)")));
        SchemaModel target = schema("b", table("orders", notNull("id", "int"), col("status", "VARCHAR(10)")));

        Classification c = differ.classify(source, target);
        assertThat(c.getModifiedTables()).containsExactly("orders");
        assertThat(c.getWarnings()).anyMatch(w -> w.startsWith("[TYPE-CHANGE] orders.status"));

        ColumnDiff diff = differ.columnDiff("orders", source, target);
        assertThat(diff.getAdded()).isEmpty();
        assertThat(diff.getRemoved()).isEmpty();
        assertThat(diff.getChanged()).singleElement().satisfies(ch -> {
            assertThat(ch.name()).isEqualTo("status");
            assertThat(ch.deltas()).containsExactly(
                    new FieldDelta(FieldDelta.Field.TYPE, "VARCHAR(10)", "VARCHAR(20)"));
        });
    }

    @Test
    @DisplayName("인덱스나 FK만 다른 테이블은 identical로 남는다")
    void indexOnlyDifferenceDoesNotPromote() {
        TableModel base = table("users", notNull("id", "int"), col("email", "varchar(100)"));
        SchemaModel source = schema("a", base.toBuilder().index(index("uk_email", "email")).build());
        SchemaModel target = schema("b", base.toBuilder()
                .foreignKey(ForeignKeyDef.builder().constraintName("fk_x").column("id")
                        .referencedTable("other").referencedColumn("id").build())
                .build());

        Classification c = differ.classify(source, target);
        assertThat(c.getIdenticalTables()).containsExactly("users");

        assertThat(differ.indexDiff("users", source, target).getAdded())
                .extracting(i -> i.getName()).containsExactly("uk_email");
        ForeignKeyDiff fks = differ.foreignKeyDiff("users", source, target);
        assertThat(fks.getRemoved()).extracting(ForeignKeyDef::getConstraintName).containsExactly("fk_x");
        assertThat(fks.getAdded()).isEmpty();
    }

    @Test
    @DisplayName("메타데이터가 불완전하면 modified로 분류하고 경고한다")
    void partialMetadataForcesModified() {
        TableModel full = table("users", notNull("id", "int"));
        SchemaModel source = schema("a", full);
        SchemaModel target = schema("b", full.toBuilder().missingPart(MetadataPart.INDEXES).build());

        Classification c = differ.classify(source, target);
        assertThat(c.getModifiedTables()).containsExactly("users");
        assertThat(c.getWarnings()).singleElement()
                .asString().startsWith("[PARTIAL-METADATA] users").contains("INDEXES");
    }

    @Test
    @DisplayName("위험한 변경은 분류 단계에서 경고된다")
    void unsafeChangeWarnings() {
        SchemaModel source = schema("a", table("t", notNull("id", "int"), notNull("email", "varchar(100)")));
        SchemaModel target = schema("b", table("t", notNull("id", "int"), col("email", "varchar(100)"), col("old", "text")));

        List<String> warnings = differ.classify(source, target).getWarnings();
        assertThat(warnings).anyMatch(w -> w.startsWith("[NOT-NULL] t.email"));
        assertThat(warnings).anyMatch(w -> w.startsWith("[DROP-COLUMN] t.old"));
    }

    @Test
    void columnDiffRequiresBothSides() {
        SchemaModel a = sample();
        assertThatThrownBy(() -> differ.columnDiff("missing", a, a))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
    }
}
