package org.dbsync.migration.differs;

import org.dbsync.model.IndexDef;
import org.dbsync.model.IndexDiff;
import org.dbsync.model.TableModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.dbsync.testing.Schemas.col;
import static org.dbsync.testing.Schemas.index;
import static org.dbsync.testing.Schemas.table;

class IndexDifferTest {

    private final IndexDiffer differ = new IndexDiffer();

    private static TableModel withIndexes(IndexDef... indexes) {
        TableModel.TableModelBuilder b = table("t", col("a", "int"), col("b", "int")).toBuilder();
        for (IndexDef i : indexes) b.index(i);
        return b.build();
    }

    @Test
    @DisplayName("같은 이름, 다른 컬럼 구성은 removed(옛 정의) + added(새 정의)")
    void changedMembersAreReplaced() {
        IndexDiff diff = differ.diff(
                withIndexes(index("idx_ab", "a", "b")),
                withIndexes(index("idx_ab", "b", "a")));

        assertThat(diff.getRemoved()).singleElement()
                .satisfies(i -> assertThat(i.getColumns()).containsExactly("b", "a"));
        assertThat(diff.getAdded()).singleElement()
                .satisfies(i -> assertThat(i.getColumns()).containsExactly("a", "b"));
    }

    @Test
    void addedAndRemovedByName() {
        IndexDiff diff = differ.diff(
                withIndexes(index("PRIMARY", "a"), index("idx_new", "b")),
                withIndexes(index("PRIMARY", "a"), index("idx_old", "b")));

        assertThat(diff.getAdded()).extracting(IndexDef::getName).containsExactly("idx_new");
        assertThat(diff.getRemoved()).extracting(IndexDef::getName).containsExactly("idx_old");
    }

    @Test
    void identicalIndexes() {
        assertThat(differ.diff(withIndexes(index("i", "a")), withIndexes(index("i", "a"))).isEmpty()).isTrue();
    }
}
