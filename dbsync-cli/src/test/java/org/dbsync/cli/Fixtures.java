package org.dbsync.cli;

import org.dbsync.cli.service.SchemaSnapshotService;
import org.dbsync.model.ColumnDef;
import org.dbsync.model.SchemaModel;
import org.dbsync.model.TableModel;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Source "app" and target "app_copy" schemas:
 * users is new, orders has status widened to varchar(20), products is identical,
 * legacy_logs exists only in the target.
 */
final class Fixtures {

    private Fixtures() {}

    static SchemaModel source() {
        return SchemaModel.builder().database("app")
                .table("users", table("users", 120,
                        column("id", "int(11)", false, 1, "auto_increment"),
                        column("email", "varchar(100)", true, 2, "")))
                .table("orders", table("orders", 5000,
                        column("id", "int(11)", false, 1, "auto_increment"),
                        column("status", "varchar(20)", true, 2, "")))
                .table("products", table("products", 30,
                        column("id", "int(11)", false, 1, "")))
                .build();
    }

    static SchemaModel target() {
        return SchemaModel.builder().database("app_copy")
                .table("orders", table("orders", 4800,
                        column("id", "int(11)", false, 1, "auto_increment"),
                        column("status", "varchar(10)", true, 2, "")))
                .table("products", table("products", 30,
                        column("id", "int(11)", false, 1, "")))
                .table("legacy_logs", table("legacy_logs", 9,
                        column("msg", "text", true, 1, "")))
                .build();
    }

    static TableModel table(String name, long rows, ColumnDef... columns) {
        TableModel.TableModelBuilder b = TableModel.builder()
                .name(name)
                .engine("InnoDB")
                .approximateRows(rows)
                .createStatement("CREATE TABLE `" + name + "` (\n  `id` int(11) NOT NULL\n) ENGINE=InnoDB");
        for (ColumnDef c : columns) b.column(c);
        return b.build();
    }

    static ColumnDef column(String name, String type, boolean nullable, int ordinal, String extra) {
        return ColumnDef.builder().name(name).type(type).nullable(nullable)
                .ordinalPosition(ordinal).extra(extra).build();
    }

    static Path write(SchemaModel schema, Path file) throws IOException {
        new SchemaSnapshotService().write(schema, file);
        return file;
    }
}
