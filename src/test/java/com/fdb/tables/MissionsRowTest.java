package com.fdb.tables;

import com.fdb.StoreFixture;
import com.fdb.columns.MissionsColumn;
import com.fdb.mem.HeapTables;
import com.fdb.types.Latin1Str;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class MissionsRowTest {

    private static MissionsTable missions(HeapTables store) throws Exception {
        return new MissionsTable(store.byName(MissionsColumn.TABLE_NAME));
    }

    @Test
    void shouldReadColumns() throws Exception {
        var table = missions(StoreFixture.store()
                .namedRow(MissionsColumn.TABLE_NAME,
                        "id", 100, "defined_type", "Story", "isMission", true, "UISortOrder", 3, "missionIconID", 7)
                .build());

        var row = table.get(100).orElseThrow();

        assertThat(row.getId()).isEqualTo(100);
        assertThat(row.getDefinedType()).isEqualTo(Latin1Str.of("Story"));
        assertThat(row.getDefinedSubtype()).isNull();
        assertThat(row.isMission()).isTrue();
        assertThat(row.getUiSortOrder()).isEqualTo(3);
        assertThat(row.getMissionIconId()).isEqualTo(7);
    }

    @Test
    void shouldReturnNullForAbsentOptionalColumn() throws Exception {
        var store = HeapTables.builder()
                .table(MissionsColumn.TABLE_NAME, 4, "id", "isMission")
                .row(1, true)
                .build();

        var row = missions(store).get(1).orElseThrow();

        assertThat(row.getId()).isEqualTo(1);
        assertThat(row.getMissionIconId()).isNull();
        assertThat(row.getDefinedType()).isNull();
        assertThat(row.toMap()).containsEntry("missionIconID", null);
    }

    @Test
    void shouldRejectWrongVariantInRequiredColumn() throws Exception {
        var table = missions(StoreFixture.store()
                .namedRow(MissionsColumn.TABLE_NAME, "id", 100, "isMission", 1)
                .build());

        var row = table.get(100).orElseThrow();

        assertThatThrownBy(row::isMission)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Column 'Missions::isMission' is INTEGER, expected BOOLEAN");
    }

    @Test
    void shouldRejectMissingValueInRequiredColumn() throws Exception {
        var table = missions(StoreFixture.store()
                .namedRow(MissionsColumn.TABLE_NAME, "id", 100)
                .build());

        var row = table.get(100).orElseThrow();

        assertThatThrownBy(row::isMission)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Column 'Missions::isMission' is NOTHING, expected BOOLEAN");
    }

    @Test
    void shouldProjectFieldsInDeclarationOrder() throws Exception {
        var table = missions(StoreFixture.store()
                .namedRow(MissionsColumn.TABLE_NAME, "id", 100, "defined_type", "Story", "isMission", false)
                .build());

        var row = table.get(100).orElseThrow();
        var expected = new LinkedHashMap<String, Object>();
        expected.put("id", row.getId());
        expected.put("defined_type", row.getDefinedType().decode());
        expected.put("defined_subtype", null);
        expected.put("isMission", row.isMission());
        expected.put("UISortOrder", null);
        expected.put("missionIconID", null);

        assertThat(row.structName()).isEqualTo("Mission");
        assertThat(row.fieldNames()).containsExactly(
                "id", "defined_type", "defined_subtype", "isMission", "UISortOrder", "missionIconID");
        assertThat(row.toMap()).containsExactlyEntriesOf(expected);
        assertThat(row.toMap()).contains(entry("defined_type", "Story"));
        assertThat(row.toString()).startsWith("Mission{id=100, defined_type=Story");
    }
}
