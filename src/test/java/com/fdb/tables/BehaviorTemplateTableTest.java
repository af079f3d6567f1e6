package com.fdb.tables;

import com.fdb.StoreFixture;
import com.fdb.columns.BehaviorParameterColumn;
import com.fdb.columns.BehaviorTemplateColumn;
import com.fdb.types.Latin1Str;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class BehaviorTemplateTableTest {

    @Test
    void shouldFindTemplateByBehavior() throws Exception {
        var store = StoreFixture.store()
                .row(BehaviorTemplateColumn.TABLE_NAME, 9, 1, null, "hit")
                .row(BehaviorTemplateColumn.TABLE_NAME, 1, 4, 300, null)
                .row(BehaviorTemplateColumn.TABLE_NAME, 1, 5, 301, null)
                .build();
        var table = new BehaviorTemplateTable(store.byName(BehaviorTemplateColumn.TABLE_NAME));

        var first = table.get(1).orElseThrow();
        var other = table.get(9).orElseThrow();

        assertThat(first.getTemplateId()).isEqualTo(4);
        assertThat(first.getEffectId()).isEqualTo(300);
        assertThat(first.getEffectHandle()).isNull();
        assertThat(other.getEffectId()).isNull();
        assertThat(other.getEffectHandle()).isEqualTo(Latin1Str.of("hit"));
        assertThat(table.get(17)).isEmpty();
        assertThat(first.structName()).isEqualTo("BehaviorTemplate");
    }

    @Test
    void shouldReadBehaviorParameters() throws Exception {
        var store = StoreFixture.store()
                .row(BehaviorParameterColumn.TABLE_NAME, 3, "max_range", 20.5f)
                .build();
        var table = new BehaviorParameterTable(store.byName(BehaviorParameterColumn.TABLE_NAME));

        var row = table.keyRows(3).iterator().next();

        assertThat(row.getBehaviorId()).isEqualTo(3);
        assertThat(row.getParameterId().decode()).isEqualTo("max_range");
        assertThat(row.getValue()).isEqualTo(20.5f);
        assertThat(row.toMap()).containsExactly(
                entry("behaviorID", 3),
                entry("parameterID", "max_range"),
                entry("value", 20.5f));
    }
}
