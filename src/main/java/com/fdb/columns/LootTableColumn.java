package com.fdb.columns;

import com.fdb.core.Column;
import lombok.Getter;

/**
 * Well-known columns of the {@code LootTable} table.
 */
@Getter
public enum LootTableColumn implements Column {
    ITEMID("itemid", true),
    LOOT_TABLE_INDEX("LootTableIndex", false),
    ID("id", false),
    MISSION_DROP("MissionDrop", false),
    SORT_PRIORITY("sortPriority", false);

    public static final String TABLE_NAME = "LootTable";

    private final String columnName;
    private final boolean required;

    LootTableColumn(String columnName, boolean required) {
        this.columnName = columnName;
        this.required = required;
    }
}
