package com.fdb.columns;

import com.fdb.core.Column;
import lombok.Getter;

/**
 * Well-known columns of the {@code ItemSets} table.
 */
@Getter
public enum ItemSetsColumn implements Column {
    SET_ID("setID", true),
    LOC_STATUS("locStatus", false),
    ITEM_IDS("itemIDs", false),
    KIT_TYPE("kitType", false),
    KIT_RANK("kitRank", false),
    KIT_IMAGE("kitImage", false),
    SKILL_SET_WITH_2("skillSetWith2", false),
    SKILL_SET_WITH_3("skillSetWith3", false),
    SKILL_SET_WITH_4("skillSetWith4", false),
    SKILL_SET_WITH_5("skillSetWith5", false),
    SKILL_SET_WITH_6("skillSetWith6", false),
    LOCALIZE("localize", false),
    GATE_VERSION("gate_version", false),
    KIT_ID("kitID", false),
    PRIORITY("priority", false);

    public static final String TABLE_NAME = "ItemSets";

    private final String columnName;
    private final boolean required;

    ItemSetsColumn(String columnName, boolean required) {
        this.columnName = columnName;
        this.required = required;
    }
}
