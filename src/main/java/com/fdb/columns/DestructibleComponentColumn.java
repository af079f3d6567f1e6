package com.fdb.columns;

import com.fdb.core.Column;
import lombok.Getter;

/**
 * Well-known columns of the {@code DestructibleComponent} table.
 */
@Getter
public enum DestructibleComponentColumn implements Column {
    ID("id", true),
    FACTION("faction", false),
    FACTION_LIST("factionList", false),
    LIFE("life", false),
    IMAGINATION("imagination", false),
    LOOT_MATRIX_INDEX("LootMatrixIndex", false),
    CURRENCY_INDEX("CurrencyIndex", false),
    LEVEL("level", false),
    ARMOR("armor", false),
    DEATH_BEHAVIOR("death_behavior", false),
    ISNPC("isnpc", false),
    ATTACK_PRIORITY("attack_priority", false),
    IS_SMASHABLE("isSmashable", false),
    DIFFICULTY_LEVEL("difficultyLevel", false);

    public static final String TABLE_NAME = "DestructibleComponent";

    private final String columnName;
    private final boolean required;

    DestructibleComponentColumn(String columnName, boolean required) {
        this.columnName = columnName;
        this.required = required;
    }
}
