package com.fdb.columns;

import com.fdb.core.Column;
import lombok.Getter;

/**
 * Well-known columns of the {@code ObjectSkills} table.
 */
@Getter
public enum ObjectSkillsColumn implements Column {
    OBJECT_TEMPLATE("objectTemplate", true),
    SKILL_ID("skillID", true),
    CAST_ON_TYPE("castOnType", false),
    AI_COMBAT_WEIGHT("AICombatWeight", false);

    public static final String TABLE_NAME = "ObjectSkills";

    private final String columnName;
    private final boolean required;

    ObjectSkillsColumn(String columnName, boolean required) {
        this.columnName = columnName;
        this.required = required;
    }
}
