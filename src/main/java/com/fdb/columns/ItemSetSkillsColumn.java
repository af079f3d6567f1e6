package com.fdb.columns;

import com.fdb.core.Column;
import lombok.Getter;

/**
 * Well-known columns of the {@code ItemSetSkills} table.
 */
@Getter
public enum ItemSetSkillsColumn implements Column {
    SKILL_SET_ID("SkillSetID", true),
    SKILL_ID("SkillID", true),
    SKILL_CAST_TYPE("SkillCastType", false);

    public static final String TABLE_NAME = "ItemSetSkills";

    private final String columnName;
    private final boolean required;

    ItemSetSkillsColumn(String columnName, boolean required) {
        this.columnName = columnName;
        this.required = required;
    }
}
