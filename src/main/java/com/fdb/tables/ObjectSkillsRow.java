package com.fdb.tables;

import com.fdb.columns.ObjectSkillsColumn;
import com.fdb.core.RowField;
import com.fdb.core.TypedRow;
import com.fdb.mem.Row;

import java.util.List;

public final class ObjectSkillsRow extends TypedRow<ObjectSkillsColumn, ObjectSkillsRow> {
    private static final List<RowField<ObjectSkillsRow>> FIELDS = List.of(
            RowField.of("objectTemplate", ObjectSkillsRow::getObjectTemplate),
            RowField.of("skillID", ObjectSkillsRow::getSkillId),
            RowField.of("castOnType", ObjectSkillsRow::getCastOnType),
            RowField.of("AICombatWeight", ObjectSkillsRow::getAiCombatWeight));

    ObjectSkillsRow(Row inner, ObjectSkillsTable table) {
        super(inner, table);
    }

    public int getObjectTemplate() {
        return requireInt(ObjectSkillsColumn.OBJECT_TEMPLATE);
    }

    public int getSkillId() {
        return requireInt(ObjectSkillsColumn.SKILL_ID);
    }

    public Integer getCastOnType() {
        return optInt(ObjectSkillsColumn.CAST_ON_TYPE);
    }

    public Integer getAiCombatWeight() {
        return optInt(ObjectSkillsColumn.AI_COMBAT_WEIGHT);
    }

    @Override
    public String structName() {
        return "ObjectSkills";
    }

    @Override
    protected List<RowField<ObjectSkillsRow>> rowFields() {
        return FIELDS;
    }
}
