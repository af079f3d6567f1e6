package com.fdb.tables;

import com.fdb.columns.SkillBehaviorColumn;
import com.fdb.core.TypedRowTable;
import com.fdb.error.FdbException;
import com.fdb.mem.Row;
import com.fdb.mem.Table;

import java.util.Optional;

/**
 * Typed {@code SkillBehavior} table.
 */
public final class SkillBehaviorTable extends TypedRowTable<SkillBehaviorColumn, SkillBehaviorRow> {

    public SkillBehaviorTable(Table raw) throws FdbException {
        super(raw, SkillBehaviorColumn.class);
    }

    @Override
    protected SkillBehaviorRow wrap(Row row) {
        return new SkillBehaviorRow(row, this);
    }

    public Optional<SkillBehaviorRow> get(int skillId) {
        return get(skillId, skillId, SkillBehaviorColumn.SKILL_ID);
    }
}
