package com.fdb.tables;

import com.fdb.columns.ObjectSkillsColumn;
import com.fdb.core.TypedRowTable;
import com.fdb.error.FdbException;
import com.fdb.mem.Row;
import com.fdb.mem.Table;

public final class ObjectSkillsTable extends TypedRowTable<ObjectSkillsColumn, ObjectSkillsRow> {

    public ObjectSkillsTable(Table raw) throws FdbException {
        super(raw, ObjectSkillsColumn.class);
    }

    @Override
    protected ObjectSkillsRow wrap(Row row) {
        return new ObjectSkillsRow(row, this);
    }
}
