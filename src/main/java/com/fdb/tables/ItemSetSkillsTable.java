package com.fdb.tables;

import com.fdb.columns.ItemSetSkillsColumn;
import com.fdb.core.TypedRowTable;
import com.fdb.error.FdbException;
import com.fdb.mem.Row;
import com.fdb.mem.Table;

public final class ItemSetSkillsTable extends TypedRowTable<ItemSetSkillsColumn, ItemSetSkillsRow> {

    public ItemSetSkillsTable(Table raw) throws FdbException {
        super(raw, ItemSetSkillsColumn.class);
    }

    @Override
    protected ItemSetSkillsRow wrap(Row row) {
        return new ItemSetSkillsRow(row, this);
    }
}
