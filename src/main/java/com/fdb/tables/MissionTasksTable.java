package com.fdb.tables;

import com.fdb.columns.MissionTasksColumn;
import com.fdb.core.TypedRowTable;
import com.fdb.error.FdbException;
import com.fdb.mem.Row;
import com.fdb.mem.Table;

/**
 * Typed {@code MissionTasks} table. Several tasks share the id of the mission they belong to.
 */
public final class MissionTasksTable extends TypedRowTable<MissionTasksColumn, MissionTaskRow> {

    public MissionTasksTable(Table raw) throws FdbException {
        super(raw, MissionTasksColumn.class);
    }

    @Override
    protected MissionTaskRow wrap(Row row) {
        return new MissionTaskRow(row, this);
    }
}
