package com.fdb.tables;

import com.fdb.columns.MissionsColumn;
import com.fdb.core.TypedRowTable;
import com.fdb.error.FdbException;
import com.fdb.mem.Row;
import com.fdb.mem.Table;

import java.util.Optional;

public final class MissionsTable extends TypedRowTable<MissionsColumn, MissionsRow> {

    public MissionsTable(Table raw) throws FdbException {
        super(raw, MissionsColumn.class);
    }

    @Override
    protected MissionsRow wrap(Row row) {
        return new MissionsRow(row, this);
    }

    /**
     * Find a mission by its id. The first matching row wins.
     */
    public Optional<MissionsRow> get(int id) {
        return get(id, id, MissionsColumn.ID);
    }
}
