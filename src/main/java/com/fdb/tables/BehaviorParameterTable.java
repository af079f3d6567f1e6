package com.fdb.tables;

import com.fdb.columns.BehaviorParameterColumn;
import com.fdb.core.TypedRowTable;
import com.fdb.error.FdbException;
import com.fdb.mem.Row;
import com.fdb.mem.Table;

/**
 * Typed {@code BehaviorParameter} table. Rows are bucketed by {@code behaviorID}.
 */
public final class BehaviorParameterTable extends TypedRowTable<BehaviorParameterColumn, BehaviorParameterRow> {

    public BehaviorParameterTable(Table raw) throws FdbException {
        super(raw, BehaviorParameterColumn.class);
    }

    @Override
    protected BehaviorParameterRow wrap(Row row) {
        return new BehaviorParameterRow(row, this);
    }
}
