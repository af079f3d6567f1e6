package com.fdb.tables;

import com.fdb.columns.BehaviorTemplateColumn;
import com.fdb.core.TypedRowTable;
import com.fdb.error.FdbException;
import com.fdb.mem.Row;
import com.fdb.mem.Table;

import java.util.Optional;

/**
 * Typed {@code BehaviorTemplate} table. Rows are bucketed by {@code behaviorID}.
 */
public final class BehaviorTemplateTable extends TypedRowTable<BehaviorTemplateColumn, BehaviorTemplateRow> {

    public BehaviorTemplateTable(Table raw) throws FdbException {
        super(raw, BehaviorTemplateColumn.class);
    }

    @Override
    protected BehaviorTemplateRow wrap(Row row) {
        return new BehaviorTemplateRow(row, this);
    }

    /**
     * Find the template of a behavior.
     */
    public Optional<BehaviorTemplateRow> get(int behaviorId) {
        return get(behaviorId, behaviorId, BehaviorTemplateColumn.BEHAVIOR_ID);
    }
}
