package com.fdb.mem;

import com.fdb.types.Field;

import java.util.List;

/**
 * A raw row: one {@link Field} per column, addressed by physical column index.
 */
public interface Row {

    /**
     * @return the field at {@code index}, or null if the row has no such column
     */
    Field fieldAt(int index);

    /**
     * @return all fields in declared column order
     */
    List<Field> fields();
}
