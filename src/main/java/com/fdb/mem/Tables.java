package com.fdb.mem;

import java.util.List;

/**
 * The set of tables in an opened store.
 */
public interface Tables {

    /**
     * Find a table by its name.
     * @param name the table name, e.g. {@code "Missions"}
     * @return the table, or null if the store has no table of that name
     */
    Table byName(String name);

    /**
     * @return the names of all tables, in the order the store declares them
     */
    List<String> tableNames();
}
