package com.fdb.mem;

import java.util.List;

/**
 * One hash partition of a {@link Table}.
 */
public interface Bucket {

    /**
     * @return the rows of this bucket in stored order
     */
    List<Row> rows();
}
