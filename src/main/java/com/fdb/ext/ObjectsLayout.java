package com.fdb.ext;

import com.fdb.mem.Row;
import com.fdb.types.Latin1Str;
import lombok.experimental.UtilityClass;

/**
 * Fixed physical layout of the {@code Objects} table used by the name/description query.
 * <p>
 * Unlike every other query, this one does not go through the column resolver: it reads the fields at
 * positions 1, 4, 7 and 10 of the row, which is where {@code name}, {@code description}, {@code displayName}
 * and {@code _internalNotes} are stored in the reference schema. A file whose {@code Objects} columns are
 * laid out differently yields whatever text sits at those positions. A position past the end of the row, or a
 * non-text value, reads as "no value".
 */
@UtilityClass
public class ObjectsLayout {
    public static final int ID = 0;
    public static final int NAME = 1;
    public static final int DESCRIPTION = 4;
    public static final int DISPLAY_NAME = 7;
    public static final int INTERNAL_NOTES = 10;

    /**
     * Build title and description from a row whose id column matched {@code id}.
     */
    public static ObjectNameDesc read(Row row, int id) {
        var title = ObjectText.formatTitle(id, text(row, NAME), text(row, DISPLAY_NAME));
        var description = ObjectText.formatDescription(text(row, DESCRIPTION), text(row, INTERNAL_NOTES));
        return new ObjectNameDesc(title, description);
    }

    private static Latin1Str text(Row row, int position) {
        var field = row.fieldAt(position);
        return field == null ? null : field.asText();
    }
}
