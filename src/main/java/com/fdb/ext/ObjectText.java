package com.fdb.ext;

import com.fdb.types.Latin1Str;
import lombok.experimental.UtilityClass;

/**
 * Formatting of object titles and descriptions. Null and empty text both count as "no value".
 */
@UtilityClass
public class ObjectText {

    /**
     * Build the title of an object.
     * <ul>
     *   <li>{@code "{displayName} ({name}) | Object #{id}"} when both are set and differ</li>
     *   <li>{@code "{name} | Object #{id}"} when only the name is set, or both are equal</li>
     *   <li>{@code "{displayName} | Object #{id}"} when only the display name is set</li>
     *   <li>{@code "Object #{id}"} otherwise</li>
     * </ul>
     */
    public static String formatTitle(int id, Latin1Str name, Latin1Str displayName) {
        var n = nonEmpty(name);
        var d = nonEmpty(displayName);
        if (n != null && d != null && !d.equals(n)) {
            return d.decode() + " (" + n.decode() + ") | Object #" + id;
        }
        if (n != null) {
            return n.decode() + " | Object #" + id;
        }
        if (d != null) {
            return d.decode() + " | Object #" + id;
        }
        return "Object #" + id;
    }

    /**
     * Build the description of an object from its description and internal notes.
     * Both are joined as {@code "{description} ({internalNotes})"} when set and different; otherwise whichever
     * is set is used, or the empty string.
     */
    public static String formatDescription(Latin1Str description, Latin1Str internalNotes) {
        var desc = nonEmpty(description);
        var notes = nonEmpty(internalNotes);
        if (desc != null && notes != null && !desc.equals(notes)) {
            return desc.decode() + " (" + notes.decode() + ")";
        }
        if (desc != null) {
            return desc.decode();
        }
        if (notes != null) {
            return notes.decode();
        }
        return "";
    }

    private static Latin1Str nonEmpty(Latin1Str text) {
        return text == null || text.isEmpty() ? null : text;
    }
}
