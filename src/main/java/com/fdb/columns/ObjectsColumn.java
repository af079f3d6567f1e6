package com.fdb.columns;

import com.fdb.core.Column;
import lombok.Getter;

/**
 * Well-known columns of the {@code Objects} table.
 */
@Getter
public enum ObjectsColumn implements Column {
    ID("id", true),
    NAME("name", false),
    PLACEABLE("placeable", false),
    TYPE("type", false),
    DESCRIPTION("description", false),
    LOCALIZE("localize", false),
    NPC_TEMPLATE_ID("npcTemplateID", false),
    DISPLAY_NAME("displayName", false),
    INTERACTION_DISTANCE("interactionDistance", false),
    NAMETAG("nametag", false),
    INTERNAL_NOTES("_internalNotes", false),
    LOC_STATUS("locStatus", false),
    GATE_VERSION("gate_version", false),
    HQ_VALID("HQ_valid", false);

    public static final String TABLE_NAME = "Objects";

    private final String columnName;
    private final boolean required;

    ObjectsColumn(String columnName, boolean required) {
        this.columnName = columnName;
        this.required = required;
    }
}
