package com.fdb.columns;

import com.fdb.core.Column;
import lombok.Getter;

/**
 * Well-known columns of the {@code Missions} table.
 */
@Getter
public enum MissionsColumn implements Column {
    ID("id", true),
    DEFINED_TYPE("defined_type", false),
    DEFINED_SUBTYPE("defined_subtype", false),
    UI_SORT_ORDER("UISortOrder", false),
    OFFER_OBJECT_ID("offer_objectID", false),
    TARGET_OBJECT_ID("target_objectID", false),
    REWARD_CURRENCY("reward_currency", false),
    LEGO_SCORE("LegoScore", false),
    REWARD_REPUTATION("reward_reputation", false),
    IS_CHOICE_REWARD("isChoiceReward", false),
    PREREQ_MISSION_ID("prereqMissionID", false),
    LOCALIZE("localize", false),
    IS_MISSION("isMission", true),
    MISSION_ICON_ID("missionIconID", false),
    LOC_STATUS("locStatus", false),
    GATE_VERSION("gate_version", false);

    public static final String TABLE_NAME = "Missions";

    private final String columnName;
    private final boolean required;

    MissionsColumn(String columnName, boolean required) {
        this.columnName = columnName;
        this.required = required;
    }
}
