package com.fdb.ext;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Summary of a mission: its icon and whether it is a mission or an achievement.
 */
@Value
public class Mission {
    /** The icon of the mission, or null. */
    Integer missionIconId;
    /** True unless the store says otherwise; a missing value counts as a mission. */
    boolean isMission;

    @JsonProperty("isMission")
    public boolean isMission() {
        return isMission;
    }
}
