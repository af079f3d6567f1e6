package com.fdb.ext;

import lombok.Value;

/**
 * One task of a mission.
 */
@Value
public class MissionTask {
    /** The icon of the task, or null. */
    Integer iconId;
    int uid;
}
