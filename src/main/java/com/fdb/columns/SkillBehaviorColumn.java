package com.fdb.columns;

import com.fdb.core.Column;
import lombok.Getter;

/**
 * Well-known columns of the {@code SkillBehavior} table.
 */
@Getter
public enum SkillBehaviorColumn implements Column {
    SKILL_ID("skillID", true),
    LOC_STATUS("locStatus", true),
    BEHAVIOR_ID("behaviorID", true),
    IMAGINATIONCOST("imaginationcost", true),
    COOLDOWNGROUP("cooldowngroup", true),
    COOLDOWN("cooldown", true),
    IN_NPC_EDITOR("inNpcEditor", true),
    SKILL_ICON("skillIcon", true),
    OOM_SKILL_ID("oomSkillID", true),
    OOM_BEHAVIOR_EFFECT_ID("oomBehaviorEffectID", true),
    CAST_TYPE_DESC("castTypeDesc", true),
    IM_BONUS_UI("imBonusUI", true),
    LIFE_BONUS_UI("lifeBonusUI", true),
    ARMOR_BONUS_UI("armorBonusUI", true),
    DAMAGE_UI("damageUI", true),
    HIDE_ICON("hideIcon", true),
    LOCALIZE("localize", true),
    GATE_VERSION("gate_version", true),
    CANCEL_TYPE("cancelType", true);

    public static final String TABLE_NAME = "SkillBehavior";

    private final String columnName;
    private final boolean required;

    SkillBehaviorColumn(String columnName, boolean required) {
        this.columnName = columnName;
        this.required = required;
    }
}
