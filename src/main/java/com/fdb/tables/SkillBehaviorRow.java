package com.fdb.tables;

import com.fdb.columns.SkillBehaviorColumn;
import com.fdb.core.RowField;
import com.fdb.core.TypedRow;
import com.fdb.mem.Row;
import com.fdb.types.Latin1Str;

import java.util.List;

/**
 * One row of the {@code SkillBehavior} table. Every column of this kind is required.
 */
public final class SkillBehaviorRow extends TypedRow<SkillBehaviorColumn, SkillBehaviorRow> {
    private static final List<RowField<SkillBehaviorRow>> FIELDS = List.of(
            RowField.of("skillID", SkillBehaviorRow::getSkillId),
            RowField.of("locStatus", SkillBehaviorRow::getLocStatus),
            RowField.of("behaviorID", SkillBehaviorRow::getBehaviorId),
            RowField.of("imaginationcost", SkillBehaviorRow::getImaginationCost),
            RowField.of("cooldowngroup", SkillBehaviorRow::getCooldownGroup),
            RowField.of("cooldown", SkillBehaviorRow::getCooldown),
            RowField.of("inNpcEditor", SkillBehaviorRow::isInNpcEditor),
            RowField.of("skillIcon", SkillBehaviorRow::getSkillIcon),
            RowField.of("oomSkillID", SkillBehaviorRow::getOomSkillId),
            RowField.of("oomBehaviorEffectID", SkillBehaviorRow::getOomBehaviorEffectId),
            RowField.of("castTypeDesc", SkillBehaviorRow::getCastTypeDesc),
            RowField.of("imBonusUI", SkillBehaviorRow::getImBonusUi),
            RowField.of("lifeBonusUI", SkillBehaviorRow::getLifeBonusUi),
            RowField.of("armorBonusUI", SkillBehaviorRow::getArmorBonusUi),
            RowField.of("damageUI", SkillBehaviorRow::getDamageUi),
            RowField.of("hideIcon", SkillBehaviorRow::isHideIcon),
            RowField.of("localize", SkillBehaviorRow::isLocalize),
            RowField.of("gate_version", SkillBehaviorRow::getGateVersion),
            RowField.of("cancelType", SkillBehaviorRow::getCancelType));

    SkillBehaviorRow(Row inner, SkillBehaviorTable table) {
        super(inner, table);
    }

    public int getSkillId() {
        return requireInt(SkillBehaviorColumn.SKILL_ID);
    }

    public int getLocStatus() {
        return requireInt(SkillBehaviorColumn.LOC_STATUS);
    }

    public int getBehaviorId() {
        return requireInt(SkillBehaviorColumn.BEHAVIOR_ID);
    }

    public int getImaginationCost() {
        return requireInt(SkillBehaviorColumn.IMAGINATIONCOST);
    }

    public int getCooldownGroup() {
        return requireInt(SkillBehaviorColumn.COOLDOWNGROUP);
    }

    public float getCooldown() {
        return requireFloat(SkillBehaviorColumn.COOLDOWN);
    }

    public boolean isInNpcEditor() {
        return requireBool(SkillBehaviorColumn.IN_NPC_EDITOR);
    }

    public int getSkillIcon() {
        return requireInt(SkillBehaviorColumn.SKILL_ICON);
    }

    public Latin1Str getOomSkillId() {
        return requireText(SkillBehaviorColumn.OOM_SKILL_ID);
    }

    public int getOomBehaviorEffectId() {
        return requireInt(SkillBehaviorColumn.OOM_BEHAVIOR_EFFECT_ID);
    }

    public int getCastTypeDesc() {
        return requireInt(SkillBehaviorColumn.CAST_TYPE_DESC);
    }

    public int getImBonusUi() {
        return requireInt(SkillBehaviorColumn.IM_BONUS_UI);
    }

    public int getLifeBonusUi() {
        return requireInt(SkillBehaviorColumn.LIFE_BONUS_UI);
    }

    public int getArmorBonusUi() {
        return requireInt(SkillBehaviorColumn.ARMOR_BONUS_UI);
    }

    public int getDamageUi() {
        return requireInt(SkillBehaviorColumn.DAMAGE_UI);
    }

    public boolean isHideIcon() {
        return requireBool(SkillBehaviorColumn.HIDE_ICON);
    }

    public boolean isLocalize() {
        return requireBool(SkillBehaviorColumn.LOCALIZE);
    }

    public Latin1Str getGateVersion() {
        return requireText(SkillBehaviorColumn.GATE_VERSION);
    }

    public int getCancelType() {
        return requireInt(SkillBehaviorColumn.CANCEL_TYPE);
    }

    @Override
    public String structName() {
        return "SkillBehavior";
    }

    @Override
    protected List<RowField<SkillBehaviorRow>> rowFields() {
        return FIELDS;
    }
}
