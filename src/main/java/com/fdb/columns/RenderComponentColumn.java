package com.fdb.columns;

import com.fdb.core.Column;
import lombok.Getter;

/**
 * Well-known columns of the {@code RenderComponent} table.
 */
@Getter
public enum RenderComponentColumn implements Column {
    ID("id", true),
    RENDER_ASSET("render_asset", false),
    ICON_ASSET("icon_asset", false),
    ICON_ID("IconID", false),
    SHADER_ID("shader_id", false),
    EFFECT1("effect1", false),
    EFFECT2("effect2", false),
    EFFECT3("effect3", false),
    EFFECT4("effect4", false),
    EFFECT5("effect5", false),
    EFFECT6("effect6", false),
    ANIMATION_GROUP_IDS("animationGroupIDs", false),
    FADE("fade", false),
    USEDROPSHADOW("usedropshadow", false);

    public static final String TABLE_NAME = "RenderComponent";

    private final String columnName;
    private final boolean required;

    RenderComponentColumn(String columnName, boolean required) {
        this.columnName = columnName;
        this.required = required;
    }
}
