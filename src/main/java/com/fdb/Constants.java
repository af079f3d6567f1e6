package com.fdb;

public final class Constants {
    /** Physical index of the primary key that rows are bucketed by. */
    public static final int KEY_COLUMN = 0;

    /** {@code ComponentsRegistry.component_type} of render components. */
    public static final int COMPONENT_TYPE_RENDER = 2;

    // Fixed positions read by the component and render image queries
    public static final int COMPONENT_TYPE_POSITION = 1;
    public static final int COMPONENT_ID_POSITION = 2;
    public static final int ICON_ASSET_POSITION = 2;

    private Constants() {}
}
