package com.fdb.ext;

import lombok.Value;

/**
 * The components registered for an object template. Only the render component is tracked.
 */
@Value
public class Components {
    public static final Components NONE = new Components(null);

    /** The render component id, or null. */
    Integer render;
}
