package com.fdb.ext;

import lombok.Value;

/**
 * Human-readable title and description of an object template.
 */
@Value
public class ObjectNameDesc {
    String title;
    String description;
}
