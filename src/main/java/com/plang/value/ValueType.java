package com.plang.value;

/**
 * Tags of the variants a {@link Value} can take.
 */
public enum ValueType {
    NULL,
    BOOL,
    INT,
    FLOAT,
    STRING,
    LIST,
    MAP
}
