package com.elime.model;

public enum RenderMode {
    /** One frame per calendar day between the first and the last photo. */
    FILL,
    /** One frame per stored photo. */
    ALL
}
