package dev.dataprep.model;

/**
 * How a {@link FilterDescriptor} compares its value to a candidate string.
 * Only EXACT and IS_NOT are case-sensitive.
 */
public enum FilterKind {
    EXACT,
    GLOB,
    CONTAINS,
    NOT_CONTAINS,
    REGEX,
    IS_NOT
}
