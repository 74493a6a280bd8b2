package dev.dataprep.model;

/**
 * Which part of a file path a filter looks at.
 */
public enum FilterTarget {
    FILENAME,
    FULL_PATH
}
