package com.naturalsql.model;

/**
 * Role a column plays in its table's keys.
 */
public enum KeyRole {
    PRIMARY,
    FOREIGN,
    NONE
}
