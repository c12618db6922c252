package com.naturalsql.model;

/**
 * One introspected column.
 *
 * @param name     column name as reported by the engine
 * @param type     declared type name
 * @param nullable whether NULL is allowed
 * @param keyRole  key role; primary wins over foreign
 */
public record ColumnInfo(String name, String type, boolean nullable, KeyRole keyRole) {
}
