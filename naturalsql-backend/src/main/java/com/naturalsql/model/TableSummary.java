package com.naturalsql.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * One-line overview of a table: column count, keys and column types.
 *
 * @param tableName table name
 * @param columnCount number of columns
 * @param primaryKeys primary key columns in ordinal order
 * @param foreignKeyCount number of foreign key columns
 * @param summary e.g. {@code 4 columns; primary key: id; 1 foreign key; types: 2 INTEGER, 2 TEXT}
 */
public record TableSummary(String tableName, int columnCount, List<String> primaryKeys, int foreignKeyCount,
                           String summary) {

    public static TableSummary of(String tableName, List<ColumnInfo> columns) {
        List<String> primaryKeys = new ArrayList<>();
        int foreignKeys = 0;
        Map<String, Integer> typeCounts = new LinkedHashMap<>();
        for (ColumnInfo column : columns) {
            if (column.keyRole() == KeyRole.PRIMARY) {
                primaryKeys.add(column.name());
            } else if (column.keyRole() == KeyRole.FOREIGN) {
                foreignKeys++;
            }
            String type = column.type() == null || column.type().isBlank() ? "unknown" : column.type();
            typeCounts.merge(type, 1, Integer::sum);
        }

        StringJoiner summary = new StringJoiner("; ");
        summary.add(columns.size() + (columns.size() == 1 ? " column" : " columns"));
        if (!primaryKeys.isEmpty()) {
            summary.add("primary key: " + String.join(", ", primaryKeys));
        }
        if (foreignKeys > 0) {
            summary.add(foreignKeys + (foreignKeys == 1 ? " foreign key" : " foreign keys"));
        }
        if (!typeCounts.isEmpty()) {
            StringJoiner types = new StringJoiner(", ", "types: ", "");
            typeCounts.forEach((type, count) -> types.add(count + " " + type));
            summary.add(types.toString());
        }
        return new TableSummary(tableName, columns.size(), List.copyOf(primaryKeys), foreignKeys, summary.toString());
    }
}
