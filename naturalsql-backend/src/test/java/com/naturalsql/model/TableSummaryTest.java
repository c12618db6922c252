package com.naturalsql.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TableSummaryTest {

    @Test
    void summarizesKeysAndTypeCounts() {
        TableSummary summary = TableSummary.of("orders", List.of(
                new ColumnInfo("id", "INTEGER", false, KeyRole.PRIMARY),
                new ColumnInfo("customer_id", "INTEGER", false, KeyRole.FOREIGN),
                new ColumnInfo("status", "TEXT", true, KeyRole.NONE),
                new ColumnInfo("created_at", "TEXT", true, KeyRole.NONE)));

        assertThat(summary.columnCount()).isEqualTo(4);
        assertThat(summary.primaryKeys()).containsExactly("id");
        assertThat(summary.foreignKeyCount()).isEqualTo(1);
        assertThat(summary.summary()).isEqualTo("4 columns; primary key: id; 1 foreign key; types: 2 INTEGER, 2 TEXT");
    }

    @Test
    void compositeKeyAndMissingTypes() {
        TableSummary summary = TableSummary.of("order_items", List.of(
                new ColumnInfo("order_id", "INTEGER", false, KeyRole.PRIMARY),
                new ColumnInfo("line", "INTEGER", false, KeyRole.PRIMARY),
                new ColumnInfo("note", null, true, KeyRole.NONE)));

        assertThat(summary.summary()).isEqualTo("3 columns; primary key: order_id, line; types: 2 INTEGER, 1 unknown");
    }

    @Test
    void emptyTable() {
        assertThat(TableSummary.of("empty", List.of()).summary()).isEqualTo("0 columns");
    }
}
