package com.naturalsql.compiler;

import com.naturalsql.config.BusyPolicy;
import com.naturalsql.config.PipelineSettings;
import com.naturalsql.exception.ErrorKind;
import com.naturalsql.model.ColumnInfo;
import com.naturalsql.model.EngineKind;
import com.naturalsql.model.HistoryEntry;
import com.naturalsql.model.KeyRole;
import com.naturalsql.model.SchemaSnapshot;
import com.naturalsql.model.StatementKind;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {

    private final PromptBuilder builder = new PromptBuilder(PipelineSettings.defaults());
    private final SchemaSnapshot snapshot = snapshot();

    @Test
    void ranksTablesByNameAndColumnHits() {
        assertThat(builder.rankTables("total amount per customer", snapshot))
                .containsExactly("customers", "orders");
    }

    @Test
    void fallsBackToAllTablesByName() {
        assertThat(builder.rankTables("hello there", snapshot))
                .containsExactly("customers", "orders", "products");
    }

    @Test
    void keepsMostRelevantTableWhenBudgetIsTiny() {
        PromptBuilder tiny = new PromptBuilder(new PipelineSettings(
                true, 300, 500, true, 1000, 1000, 30000, BusyPolicy.WAIT, 1, 3, 5000));

        assertThat(tiny.selectTables("total amount per customer", snapshot))
                .containsExactly("- customers(id INTEGER PK NOT NULL, name TEXT NOT NULL)");
    }

    @Test
    void rendersRequestSchemaAndHistory() {
        List<HistoryEntry> tail = List.of(
                HistoryEntry.builder().requestText("list customers").sql("SELECT name FROM customers")
                        .kind(StatementKind.SELECT).success(true).build(),
                HistoryEntry.builder().requestText("drop everything").kind(StatementKind.DELETE).success(false)
                        .errorKind(ErrorKind.COMPILATION_ERROR).errorMessage("no usable statement").build());

        Prompt prompt = builder.build("orders per customer", snapshot, tail, null, EngineKind.SQLITE);

        assertThat(prompt.user()).startsWith("Request:\norders per customer\n\nSchema:\n");
        assertThat(prompt.user()).contains("- orders(id INTEGER PK NOT NULL, customer_id INTEGER FK NOT NULL, amount REAL)");
        assertThat(prompt.user()).contains("Recent requests (oldest first):\n[1] Request: list customers\n    SQL: SELECT name FROM customers\n");
        assertThat(prompt.user()).contains("[2] Request: drop everything\n    ERROR: no usable statement");
        assertThat(prompt.system()).contains("SQLite").contains("SELECT query");
        assertThat(prompt.attempt()).isEqualTo(1);
        assertThat(prompt.expectedKind()).isNull();
    }

    @Test
    void systemPromptNamesRequestedMutation() {
        Prompt prompt = builder.build("delete order 3", snapshot, List.of(), StatementKind.DELETE, EngineKind.POSTGRES);

        assertThat(prompt.system()).contains("single DELETE statement").contains("PostgreSQL");
        assertThat(prompt.user()).doesNotContain("Recent requests");
    }

    @Test
    void identicalInputsGiveIdenticalPrompts() {
        Prompt first = builder.build("orders per customer", snapshot, List.of(), null, EngineKind.MYSQL);
        Prompt second = builder.build("orders per customer", snapshot, List.of(), null, EngineKind.MYSQL);

        assertThat(first).isEqualTo(second);
    }

    @Test
    void singularizesCommonPlurals() {
        assertThat(PromptBuilder.singular("orders")).isEqualTo("order");
        assertThat(PromptBuilder.singular("categories")).isEqualTo("category");
        assertThat(PromptBuilder.singular("addresses")).isEqualTo("address");
        assertThat(PromptBuilder.singular("boxes")).isEqualTo("box");
        assertThat(PromptBuilder.singular("status")).isEqualTo("status");
        assertThat(PromptBuilder.singular("class")).isEqualTo("class");
        assertThat(PromptBuilder.singular("ids")).isEqualTo("ids");
    }

    @Test
    void tokenizesIdentifiersAndText() {
        assertThat(PromptBuilder.tokens("Customer_ID of Orders")).containsExactly("customer", "id", "of", "order");
    }

    private static SchemaSnapshot snapshot() {
        Map<String, List<ColumnInfo>> tables = new LinkedHashMap<>();
        tables.put("orders", List.of(
                new ColumnInfo("id", "INTEGER", false, KeyRole.PRIMARY),
                new ColumnInfo("customer_id", "INTEGER", false, KeyRole.FOREIGN),
                new ColumnInfo("amount", "REAL", true, KeyRole.NONE)));
        tables.put("customers", List.of(
                new ColumnInfo("id", "INTEGER", false, KeyRole.PRIMARY),
                new ColumnInfo("name", "TEXT", false, KeyRole.NONE)));
        tables.put("products", List.of(
                new ColumnInfo("id", "INTEGER", false, KeyRole.PRIMARY),
                new ColumnInfo("title", "TEXT", true, KeyRole.NONE)));
        return new SchemaSnapshot("conn-1", tables, OffsetDateTime.now());
    }
}
