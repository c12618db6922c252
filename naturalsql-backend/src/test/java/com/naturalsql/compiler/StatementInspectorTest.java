package com.naturalsql.compiler;

import com.naturalsql.model.StatementKind;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StatementInspectorTest {

    @Test
    void classifiesDataStatements() throws Exception {
        assertThat(classify("SELECT id FROM orders")).isEqualTo(StatementKind.SELECT);
        assertThat(classify("INSERT INTO orders (id) VALUES (?)")).isEqualTo(StatementKind.INSERT);
        assertThat(classify("UPDATE orders SET status = ? WHERE id = ?")).isEqualTo(StatementKind.UPDATE);
        assertThat(classify("DELETE FROM orders WHERE id = ?")).isEqualTo(StatementKind.DELETE);
    }

    @Test
    void commonTableExpressionIsSelect() throws Exception {
        assertThat(classify("WITH recent AS (SELECT id FROM orders) SELECT id FROM recent"))
                .isEqualTo(StatementKind.SELECT);
    }

    @Test
    void everythingElseIsOther() throws Exception {
        assertThat(classify("DROP TABLE orders")).isEqualTo(StatementKind.OTHER);
        assertThat(classify("CREATE TABLE t (id INT)")).isEqualTo(StatementKind.OTHER);
        assertThat(classify("TRUNCATE TABLE orders")).isEqualTo(StatementKind.OTHER);
    }

    @Test
    void selectIntoIsOther() throws Exception {
        assertThat(classify("SELECT * INTO backup FROM orders")).isEqualTo(StatementKind.OTHER);
        assertThat(StatementInspector.selectsInto("SELECT * FROM orders INTO OUTFILE '/tmp/orders.csv'")).isTrue();
        assertThat(StatementInspector.selectsInto("SELECT 'into' AS word, \"into\" FROM notes")).isFalse();
    }

    @Test
    void extractsTablesWithoutSchemaOrQuotes() throws Exception {
        Statement statement = CCJSqlParserUtil.parse(
                "SELECT o.id FROM public.orders o JOIN \"customers\" c ON c.id = o.customer_id");

        assertThat(StatementInspector.tables(statement)).containsExactly("customers", "orders");
    }

    @Test
    void extractsTablesFromSubqueries() throws Exception {
        Statement statement = CCJSqlParserUtil.parse(
                "DELETE FROM orders WHERE customer_id IN (SELECT id FROM customers WHERE email = ?)");

        assertThat(StatementInspector.tables(statement)).containsExactly("customers", "orders");
    }

    @Test
    void normalizesQualifiedNames() {
        assertThat(StatementInspector.normalizeTableName("main.`orders`")).isEqualTo("orders");
        assertThat(StatementInspector.normalizeTableName("\"my.schema\".\"line_items\"")).isEqualTo("line_items");
        assertThat(StatementInspector.normalizeTableName(null)).isEmpty();
    }

    private static StatementKind classify(String sql) throws Exception {
        return StatementInspector.classify(sql, CCJSqlParserUtil.parse(sql));
    }
}
