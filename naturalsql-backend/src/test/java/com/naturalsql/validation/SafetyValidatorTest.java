package com.naturalsql.validation;

import com.naturalsql.compiler.StatementInspector;
import com.naturalsql.model.CandidateStatement;
import com.naturalsql.model.ColumnInfo;
import com.naturalsql.model.KeyRole;
import com.naturalsql.model.RejectionReason;
import com.naturalsql.model.SchemaSnapshot;
import com.naturalsql.model.StatementKind;
import com.naturalsql.model.Verdict;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SafetyValidatorTest {

    private final SafetyValidator validator = new SafetyValidator();
    private final SchemaSnapshot snapshot = snapshot();

    @Test
    void acceptsParameterizedSelect() throws Exception {
        Verdict verdict = validator.validate(
                candidate("SELECT id, status FROM orders WHERE customer_id = ?", "orders of customer 42", 42),
                snapshot);

        assertThat(verdict.isAccepted()).isTrue();
        assertThat(verdict.getReason()).isNull();
    }

    @Test
    void rejectsDdl() throws Exception {
        Verdict verdict = validator.validate(candidate("DROP TABLE orders", "drop the orders table"), snapshot);

        assertThat(verdict.isAccepted()).isFalse();
        assertThat(verdict.getReason()).isEqualTo(RejectionReason.DISALLOWED_STATEMENT_KIND);
    }

    @Test
    void rejectsSelectIntoNewTable() throws Exception {
        Verdict verdict = validator.validate(candidate("SELECT * INTO backup FROM orders", "back up the orders"),
                snapshot, StatementKind.SELECT);

        assertThat(verdict.isAccepted()).isFalse();
        assertThat(verdict.getReason()).isEqualTo(RejectionReason.DISALLOWED_STATEMENT_KIND);
        assertThat(verdict.getMessage()).contains("INTO");
    }

    @Test
    void rejectsAdministrativeFunctions() throws Exception {
        Verdict terminate = validator.validate(candidate("SELECT pg_terminate_backend(?)", "stop process 12", 12),
                snapshot);
        Verdict sleep = validator.validate(
                candidate("SELECT id FROM orders WHERE id = ? AND pg_sleep(5) IS NOT NULL",
                        "order 3", 3),
                snapshot);
        Verdict inUpdate = validator.validate(
                candidate("UPDATE orders SET status = load_file(?) WHERE id = ?", "load status", "/etc/passwd", 1),
                snapshot);

        assertThat(terminate.getReason()).isEqualTo(RejectionReason.DISALLOWED_STATEMENT_KIND);
        assertThat(terminate.getMessage()).contains("pg_terminate_backend");
        assertThat(sleep.getReason()).isEqualTo(RejectionReason.DISALLOWED_STATEMENT_KIND);
        assertThat(inUpdate.getReason()).isEqualTo(RejectionReason.DISALLOWED_STATEMENT_KIND);
    }

    @Test
    void columnNamedLikeFunctionIsNotAFunctionCall() {
        assertThat(SafetyValidator.findAdminFunction("SELECT sleep FROM orders WHERE benchmark > ?")).isNull();
        assertThat(SafetyValidator.findAdminFunction("SELECT SLEEP(1)")).isEqualTo("sleep");
        assertThat(SafetyValidator.findAdminFunction("SELECT pg_catalog.\"pg_sleep\"(5)")).isEqualTo("pg_sleep");
    }

    @Test
    void rejectsKindOtherThanExpected() throws Exception {
        Verdict verdict = validator.validate(
                candidate("UPDATE orders SET status = ? WHERE id = ?", "cancel order 7", "cancelled", 7),
                snapshot, StatementKind.DELETE);

        assertThat(verdict.getReason()).isEqualTo(RejectionReason.DISALLOWED_STATEMENT_KIND);
        assertThat(verdict.getMessage()).contains("Expected a DELETE");
    }

    @Test
    void rejectsDeleteWithoutWhere() throws Exception {
        Verdict verdict = validator.validate(candidate("DELETE FROM orders", "delete all orders"), snapshot);

        assertThat(verdict.getReason()).isEqualTo(RejectionReason.MISSING_FILTER_PREDICATE);
    }

    @Test
    void rejectsUpdateWithConstantPredicate() throws Exception {
        Verdict verdict = validator.validate(
                candidate("UPDATE orders SET status = ? WHERE 1 = 1", "close everything", "closed"), snapshot);

        assertThat(verdict.getReason()).isEqualTo(RejectionReason.MISSING_FILTER_PREDICATE);
    }

    @Test
    void filterRuleIsCheckedBeforeTableRule() throws Exception {
        Verdict verdict = validator.validate(candidate("DELETE FROM invoices", "delete invoices"), snapshot);

        assertThat(verdict.getReason()).isEqualTo(RejectionReason.MISSING_FILTER_PREDICATE);
    }

    @Test
    void rejectsUnknownTable() throws Exception {
        Verdict verdict = validator.validate(candidate("SELECT id FROM invoices", "list invoices"), snapshot);

        assertThat(verdict.getReason()).isEqualTo(RejectionReason.UNKNOWN_TABLE);
        assertThat(verdict.getMessage()).isEqualTo("Unknown table: invoices");
    }

    @Test
    void tableLookupIgnoresCase() throws Exception {
        Verdict verdict = validator.validate(candidate("SELECT id FROM ORDERS", "list orders"), snapshot);

        assertThat(verdict.isAccepted()).isTrue();
    }

    @Test
    void rejectsNumberInlinedFromRequest() throws Exception {
        Verdict verdict = validator.validate(
                candidate("DELETE FROM orders WHERE id = 456", "delete the order with ID 456"), snapshot);

        assertThat(verdict.getReason()).isEqualTo(RejectionReason.UNPARAMETERIZED_LITERAL);
        assertThat(verdict.getMessage()).contains("456");
    }

    @Test
    void rejectsStringInlinedFromRequest() throws Exception {
        Verdict verdict = validator.validate(
                candidate("SELECT email FROM customers WHERE name = 'Alice'", "find the email of Alice"), snapshot);

        assertThat(verdict.getReason()).isEqualTo(RejectionReason.UNPARAMETERIZED_LITERAL);
    }

    @Test
    void limitCountMayRepeatRequestNumber() throws Exception {
        Verdict verdict = validator.validate(
                candidate("SELECT id FROM orders ORDER BY created_at DESC LIMIT 10", "latest 10 orders"), snapshot);

        assertThat(verdict.isAccepted()).isTrue();
    }

    @Test
    void literalsNotTakenFromRequestAreAllowed() throws Exception {
        Verdict verdict = validator.validate(
                candidate("SELECT COUNT(*) FROM orders WHERE status = 'open'", "how many orders are pending"), snapshot);

        assertThat(verdict.isAccepted()).isTrue();
    }

    @Test
    void singleLetterCodeIsNotMatchedInsideRequestWords() throws Exception {
        Verdict verdict = validator.validate(
                candidate("SELECT name FROM customers WHERE email LIKE 'M'", "show male customers"), snapshot);

        assertThat(verdict.isAccepted()).isTrue();
    }

    @Test
    void separatorLiteralIsNotTakenFromRequest() throws Exception {
        Verdict verdict = validator.validate(
                candidate("SELECT string_agg(name, ', ') FROM customers", "list customer names, comma separated"),
                snapshot);

        assertThat(verdict.isAccepted()).isTrue();
    }

    @Test
    void standaloneRequestWordIsStillRejected() throws Exception {
        Verdict verdict = validator.validate(
                candidate("SELECT name FROM customers WHERE email LIKE 'M'", "customers with grade M"), snapshot);

        assertThat(verdict.getReason()).isEqualTo(RejectionReason.UNPARAMETERIZED_LITERAL);
    }

    @Test
    void containsWordRespectsBoundaries() {
        assertThat(SafetyValidator.containsWord("show male customers", "m")).isFalse();
        assertThat(SafetyValidator.containsWord("orders of alice smith", "alice smith")).isTrue();
        assertThat(SafetyValidator.containsWord("email bob@example.com", "bob@example.com")).isTrue();
        assertThat(SafetyValidator.containsWord("the 'open' ones", "open")).isTrue();
        assertThat(SafetyValidator.containsWord("reopened orders", "open")).isFalse();
    }

    @Test
    void findRequestLiteralComparesNumbersByValue() {
        assertThat(SafetyValidator.findRequestLiteral("SELECT id FROM orders WHERE total > 10.50", "orders above 10.5"))
                .isEqualTo("10.50");
        assertThat(SafetyValidator.findRequestLiteral("SELECT id FROM orders WHERE total > ?", "orders above 10.5"))
                .isNull();
    }

    private static CandidateStatement candidate(String sql, String requestText, Object... params) throws Exception {
        Statement statement = CCJSqlParserUtil.parse(sql);
        return new CandidateStatement(sql, List.of(params), StatementInspector.classify(sql, statement),
                StatementInspector.tables(statement), statement, requestText);
    }

    private static SchemaSnapshot snapshot() {
        Map<String, List<ColumnInfo>> tables = new LinkedHashMap<>();
        tables.put("orders", List.of(
                new ColumnInfo("id", "INTEGER", false, KeyRole.PRIMARY),
                new ColumnInfo("customer_id", "INTEGER", false, KeyRole.FOREIGN),
                new ColumnInfo("status", "TEXT", true, KeyRole.NONE),
                new ColumnInfo("total", "REAL", true, KeyRole.NONE),
                new ColumnInfo("created_at", "TEXT", true, KeyRole.NONE)));
        tables.put("customers", List.of(
                new ColumnInfo("id", "INTEGER", false, KeyRole.PRIMARY),
                new ColumnInfo("name", "TEXT", false, KeyRole.NONE),
                new ColumnInfo("email", "TEXT", true, KeyRole.NONE)));
        return new SchemaSnapshot("conn-1", tables, OffsetDateTime.now());
    }
}
