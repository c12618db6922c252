package com.naturalsql.compiler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.naturalsql.config.LlmConfig;
import com.naturalsql.exception.CompilationException;
import com.naturalsql.exception.ErrorKind;
import com.naturalsql.exception.LanguageModelDisabledException;
import com.naturalsql.exception.QueryTimeoutException;
import com.naturalsql.exception.RequestCancelledException;
import com.naturalsql.model.CandidateStatement;
import com.naturalsql.model.StatementKind;
import com.naturalsql.util.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SqlCompilerTest {

    private static final Prompt PROMPT = new Prompt("system", "Request:\ndelete the order with ID 456\n",
            "delete the order with ID 456", StatementKind.DELETE, 1);

    private LanguageModel languageModel;
    private SqlCompiler compiler;

    @BeforeEach
    void setup() {
        languageModel = mock(LanguageModel.class);
        when(languageModel.isEnabled()).thenReturn(true);
        compiler = new SqlCompiler(languageModel, new ObjectMapper(),
                new LlmConfig("http://localhost:1", "key", "model", 200));
    }

    @Test
    void compilesJsonReply() {
        reply("{\"statements\":[{\"sql\":\"DELETE FROM orders WHERE id = ?\",\"params\":[456]}]}");

        CandidateStatement candidate = compiler.compile(PROMPT);

        assertThat(candidate.sql()).isEqualTo("DELETE FROM orders WHERE id = ?");
        assertThat(candidate.params()).containsExactly(456);
        assertThat(candidate.kind()).isEqualTo(StatementKind.DELETE);
        assertThat(candidate.tables()).containsExactly("orders");
        assertThat(candidate.requestText()).isEqualTo("delete the order with ID 456");
    }

    @Test
    void stripsFencesAndTrailingSemicolon() {
        reply("```json\n{\"sql\":\"SELECT id FROM orders WHERE status = ?;\",\"params\":[\"open\"]}\n```");

        CandidateStatement candidate = compiler.compile(PROMPT);

        assertThat(candidate.sql()).isEqualTo("SELECT id FROM orders WHERE status = ?");
        assertThat(candidate.params()).containsExactly("open");
        assertThat(candidate.kind()).isEqualTo(StatementKind.SELECT);
    }

    @Test
    void acceptsPlainSqlReply() {
        reply("SELECT name FROM customers;");

        CandidateStatement candidate = compiler.compile(PROMPT);

        assertThat(candidate.sql()).isEqualTo("SELECT name FROM customers");
        assertThat(candidate.params()).isEmpty();
    }

    @Test
    void keepsNullParams() {
        reply("{\"sql\":\"INSERT INTO notes (title, body) VALUES (?, ?)\",\"params\":[\"todo\", null]}");

        CandidateStatement candidate = compiler.compile(PROMPT);

        assertThat(candidate.kind()).isEqualTo(StatementKind.INSERT);
        assertThat(candidate.params()).isEqualTo(Arrays.asList("todo", null));
    }

    @Test
    void retriesOnceWithClarification() {
        when(languageModel.generate(any()))
                .thenReturn(CompletableFuture.completedFuture("SELECT 1; SELECT 2"))
                .thenReturn(CompletableFuture.completedFuture("{\"sql\":\"SELECT id FROM orders\",\"params\":[]}"));

        CandidateStatement candidate = compiler.compile(PROMPT);

        assertThat(candidate.sql()).isEqualTo("SELECT id FROM orders");
        ArgumentCaptor<Prompt> prompts = ArgumentCaptor.forClass(Prompt.class);
        verify(languageModel, times(2)).generate(prompts.capture());
        Prompt retry = prompts.getAllValues().get(1);
        assertThat(retry.attempt()).isEqualTo(2);
        assertThat(retry.user()).contains("expected exactly one statement, got 2");
    }

    @Test
    void failsAfterSecondUnusableReply() {
        reply("{\"sql\":\"SELECT id FROM orders WHERE id = ?\",\"params\":[]}");

        assertThatThrownBy(() -> compiler.compile(PROMPT))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("1 placeholders but 0 params");
        verify(languageModel, times(SqlCompiler.MAX_ATTEMPTS)).generate(any());
    }

    @Test
    void rejectsUnparseableSql() {
        reply("this is not sql at all");

        assertThatThrownBy(() -> compiler.compile(PROMPT))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("does not parse");
    }

    @Test
    void rejectsStructuredParams() {
        reply("{\"sql\":\"SELECT id FROM orders WHERE id = ?\",\"params\":[{\"id\":1}]}");

        assertThatThrownBy(() -> compiler.compile(PROMPT))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("scalar");
    }

    @Test
    void gatewayErrorsAreNotRetried() {
        when(languageModel.generate(any()))
                .thenReturn(CompletableFuture.failedFuture(new CompilationException("Language model returned HTTP 500")));

        assertThatThrownBy(() -> compiler.compile(PROMPT))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("HTTP 500");
        verify(languageModel, times(1)).generate(any());
    }

    @Test
    void timesOutWhenModelDoesNotAnswer() {
        when(languageModel.generate(any())).thenReturn(new CompletableFuture<>());

        assertThatThrownBy(() -> compiler.compile(PROMPT))
                .isInstanceOfSatisfying(QueryTimeoutException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.TIMEOUT);
                    assertThat(e.getPhase()).isEqualTo(QueryTimeoutException.Phase.COMPILATION);
                });
    }

    @Test
    void disabledModelIsNeverCalled() {
        when(languageModel.isEnabled()).thenReturn(false);

        assertThatThrownBy(() -> compiler.compile(PROMPT)).isInstanceOf(LanguageModelDisabledException.class);
        verify(languageModel, never()).generate(any());
    }

    @Test
    void cancelledRequestIsNotSent() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThatThrownBy(() -> compiler.compile(PROMPT, token)).isInstanceOf(RequestCancelledException.class);
        verify(languageModel, never()).generate(any());
    }

    @Test
    void inspectParsesKnownStatement() {
        CandidateStatement candidate = compiler.inspect("SELECT id FROM orders WHERE id = ?", List.of(1), "order 1");

        assertThat(candidate.kind()).isEqualTo(StatementKind.SELECT);
        assertThat(candidate.params()).containsExactly(1);
    }

    @Test
    void stripFencesLeavesPlainContent() {
        assertThat(SqlCompiler.stripFences("```sql\nSELECT 1\n```")).isEqualTo("SELECT 1");
        assertThat(SqlCompiler.stripFences("  SELECT 1  ")).isEqualTo("SELECT 1");
        assertThat(SqlCompiler.stripFences(null)).isEmpty();
    }

    private void reply(String content) {
        when(languageModel.generate(any())).thenReturn(CompletableFuture.completedFuture(content));
    }
}
