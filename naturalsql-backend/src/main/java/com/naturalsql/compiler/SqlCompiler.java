package com.naturalsql.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.naturalsql.config.LlmConfig;
import com.naturalsql.exception.CompilationException;
import com.naturalsql.exception.LanguageModelDisabledException;
import com.naturalsql.exception.NaturalSqlException;
import com.naturalsql.exception.QueryTimeoutException;
import com.naturalsql.exception.RequestCancelledException;
import com.naturalsql.model.CandidateStatement;
import com.naturalsql.model.StatementKind;
import com.naturalsql.util.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.Statements;
import org.springframework.stereotype.Service;

import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns a prompt into exactly one parsed, classified candidate statement.
 *
 * <p>A reply that cannot be parsed is retried once with a clarifying follow-up. Model timeouts, gateway errors
 * and cancellation are not retried.
 */
@Slf4j
@Service
public class SqlCompiler {

    static final int MAX_ATTEMPTS = 2;

    private final LanguageModel languageModel;
    private final ObjectMapper objectMapper;
    private final long timeoutMs;

    public SqlCompiler(LanguageModel languageModel, ObjectMapper objectMapper, LlmConfig llmConfig) {
        this.languageModel = languageModel;
        this.objectMapper = objectMapper;
        this.timeoutMs = llmConfig.timeoutMs();
    }

    public CandidateStatement compile(Prompt prompt) {
        return compile(prompt, new CancellationToken());
    }

    /**
     * Compile a prompt into a candidate statement.
     *
     * @param prompt prompt built for the request
     * @param token cancellation token of the request
     * @return candidate statement, not yet validated
     * @throws CompilationException when no usable statement was produced
     * @throws QueryTimeoutException when the model call timed out
     */
    public CandidateStatement compile(Prompt prompt, CancellationToken token) {
        if (!languageModel.isEnabled()) {
            throw new LanguageModelDisabledException("Language model is not configured (set LLM_API_KEY and LLM_MODEL)");
        }

        Prompt current = prompt;
        String lastReason = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            String reply = call(current, token);
            try {
                CandidateStatement candidate = parseReply(reply, prompt.requestText());
                log.debug("Compiled request (attempt={}, kind={}, tables={})", attempt, candidate.kind(), candidate.tables());
                return candidate;
            } catch (MalformedReplyException e) {
                lastReason = e.getMessage();
                log.warn("Model reply unusable (attempt={}, reason={})", attempt, lastReason);
                current = current.withClarification(lastReason);
            }
        }
        throw new CompilationException("Could not compile request after " + MAX_ATTEMPTS + " attempts: " + lastReason);
    }

    /**
     * Parse an already known statement, e.g. one stored in history.
     *
     * @param sql statement text
     * @param params bound parameters
     * @param requestText originating request
     * @return candidate statement
     * @throws CompilationException when the statement does not parse
     */
    public CandidateStatement inspect(String sql, List<Object> params, String requestText) {
        try {
            return toCandidate(sql, params, requestText);
        } catch (MalformedReplyException e) {
            throw new CompilationException(e.getMessage());
        }
    }

    private String call(Prompt prompt, CancellationToken token) {
        if (token.isCancelled()) {
            throw new RequestCancelledException("Request cancelled before compilation", null);
        }
        CompletableFuture<String> future = languageModel.generate(prompt);
        token.attach(future);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new QueryTimeoutException(QueryTimeoutException.Phase.COMPILATION, timeoutMs, e);
        } catch (CancellationException e) {
            throw new RequestCancelledException("Request cancelled while compiling", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RequestCancelledException("Interrupted while compiling", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof NaturalSqlException nse) {
                throw nse;
            }
            if (cause instanceof HttpTimeoutException) {
                throw new QueryTimeoutException(QueryTimeoutException.Phase.COMPILATION, timeoutMs, cause);
            }
            throw new CompilationException("Language model call failed: " + cause.getMessage(), cause);
        } finally {
            token.detach(future);
        }
    }

    CandidateStatement parseReply(String reply, String requestText) throws MalformedReplyException {
        String content = stripFences(reply);
        if (content.isBlank()) {
            throw new MalformedReplyException("empty reply");
        }

        String sql = content;
        List<Object> params = List.of();
        if (content.startsWith("{")) {
            JsonNode root = readJson(content);
            if (root != null) {
                JsonNode statement = selectSingleStatement(root);
                if (statement.isTextual()) {
                    sql = statement.asText();
                } else {
                    sql = statement.path("sql").asText("");
                    params = readParams(statement.path("params"));
                }
            }
        }
        return toCandidate(sql, params, requestText);
    }

    private CandidateStatement toCandidate(String rawSql, List<Object> params, String requestText) throws MalformedReplyException {
        String sql = stripTrailingSemicolons(rawSql);
        if (sql.isBlank()) {
            throw new MalformedReplyException("reply contains no SQL statement");
        }

        List<Statement> statements;
        try {
            Statements parsed = CCJSqlParserUtil.parseStatements(sql);
            statements = parsed != null ? parsed.getStatements() : List.of();
        } catch (JSQLParserException e) {
            throw new MalformedReplyException("SQL does not parse: " + firstLine(e.getMessage()));
        }
        if (statements == null || statements.isEmpty()) {
            throw new MalformedReplyException("reply contains no SQL statement");
        }
        if (statements.size() > 1) {
            throw new MalformedReplyException("expected exactly one statement, got " + statements.size());
        }

        int placeholders = SqlTokenizer.countPlaceholders(sql);
        List<Object> safeParams = params != null ? params : List.of();
        if (placeholders != safeParams.size()) {
            throw new MalformedReplyException("statement has " + placeholders + " placeholders but "
                    + safeParams.size() + " params were supplied");
        }

        Statement statement = statements.get(0);
        StatementKind kind = StatementInspector.classify(sql, statement);
        List<String> tables = StatementInspector.tables(statement);
        return new CandidateStatement(sql, safeParams, kind, tables, statement, requestText);
    }

    private JsonNode readJson(String content) {
        try {
            return objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            log.debug("Model reply is not JSON, treating it as SQL: {}", e.getOriginalMessage());
            return null;
        }
    }

    private JsonNode selectSingleStatement(JsonNode root) throws MalformedReplyException {
        JsonNode statements = root.path("statements");
        if (statements.isMissingNode() && root.has("sql")) {
            return root;
        }
        if (!statements.isArray() || statements.isEmpty()) {
            throw new MalformedReplyException("reply contains no statements");
        }
        if (statements.size() != 1) {
            throw new MalformedReplyException("expected exactly one statement, got " + statements.size());
        }
        return statements.get(0);
    }

    private List<Object> readParams(JsonNode node) throws MalformedReplyException {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new MalformedReplyException("params must be an array");
        }
        List<Object> out = new ArrayList<>(node.size());
        for (JsonNode p : node) {
            if (p.isContainerNode()) {
                throw new MalformedReplyException("params must be scalar values");
            }
            out.add(objectMapper.convertValue(p, Object.class));
        }
        return out;
    }

    static String stripFences(String content) {
        if (content == null) {
            return "";
        }
        String s = content.trim();
        if (s.startsWith("```")) {
            s = s.replaceFirst("^```[a-zA-Z0-9_-]*\\n", "");
            s = s.replaceFirst("\\n?```$", "");
            s = s.trim();
        }
        return s;
    }

    private static String stripTrailingSemicolons(String sql) {
        return sql == null ? "" : sql.trim().replaceFirst("[;\\s]+$", "");
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unknown parse error";
        }
        int nl = message.indexOf('\n');
        return nl == -1 ? message : message.substring(0, nl);
    }

    /**
     * A model reply that cannot be turned into a single statement. Triggers the clarifying retry.
     */
    static final class MalformedReplyException extends Exception {
        MalformedReplyException(String message) {
            super(message);
        }
    }
}
