package com.naturalsql.service;

import com.naturalsql.compiler.Prompt;
import com.naturalsql.compiler.PromptBuilder;
import com.naturalsql.compiler.SqlCompiler;
import com.naturalsql.config.PipelineSettings;
import com.naturalsql.exception.NaturalSqlException;
import com.naturalsql.exception.RequestCancelledException;
import com.naturalsql.exception.StatementRejectedException;
import com.naturalsql.exception.TableNotFoundException;
import com.naturalsql.model.CandidateStatement;
import com.naturalsql.model.ColumnInfo;
import com.naturalsql.model.ConnectionDescriptor;
import com.naturalsql.model.ConnectionHandle;
import com.naturalsql.model.ConnectionStatus;
import com.naturalsql.model.EngineKind;
import com.naturalsql.model.HistoryEntry;
import com.naturalsql.model.HistoryStats;
import com.naturalsql.model.QueryResult;
import com.naturalsql.model.QuerySuggestions;
import com.naturalsql.model.SchemaSnapshot;
import com.naturalsql.model.SimilarRequest;
import com.naturalsql.model.StatementKind;
import com.naturalsql.model.TableSummary;
import com.naturalsql.model.Verdict;
import com.naturalsql.util.CancellationToken;
import com.naturalsql.validation.QueryLinter;
import com.naturalsql.validation.SafetyValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Request pipeline: cache lookup, schema snapshot, prompt, compilation, validation, execution and history.
 */
@Slf4j
@Service
public class NaturalSqlService {

    private static final int SUGGESTION_HISTORY = 3;
    private static final int SIMILAR_REQUESTS = 3;

    private final SessionManager sessionManager;
    private final PromptBuilder promptBuilder;
    private final SqlCompiler sqlCompiler;
    private final SafetyValidator safetyValidator;
    private final QueryLinter queryLinter;
    private final QueryExecutor queryExecutor;
    private final QuerySuggester querySuggester;
    private final PipelineSettings settings;

    public NaturalSqlService(SessionManager sessionManager,
                             PromptBuilder promptBuilder,
                             SqlCompiler sqlCompiler,
                             SafetyValidator safetyValidator,
                             QueryLinter queryLinter,
                             QueryExecutor queryExecutor,
                             QuerySuggester querySuggester,
                             PipelineSettings settings) {
        this.sessionManager = sessionManager;
        this.promptBuilder = promptBuilder;
        this.sqlCompiler = sqlCompiler;
        this.safetyValidator = safetyValidator;
        this.queryLinter = queryLinter;
        this.queryExecutor = queryExecutor;
        this.querySuggester = querySuggester;
        this.settings = settings;
    }

    /**
     * Connect a session, creating it when {@code sessionId} is blank. An existing connection is replaced.
     *
     * @param sessionId existing session, or {@code null}
     * @param descriptor target database
     * @return the session
     */
    public SessionContext connect(String sessionId, ConnectionDescriptor descriptor) {
        boolean created = sessionId == null || sessionId.isBlank();
        SessionContext session = created ? sessionManager.createSession() : sessionManager.requireSession(sessionId);
        session.getQueryCache().invalidateAll();
        session.getSchemaCache().invalidateAll();
        try {
            session.getConnectionManager().connect(descriptor);
        } catch (NaturalSqlException e) {
            if (created) {
                sessionManager.terminateSession(session.getSessionId());
            }
            throw e;
        }
        return session;
    }

    /**
     * Close the session's connection. Unknown sessions and repeated calls are no-ops.
     *
     * @param sessionId session identifier
     */
    public void disconnect(String sessionId) {
        sessionManager.getSession(sessionId).ifPresent(session -> {
            session.getConnectionManager().disconnect();
            session.getQueryCache().invalidateAll();
            session.getSchemaCache().invalidateAll();
        });
    }

    public ConnectionStatus status(String sessionId) {
        return sessionManager.requireSession(sessionId).getConnectionManager().status();
    }

    public List<String> listTables(String sessionId) {
        return snapshot(sessionManager.requireSession(sessionId)).tableNames();
    }

    public List<ColumnInfo> describeTable(String sessionId, String tableName) {
        return snapshot(sessionManager.requireSession(sessionId)).columns(tableName)
                .orElseThrow(() -> new TableNotFoundException(tableName));
    }

    /**
     * Column count, keys and column types of every table.
     *
     * @param sessionId session identifier
     * @return one summary per table, in introspection order
     */
    public List<TableSummary> schemaSummary(String sessionId) {
        SchemaSnapshot snapshot = snapshot(sessionManager.requireSession(sessionId));
        List<TableSummary> out = new ArrayList<>();
        snapshot.getTables().forEach((table, columns) -> out.add(TableSummary.of(table, columns)));
        return out;
    }

    /**
     * Drop the cached snapshot and introspect again.
     *
     * @param sessionId session identifier
     * @return fresh snapshot
     */
    public SchemaSnapshot refreshSchema(String sessionId) {
        SessionContext session = sessionManager.requireSession(sessionId);
        String connectionId = session.getConnectionManager().requireHandle().connectionId();
        session.getSchemaCache().invalidate(connectionId);
        return session.getSchemaCache().getSnapshot(connectionId);
    }

    /**
     * Answer a natural-language question with a SELECT.
     *
     * @param sessionId session identifier
     * @param requestText the question
     * @return rows, possibly served from the query cache
     */
    public QueryResult query(String sessionId, String requestText) {
        SessionContext session = sessionManager.requireSession(sessionId);
        CancellationToken token = session.beginRequest();
        ConnectionHandle handle = session.getConnectionManager().requireHandle();
        CacheKey key = CacheKey.of(handle.connectionId(), requestText);
        return session.getQueryCache().getOrCompute(key,
                () -> compileAndRun(session, handle, token, requestText, StatementKind.SELECT));
    }

    /**
     * Apply a natural-language change with an INSERT, UPDATE or DELETE.
     *
     * @param sessionId session identifier
     * @param requestText the change
     * @param kind required statement kind
     * @return affected rows
     */
    public QueryResult mutate(String sessionId, String requestText, StatementKind kind) {
        if (kind == null || !kind.isMutation()) {
            throw new IllegalArgumentException("kind must be one of insert, update, delete");
        }
        SessionContext session = sessionManager.requireSession(sessionId);
        CancellationToken token = session.beginRequest();
        ConnectionHandle handle = session.getConnectionManager().requireHandle();
        return compileAndRun(session, handle, token, requestText, kind);
    }

    public List<HistoryEntry> history(String sessionId, int limit, boolean successfulOnly) {
        return sessionManager.requireSession(sessionId).getHistoryStore().recent(limit, successfulOnly);
    }

    public HistoryStats historyStats(String sessionId) {
        return sessionManager.requireSession(sessionId).getHistoryStore().stats();
    }

    /**
     * Forget the session's history. Cached results stay.
     *
     * @param sessionId session identifier
     * @return number of entries removed
     */
    public int clearHistory(String sessionId) {
        int removed = sessionManager.requireSession(sessionId).getHistoryStore().clear();
        log.info("History cleared (session_id={}, entries={})", sessionId, removed);
        return removed;
    }

    /**
     * Suggest next requests from the session's history and, when connected, its schema.
     *
     * @param sessionId session identifier
     * @param currentRequest what the user is typing, may be {@code null}
     * @return suggestions and similar past requests
     */
    public QuerySuggestions suggestions(String sessionId, String currentRequest) {
        SessionContext session = sessionManager.requireSession(sessionId);
        HistoryStore history = session.getHistoryStore();
        SchemaSnapshot snapshot = session.getConnectionManager().status().connected() ? snapshot(session) : null;
        List<String> suggestions = querySuggester.suggest(snapshot, history.recent(SUGGESTION_HISTORY, true),
                currentRequest);
        List<SimilarRequest> similar = currentRequest == null || currentRequest.isBlank()
                ? List.of()
                : history.similar(currentRequest, SIMILAR_REQUESTS);
        return new QuerySuggestions(suggestions, similar);
    }

    /**
     * Re-run the SQL of a SELECT history entry without calling the model. Mutations are never replayed.
     *
     * @param sessionId session identifier
     * @param sequence history sequence number
     * @return fresh result
     */
    public QueryResult replay(String sessionId, long sequence) {
        SessionContext session = sessionManager.requireSession(sessionId);
        HistoryEntry entry = session.getHistoryStore().find(sequence)
                .orElseThrow(() -> new IllegalArgumentException("History entry " + sequence + " not found"));
        if (entry.getKind() != StatementKind.SELECT || entry.getSql() == null) {
            throw new IllegalArgumentException("Only SELECT history entries can be replayed");
        }
        CancellationToken token = session.beginRequest();
        ConnectionHandle handle = session.getConnectionManager().requireHandle();
        CandidateStatement candidate = sqlCompiler.inspect(entry.getSql(), entry.getParams(), entry.getRequestText());
        SchemaSnapshot snapshot = session.getSchemaCache().getSnapshot(handle.connectionId());
        return validateAndRun(session, handle, token, candidate, snapshot, StatementKind.SELECT);
    }

    /**
     * Abort the session's in-flight model call and statement.
     *
     * @param sessionId session identifier
     * @return true if something was running
     */
    public boolean cancel(String sessionId) {
        return sessionManager.requireSession(sessionId).cancel();
    }

    private QueryResult compileAndRun(SessionContext session, ConnectionHandle handle, CancellationToken token,
                                      String requestText, StatementKind expectedKind) {
        SchemaSnapshot snapshot = session.getSchemaCache().getSnapshot(handle.connectionId());
        EngineKind engine = session.getConnectionManager().status().descriptor().getEngine();
        List<HistoryEntry> tail = session.getHistoryStore().tail(settings.promptHistoryTail());
        Prompt prompt = promptBuilder.build(requestText, snapshot, tail, expectedKind, engine);

        CandidateStatement candidate;
        try {
            candidate = sqlCompiler.compile(prompt, token);
        } catch (NaturalSqlException e) {
            record(session, failure(requestText, null, expectedKind, e));
            throw e;
        }
        return validateAndRun(session, handle, token, candidate, snapshot, expectedKind);
    }

    private QueryResult validateAndRun(SessionContext session, ConnectionHandle handle, CancellationToken token,
                                       CandidateStatement candidate, SchemaSnapshot snapshot, StatementKind expectedKind) {
        Verdict verdict = safetyValidator.validate(candidate, snapshot, expectedKind);
        if (!verdict.isAccepted()) {
            log.warn("Statement rejected (session_id={}, reason={}, sql={})",
                    session.getSessionId(), verdict.getReason(), candidate.sql());
            StatementRejectedException rejected = new StatementRejectedException(verdict, candidate.sql());
            record(session, failure(candidate.requestText(), candidate, candidate.kind(), rejected)
                    .rejection(verdict.getReason()));
            throw rejected;
        }

        QueryResult result;
        try {
            if (token.isCancelled()) {
                throw new RequestCancelledException("Request cancelled before execution", null);
            }
            result = queryExecutor.run(candidate, session.getConnectionManager(), handle);
        } catch (NaturalSqlException e) {
            record(session, failure(candidate.requestText(), candidate, candidate.kind(), e));
            throw e;
        }

        if (candidate.kind() == StatementKind.SELECT) {
            result = result.withWarnings(queryLinter.lint(candidate.sql()));
        } else {
            session.getQueryCache().invalidate(handle.connectionId());
        }

        record(session, HistoryEntry.builder()
                .requestText(candidate.requestText())
                .sql(candidate.sql())
                .params(candidate.params())
                .kind(candidate.kind())
                .tables(candidate.tables())
                .success(true)
                .rowCount(result.getRowCount())
                .affectedRows(result.getAffectedRows())
                .executionMs(result.getExecutionMs()));
        return result;
    }

    private static HistoryEntry.HistoryEntryBuilder failure(String requestText, CandidateStatement candidate,
                                                            StatementKind kind, NaturalSqlException error) {
        HistoryEntry.HistoryEntryBuilder b = HistoryEntry.builder()
                .requestText(requestText)
                .kind(kind)
                .success(false)
                .errorKind(error.getKind())
                .errorMessage(error.getMessage());
        if (candidate != null) {
            b.sql(candidate.sql()).params(candidate.params()).tables(candidate.tables());
        }
        return b;
    }

    private static void record(SessionContext session, HistoryEntry.HistoryEntryBuilder draft) {
        session.getHistoryStore().append(draft.build());
    }

    private static SchemaSnapshot snapshot(SessionContext session) {
        String connectionId = session.getConnectionManager().requireHandle().connectionId();
        return session.getSchemaCache().getSnapshot(connectionId);
    }
}
