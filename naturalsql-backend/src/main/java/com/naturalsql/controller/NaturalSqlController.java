package com.naturalsql.controller;

import com.naturalsql.api.ColumnResponse;
import com.naturalsql.api.ConnectRequest;
import com.naturalsql.api.ConnectResponse;
import com.naturalsql.api.HistoryClearRequest;
import com.naturalsql.api.HistoryResponse;
import com.naturalsql.api.MutateRequest;
import com.naturalsql.api.MutateResponse;
import com.naturalsql.api.QueryRequest;
import com.naturalsql.api.QueryResponse;
import com.naturalsql.api.ReplayRequest;
import com.naturalsql.api.SchemaRefreshResponse;
import com.naturalsql.api.SchemaSummaryResponse;
import com.naturalsql.api.SimilarRequestResponse;
import com.naturalsql.api.StatusResponse;
import com.naturalsql.api.SuggestionsResponse;
import com.naturalsql.compiler.LanguageModel;
import com.naturalsql.model.ConnectionDescriptor;
import com.naturalsql.model.ConnectionStatus;
import com.naturalsql.model.EngineKind;
import com.naturalsql.model.QueryResult;
import com.naturalsql.model.QuerySuggestions;
import com.naturalsql.model.SchemaSnapshot;
import com.naturalsql.model.StatementKind;
import com.naturalsql.model.TableSummary;
import com.naturalsql.service.NaturalSqlService;
import com.naturalsql.service.SessionContext;
import com.naturalsql.service.SessionManager;
import com.naturalsql.util.DsnParser;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/v1")
public class NaturalSqlController {

    private static final Logger log = LoggerFactory.getLogger(NaturalSqlController.class);

    private final NaturalSqlService naturalSqlService;
    private final SessionManager sessionManager;
    private final LanguageModel languageModel;

    public NaturalSqlController(NaturalSqlService naturalSqlService, SessionManager sessionManager, LanguageModel languageModel) {
        this.naturalSqlService = naturalSqlService;
        this.sessionManager = sessionManager;
        this.languageModel = languageModel;
    }

    @PostMapping("/connect")
    public ResponseEntity<ConnectResponse> connect(@Valid @RequestBody ConnectRequest request) {
        ConnectionDescriptor descriptor = toDescriptor(request);
        log.info("Connect requested (target={})", descriptor);
        SessionContext session = naturalSqlService.connect(request.getSessionId(), descriptor);
        return ResponseEntity.ok(ConnectResponse.builder()
                .sessionId(session.getSessionId())
                .connected(true)
                .detail("Connected to " + descriptor.getEngine().getDialect())
                .engine(engineName(descriptor.getEngine()))
                .host(descriptor.getHost())
                .database(descriptor.databaseLabel())
                .expiresAt(session.getInfo().getExpiresAt())
                .build());
    }

    @PostMapping("/disconnect")
    public ResponseEntity<Map<String, Object>> disconnect(@RequestParam("session_id") String sessionId) {
        naturalSqlService.disconnect(sessionId);
        return ResponseEntity.ok(Map.of("ok", true));
    }

    @GetMapping("/status")
    public ResponseEntity<StatusResponse> status(@RequestParam("session_id") String sessionId) {
        ConnectionStatus status = naturalSqlService.status(sessionId);
        if (!status.connected()) {
            return ResponseEntity.ok(StatusResponse.builder().connected(false).build());
        }
        ConnectionDescriptor d = status.descriptor();
        return ResponseEntity.ok(StatusResponse.builder()
                .connected(true)
                .engine(engineName(d.getEngine()))
                .host(d.getHost())
                .database(d.databaseLabel())
                .build());
    }

    @GetMapping("/tables")
    public ResponseEntity<List<String>> listTables(@RequestParam("session_id") String sessionId) {
        return ResponseEntity.ok(naturalSqlService.listTables(sessionId));
    }

    @GetMapping("/tables/{name}")
    public ResponseEntity<List<ColumnResponse>> describeTable(
            @PathVariable("name") String name,
            @RequestParam("session_id") String sessionId
    ) {
        List<ColumnResponse> columns = naturalSqlService.describeTable(sessionId, name).stream()
                .map(c -> new ColumnResponse(c.name(), c.type(), c.nullable(), c.keyRole().name()))
                .toList();
        return ResponseEntity.ok(columns);
    }

    @PostMapping("/query")
    public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
        QueryResult result = naturalSqlService.query(request.getSessionId(), request.getRequestText());
        return ResponseEntity.ok(QueryResponse.builder()
                .sql(result.getSql())
                .params(result.getParams())
                .columns(result.getColumns())
                .rows(result.getRows())
                .rowCount(result.getRowCount())
                .truncated(result.isTruncated())
                .fromCache(result.isFromCache())
                .executionMs(result.getExecutionMs())
                .warnings(result.getWarnings())
                .build());
    }

    @PostMapping("/mutate")
    public ResponseEntity<MutateResponse> mutate(@Valid @RequestBody MutateRequest request) {
        StatementKind kind = StatementKind.mutationFromName(request.getKind());
        QueryResult result = naturalSqlService.mutate(request.getSessionId(), request.getRequestText(), kind);
        return ResponseEntity.ok(MutateResponse.builder()
                .sql(result.getSql())
                .params(result.getParams())
                .affectedRows(result.getAffectedRows())
                .executionMs(result.getExecutionMs())
                .build());
    }

    @GetMapping("/history")
    public ResponseEntity<HistoryResponse> history(
            @RequestParam("session_id") String sessionId,
            @RequestParam(value = "limit", defaultValue = "20") int limit,
            @RequestParam(value = "successful_only", defaultValue = "false") boolean successfulOnly
    ) {
        return ResponseEntity.ok(new HistoryResponse(
                naturalSqlService.history(sessionId, limit, successfulOnly),
                naturalSqlService.historyStats(sessionId)));
    }

    /**
     * POST /v1/history/clear
     */
    @PostMapping("/history/clear")
    public ResponseEntity<Map<String, Object>> clearHistory(@Valid @RequestBody HistoryClearRequest request) {
        if (!request.isConfirm()) {
            throw new IllegalArgumentException("History clearing requires confirm=true; it cannot be undone");
        }
        int cleared = naturalSqlService.clearHistory(request.getSessionId());
        return ResponseEntity.ok(Map.of("cleared", cleared));
    }

    @GetMapping("/suggestions")
    public ResponseEntity<SuggestionsResponse> suggestions(
            @RequestParam("session_id") String sessionId,
            @RequestParam(value = "current_request", required = false) String currentRequest
    ) {
        QuerySuggestions result = naturalSqlService.suggestions(sessionId, currentRequest);
        List<SimilarRequestResponse> similar = result.similarRequests().stream()
                .map(s -> SimilarRequestResponse.builder()
                        .sequence(s.entry().getSequence())
                        .requestText(s.entry().getRequestText())
                        .sql(s.entry().getSql())
                        .rowCount(s.entry().getRowCount())
                        .executionMs(s.entry().getExecutionMs())
                        .timestamp(s.entry().getTimestamp())
                        .similarity(Math.round(s.similarity() * 1000) / 1000.0)
                        .build())
                .toList();
        return ResponseEntity.ok(SuggestionsResponse.builder()
                .currentRequest(currentRequest)
                .suggestions(result.suggestions())
                .similarRequests(similar)
                .build());
    }

    @PostMapping("/history/replay")
    public ResponseEntity<QueryResponse> replay(@Valid @RequestBody ReplayRequest request) {
        QueryResult result = naturalSqlService.replay(request.getSessionId(), request.getSequence());
        return ResponseEntity.ok(QueryResponse.builder()
                .sql(result.getSql())
                .params(result.getParams())
                .columns(result.getColumns())
                .rows(result.getRows())
                .rowCount(result.getRowCount())
                .truncated(result.isTruncated())
                .fromCache(false)
                .executionMs(result.getExecutionMs())
                .warnings(result.getWarnings())
                .build());
    }

    @PostMapping("/schema/refresh")
    public ResponseEntity<SchemaRefreshResponse> refreshSchema(@RequestParam("session_id") String sessionId) {
        SchemaSnapshot snapshot = naturalSqlService.refreshSchema(sessionId);
        return ResponseEntity.ok(new SchemaRefreshResponse(snapshot.tableNames(), snapshot.getTakenAt()));
    }

    @GetMapping("/schema/summary")
    public ResponseEntity<SchemaSummaryResponse> schemaSummary(@RequestParam("session_id") String sessionId) {
        List<TableSummary> tables = naturalSqlService.schemaSummary(sessionId);
        return ResponseEntity.ok(new SchemaSummaryResponse(tables.size(), tables));
    }

    @PostMapping("/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@RequestParam("session_id") String sessionId) {
        boolean cancelled = naturalSqlService.cancel(sessionId);
        return ResponseEntity.ok(Map.of("cancelled", cancelled));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "active_sessions", sessionManager.activeSessions(),
                "llm_enabled", languageModel.isEnabled()
        ));
    }

    private static ConnectionDescriptor toDescriptor(ConnectRequest request) {
        if (request.getDsn() != null && !request.getDsn().isBlank()) {
            return DsnParser.parse(request.getDsn(), request.getDbType());
        }
        EngineKind engine = EngineKind.fromName(request.getDbType());
        if (engine.isFileBased()) {
            if (request.getPath() == null || request.getPath().isBlank()) {
                throw new IllegalArgumentException("path is required for " + engineName(engine));
            }
            return ConnectionDescriptor.builder().engine(engine).path(request.getPath().trim()).build();
        }
        if (request.getHost() == null || request.getHost().isBlank()) {
            throw new IllegalArgumentException("host is required for " + engineName(engine));
        }
        return ConnectionDescriptor.builder()
                .engine(engine)
                .host(request.getHost().trim())
                .port(request.getPort() != null ? request.getPort() : -1)
                .username(request.getUsername())
                .password(request.getPassword())
                .database(request.getDatabase())
                .build();
    }

    private static String engineName(EngineKind engine) {
        return engine.name().toLowerCase(Locale.ROOT);
    }
}
