package com.naturalsql.service;

import com.naturalsql.config.PipelineSettings;
import com.naturalsql.model.CandidateStatement;
import com.naturalsql.model.ConnectionHandle;
import com.naturalsql.model.QueryResult;
import com.naturalsql.model.StatementKind;
import com.naturalsql.util.JdbcJsonSafe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs accepted statements. SELECT results are capped at the configured row ceiling and flagged as truncated
 * rather than failing.
 */
@Slf4j
@Service
public class QueryExecutor {

    private final int maxRows;
    private final long timeoutMs;

    public QueryExecutor(PipelineSettings settings) {
        this.maxRows = settings.maxRows();
        this.timeoutMs = settings.executionTimeoutMs();
    }

    /**
     * Execute an accepted statement.
     *
     * @param candidate accepted candidate
     * @param connectionManager session connection
     * @param handle live handle
     * @return result
     */
    public QueryResult run(CandidateStatement candidate, ConnectionManager connectionManager, ConnectionHandle handle) {
        long start = System.currentTimeMillis();
        QueryResult.QueryResultBuilder builder;
        if (candidate.kind() == StatementKind.SELECT) {
            builder = connectionManager.execute(handle, candidate.sql(), candidate.params(), timeoutMs, this::readRows);
        } else {
            int affected = connectionManager.execute(handle, candidate.sql(), candidate.params(), timeoutMs,
                    PreparedStatement::executeUpdate);
            builder = QueryResult.builder().affectedRows(affected);
        }
        long duration = System.currentTimeMillis() - start;
        QueryResult result = builder
                .sql(candidate.sql())
                .params(candidate.params())
                .kind(candidate.kind())
                .executionMs(duration)
                .build();
        log.info("Statement executed (kind={}, rows={}, affected={}, truncated={}, duration_ms={})",
                result.getKind(), result.getRowCount(), result.getAffectedRows(), result.isTruncated(), duration);
        return result;
    }

    private QueryResult.QueryResultBuilder readRows(PreparedStatement ps) throws SQLException {
        if (maxRows > 0) {
            ps.setMaxRows(maxRows == Integer.MAX_VALUE ? maxRows : maxRows + 1);
        }
        try (ResultSet rs = ps.executeQuery()) {
            ResultSetMetaData md = rs.getMetaData();
            int columnCount = md.getColumnCount();
            List<String> columns = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                columns.add(md.getColumnLabel(i));
            }

            List<Map<String, Object>> rows = new ArrayList<>();
            boolean truncated = false;
            while (rs.next()) {
                if (maxRows > 0 && rows.size() >= maxRows) {
                    truncated = true;
                    break;
                }
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= columnCount; i++) {
                    row.put(columns.get(i - 1), JdbcJsonSafe.readJsonSafeValue(rs, i));
                }
                rows.add(row);
            }
            return QueryResult.builder()
                    .columns(columns)
                    .rows(rows)
                    .rowCount(rows.size())
                    .truncated(truncated);
        }
    }
}
