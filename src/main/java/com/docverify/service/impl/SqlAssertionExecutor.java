package com.docverify.service.impl;

import com.docverify.dto.llm.LlmVerdict;
import com.docverify.exception.DocVerifyException;
import com.docverify.model.Assertion;
import com.docverify.model.AssertionResult;
import com.docverify.model.EnvironmentContext;
import com.docverify.model.SqlTest;
import com.docverify.service.api.AssertionExecutor;
import com.docverify.service.api.SqlQueryPlanner;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Checks sql claims: the planner turns the prose description into a statement using the live schema, the
 * statement runs in a read-only transaction that is always rolled back, and the planner judges the rows
 * against the expectation.
 * <p>
 * Only a single {@code SELECT} or {@code WITH} statement is ever executed, and none that names a
 * data-modifying keyword outside a quoted literal.
 */
@Service
@Slf4j
public class SqlAssertionExecutor implements AssertionExecutor {

    private static final Pattern READ_ONLY_STATEMENT = Pattern.compile("^\\s*(select|with)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WRITE_KEYWORD = Pattern.compile(
            "\\b(insert|update|delete|merge|truncate|alter|drop|create|grant|revoke|copy|call|lock|vacuum)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern QUOTED = Pattern.compile("'(?:[^']|'')*'|\"(?:[^\"]|\"\")*\"");
    private static final Set<String> SYSTEM_SCHEMAS = Set.of("information_schema", "pg_catalog", "pg_toast");

    private final SqlQueryPlanner sqlQueryPlanner;
    private final ObjectMapper objectMapper;

    @Value("${docverify.sql.timeout-seconds:15}")
    private int timeoutSeconds;

    @Value("${docverify.sql.max-rows:50}")
    private int maxRows;

    public SqlAssertionExecutor(SqlQueryPlanner sqlQueryPlanner, ObjectMapper objectMapper) {
        this.sqlQueryPlanner = sqlQueryPlanner;
        this.objectMapper = objectMapper;
    }

    @Override
    public AssertionResult execute(Assertion assertion, String databaseUrl, EnvironmentContext environment) {
        if (!(assertion.getTest() instanceof SqlTest test)) {
            throw new IllegalArgumentException("Assertion " + assertion.getId() + " is not a sql assertion");
        }
        if (databaseUrl == null || databaseUrl.isBlank()) {
            return AssertionResult.skip(assertion, "no database connection configured");
        }

        JdbcTarget target = JdbcTarget.parse(databaseUrl);
        try (Connection connection = connect(target)) {
            // pgjdbc only enforces read-only inside an explicit transaction
            connection.setAutoCommit(false);
            connection.setReadOnly(true);
            try {
                return check(assertion, test, environment, connection);
            } finally {
                rollback(connection, assertion);
            }
        } catch (SQLException e) {
            throw new DocVerifyException("Database query failed: " + e.getMessage(), e);
        }
    }

    private AssertionResult check(Assertion assertion, SqlTest test, EnvironmentContext environment,
                                  Connection connection) throws SQLException {
        String schema = describeSchema(connection);
        String sql = normalize(sqlQueryPlanner.plan(test, environment, schema));
        if (!isReadOnlyStatement(sql)) {
            return AssertionResult.fail(assertion, "planned statement is not a single read-only query: " + sql);
        }
        log.debug("Running planned query for {}: {}", assertion.getId(), sql);

        String rowsJson = query(connection, sql);
        LlmVerdict verdict = sqlQueryPlanner.judge(test, sql, rowsJson);
        if (verdict.pass()) {
            return AssertionResult.pass(assertion);
        }
        return AssertionResult.fail(assertion, verdict.reason() + " [query: " + sql + "]");
    }

    private void rollback(Connection connection, Assertion assertion) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.warn("Could not roll back the query transaction for {}: {}", assertion.getId(), e.getMessage());
        }
    }

    private Connection connect(JdbcTarget target) throws SQLException {
        if (target.username() == null) {
            return DriverManager.getConnection(target.jdbcUrl());
        }
        return DriverManager.getConnection(target.jdbcUrl(), target.username(), target.password());
    }

    /**
     * @return One line per user table: {@code schema.table(column type, ...)}.
     */
    private String describeSchema(Connection connection) throws SQLException {
        Map<String, List<String>> tables = new LinkedHashMap<>();
        DatabaseMetaData metaData = connection.getMetaData();
        try (ResultSet columns = metaData.getColumns(null, null, "%", "%")) {
            while (columns.next()) {
                String schemaName = columns.getString("TABLE_SCHEM");
                if (schemaName != null && SYSTEM_SCHEMAS.contains(schemaName.toLowerCase(Locale.ROOT))) {
                    continue;
                }
                String table = (schemaName == null ? "" : schemaName + ".") + columns.getString("TABLE_NAME");
                tables.computeIfAbsent(table, key -> new ArrayList<>())
                        .add(columns.getString("COLUMN_NAME") + " " + columns.getString("TYPE_NAME"));
            }
        }
        return tables.entrySet().stream()
                .map(entry -> entry.getKey() + "(" + String.join(", ", entry.getValue()) + ")")
                .collect(Collectors.joining("\n"));
    }

    private String query(Connection connection, String sql) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.setQueryTimeout(timeoutSeconds);
            statement.setMaxRows(maxRows);
            try (ResultSet rs = statement.executeQuery(sql)) {
                ResultSetMetaData meta = rs.getMetaData();
                int columnCount = meta.getColumnCount();
                List<Map<String, Object>> rows = new ArrayList<>();
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 1; i <= columnCount; i++) {
                        row.put(meta.getColumnLabel(i), toJsonValue(rs.getObject(i)));
                    }
                    rows.add(row);
                }
                return objectMapper.writeValueAsString(rows);
            }
        } catch (JsonProcessingException e) {
            throw new DocVerifyException("Could not serialize query result", e);
        }
    }

    private static Object toJsonValue(Object value) {
        if (value == null || value instanceof Number || value instanceof Boolean || value instanceof String) {
            return value;
        }
        return String.valueOf(value);
    }

    static String normalize(String sql) {
        String trimmed = sql == null ? "" : sql.trim();
        while (trimmed.endsWith(";")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    static boolean isReadOnlyStatement(String sql) {
        if (!READ_ONLY_STATEMENT.matcher(sql).find() || sql.contains(";")) {
            return false;
        }
        String unquoted = QUOTED.matcher(sql).replaceAll("''");
        return !WRITE_KEYWORD.matcher(unquoted).find();
    }
}
