package com.docverify.service.api;

import com.docverify.dto.llm.LlmVerdict;
import com.docverify.model.EnvironmentContext;
import com.docverify.model.SqlTest;

/**
 * Turns prose sql claims into something a database can answer, and judges the answer.
 */
public interface SqlQueryPlanner {

    /**
     * @param schema One line per table with its columns, as read from the live database.
     * @return One read-only SQL statement answering {@code test.query()}.
     */
    String plan(SqlTest test, EnvironmentContext environment, String schema);

    /**
     * @param rowsJson The query result as a JSON array of row objects.
     */
    LlmVerdict judge(SqlTest test, String sql, String rowsJson);
}
