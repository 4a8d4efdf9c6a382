/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ai.floedb.metr.jdbc;

import ai.floedb.metr.MetrRecord;
import ai.floedb.metr.format.SqlValuesFormatter;
import ai.floedb.metr.handlers.AbstractHandler;
import ai.floedb.metr.handlers.HandlerPolicy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inserts each record as one row of {@code (timestamp, tag, value, session_id)} and commits it
 * immediately.
 *
 * <p>The table name is fixed at construction. A failed insert rolls the connection back before
 * the handler policy is applied.
 */
public final class JdbcHandler extends AbstractHandler {
  public static final String DEFAULT_TABLE = "metrics";

  private static final Logger LOG = LoggerFactory.getLogger(JdbcHandler.class);
  private static final Pattern TABLE_NAME =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

  private final Connection connection;
  private final String table;
  private final String insertSql;

  public JdbcHandler(Connection connection) {
    this(connection, DEFAULT_TABLE, HandlerPolicy.LENIENT);
  }

  public JdbcHandler(Connection connection, String table, HandlerPolicy policy) {
    super(SqlValuesFormatter.INSTANCE, policy);
    this.connection = Objects.requireNonNull(connection, "connection");
    this.table = requireTableName(table);
    this.insertSql =
        "INSERT INTO " + this.table + " (timestamp, tag, value, session_id) VALUES (?, ?, ?, ?)";
  }

  private static String requireTableName(String table) {
    Objects.requireNonNull(table, "table");
    if (!TABLE_NAME.matcher(table).matches()) {
      throw new IllegalArgumentException("invalid table name: " + table);
    }
    return table;
  }

  @Override
  protected void emit(MetrRecord record) throws SQLException {
    try (PreparedStatement statement = connection.prepareStatement(insertSql)) {
      statement.setTimestamp(1, Timestamp.from(record.created()));
      statement.setString(2, record.tag());
      statement.setLong(3, record.value());
      statement.setString(4, record.sessionId());
      statement.executeUpdate();
    }
    doFlush();
  }

  @Override
  protected void doFlush() {
    try {
      if (!connection.getAutoCommit()) {
        connection.commit();
      }
    } catch (SQLException e) {
      throw new JdbcHandlerException("commit failed for table " + table, e);
    }
  }

  @Override
  protected void doClose() {
    try {
      connection.close();
    } catch (SQLException e) {
      throw new JdbcHandlerException("failed to close connection for table " + table, e);
    }
  }

  @Override
  protected void handleError(MetrRecord record, Exception error) {
    try {
      if (!connection.getAutoCommit()) {
        connection.rollback();
      }
    } catch (SQLException rollbackFailure) {
      error.addSuppressed(rollbackFailure);
    }
    LOG.debug("Insert into {} failed for values ({})", table, format(record));
    super.handleError(record, error);
  }

  public String table() {
    return table;
  }

  String insertSql() {
    return insertSql;
  }

  @Override
  public String toString() {
    return "JdbcHandler(" + table + ")";
  }
}
