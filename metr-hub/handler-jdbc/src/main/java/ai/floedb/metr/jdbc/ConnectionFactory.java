package ai.floedb.metr.jdbc;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/** Opens the connection a {@link JdbcHandler} writes through. */
@FunctionalInterface
public interface ConnectionFactory {

  Connection open() throws SQLException;

  static ConnectionFactory driverManager(String url, String user, String password) {
    return () -> DriverManager.getConnection(url, user, password);
  }
}
