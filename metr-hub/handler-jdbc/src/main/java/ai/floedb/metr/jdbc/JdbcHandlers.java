package ai.floedb.metr.jdbc;

import ai.floedb.metr.Handler;
import ai.floedb.metr.MetrException;
import ai.floedb.metr.handlers.HandlerPolicy;
import ai.floedb.metr.handlers.NullHandler;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds database handlers from configuration.
 *
 * <p>When the database cannot be reached a {@link HandlerPolicy#LENIENT} caller gets a {@link
 * NullHandler} and an error in the log; a {@link HandlerPolicy#STRICT} caller gets the failure.
 */
public final class JdbcHandlers {
  private static final Logger LOG = LoggerFactory.getLogger(JdbcHandlers.class);

  private JdbcHandlers() {}

  public static Handler fromConfig(JdbcHandlerConfig config, HandlerPolicy policy) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(policy, "policy");
    if (!config.enabled()) {
      LOG.debug("metr.jdbc.enabled is false, records will not be written to a database");
      return NullHandler.INSTANCE;
    }
    if (config.url().isEmpty()) {
      if (policy.isStrict()) {
        throw new MetrException("metr.jdbc.url is required when metr.jdbc.enabled is true");
      }
      LOG.error("metr.jdbc.url is not set, records will not be written to a database");
      return NullHandler.INSTANCE;
    }
    ConnectionFactory factory =
        ConnectionFactory.driverManager(
            config.url().get(), config.user().orElse(null), config.password().orElse(null));
    return open(factory, config.table(), policy);
  }

  /** Opens a connection with auto-commit disabled and wraps it in a {@link JdbcHandler}. */
  public static Handler open(ConnectionFactory factory, String table, HandlerPolicy policy) {
    Objects.requireNonNull(factory, "factory");
    Connection connection;
    try {
      connection = factory.open();
    } catch (SQLException e) {
      if (policy.isStrict()) {
        throw new JdbcHandlerException("Error while opening metrics database connection", e);
      }
      LOG.error("Error while opening metrics database connection", e);
      return NullHandler.INSTANCE;
    }
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      closeQuietly(connection, e);
      throw new JdbcHandlerException("Could not disable auto-commit", e);
    }
    return new JdbcHandler(connection, table, policy);
  }

  private static void closeQuietly(Connection connection, SQLException cause) {
    try {
      connection.close();
    } catch (SQLException closeFailure) {
      cause.addSuppressed(closeFailure);
    }
  }
}
