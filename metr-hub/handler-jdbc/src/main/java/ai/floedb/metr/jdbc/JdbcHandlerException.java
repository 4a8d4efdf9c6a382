package ai.floedb.metr.jdbc;

import ai.floedb.metr.MetrException;
import java.sql.SQLException;

/** Wraps a {@link SQLException} raised outside of a record insert. */
public class JdbcHandlerException extends MetrException {

  public JdbcHandlerException(String message, SQLException cause) {
    super(message, cause);
  }
}
