package raffle.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Unit of JDBC work run by {@link ConnectionPool} inside a connection scope.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface SqlWork<T> {

  T run(Connection conn) throws SQLException;
}
