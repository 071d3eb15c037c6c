package de.bsommerfeld.sparkle.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A unit of JDBC work executed against a connection handed out by
 * {@link NoteDatabase}. Implementations must not commit, roll back or close
 * the connection.
 */
@FunctionalInterface
public interface SqlWork<T> {

    T execute(Connection conn) throws SQLException;
}
