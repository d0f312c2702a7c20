package autowarm.engine.store;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Unit of work run by {@link DurableStore} on a routed connection.
 * Runs inside a transaction; the store commits or rolls back.
 */
@FunctionalInterface
public interface SqlWork<T> {

    T run(Connection conn) throws SQLException;
}
