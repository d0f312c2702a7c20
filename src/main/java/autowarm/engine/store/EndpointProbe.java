package autowarm.engine.store;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;

/**
 * Health probe for a storage endpoint.
 * Returning false or throwing both mean UNHEALTHY.
 */
@FunctionalInterface
public interface EndpointProbe {

    boolean probe(Endpoint endpoint) throws Exception;

    /** Runs {@code SELECT 1} on a connection opened outside the endpoint's pool. */
    static EndpointProbe selectOne() {
        return endpoint -> {
            try (Connection conn = endpoint.probeConnection();
                    Statement st = conn.createStatement();
                    ResultSet rs = st.executeQuery("SELECT 1")) {
                return rs.next();
            }
        };
    }
}
