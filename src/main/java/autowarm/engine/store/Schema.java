package autowarm.engine.store;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Table and index definitions. Idempotent.
 */
public final class Schema {

    private Schema() {
    }

    public static void apply(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {

            // ---------- RESOURCES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS resources (
                            id              BIGINT PRIMARY KEY,
                            owner_id        BIGINT NOT NULL,
                            handle          VARCHAR(256) NOT NULL,
                            active          BOOLEAN DEFAULT TRUE,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tasks (
                            id              VARCHAR(64) PRIMARY KEY,
                            owner_id        BIGINT NOT NULL,
                            resource_id     BIGINT NOT NULL,
                            kind            VARCHAR(64) DEFAULT 'warmup',
                            status          VARCHAR(20) DEFAULT 'PENDING',
                            settings        CLOB,
                            progress        CLOB,
                            next_attempt_at TIMESTAMP,
                            error           VARCHAR(4096),
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at      TIMESTAMP,
                            completed_at    TIMESTAMP,
                            updated_at      TIMESTAMP
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_owner ON tasks(owner_id, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_resource ON tasks(resource_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_status_next ON tasks(status, next_attempt_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_resources_owner ON resources(owner_id);");

            st.executeBatch();
        }
    }
}
