package autowarm.engine.config;

import autowarm.engine.retry.BackoffWindow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @Test
    void defaults() {
        EngineConfig config = EngineConfig.defaults();

        assertEquals(3, config.maxWorkers());
        assertEquals(2, config.maxPerUser());
        assertEquals(new BackoffWindow(30, 90), config.backoffWindow());
        assertEquals(Duration.ofSeconds(30), config.healthCheckInterval());
        assertEquals(60, config.riskThreshold());
        assertEquals(40, config.healthThreshold());
        assertEquals(PoolSettings.PRIMARY_DEFAULTS, config.primaryPool());
        assertEquals(150, config.primaryPool().maxConnections());
        assertEquals(60, config.replicaPool().maxConnections());
        assertTrue(config.replicaUrls().isEmpty());
        assertTrue(config.httpEnabled());
    }

    @Test
    void iniOverridesDefaults(@TempDir Path dir) throws IOException {
        Path ini = dir.resolve("autowarm.ini");
        Files.writeString(ini, """
                [database]
                primary_url = jdbc:h2:mem:ini-primary
                replica_urls = jdbc:h2:mem:r1, jdbc:h2:mem:r2
                health_check_interval_seconds = 10

                [pool.replica]
                size = 5
                max_overflow = 5

                [scheduler]
                max_workers = 8
                max_per_user = 3
                backoff_min_minutes = 10
                backoff_max_minutes = 20

                [health_gate]
                risk_threshold = 70.5

                [server]
                port = 0
                """);

        EngineConfig config = EngineConfig.fromIni(ini.toFile());

        assertEquals("jdbc:h2:mem:ini-primary", config.primaryUrl());
        assertEquals(List.of("jdbc:h2:mem:r1", "jdbc:h2:mem:r2"), config.replicaUrls());
        assertEquals(Duration.ofSeconds(10), config.healthCheckInterval());
        assertEquals(10, config.replicaPool().maxConnections());
        assertEquals(Duration.ofSeconds(30), config.replicaPool().acquireTimeout());
        assertEquals(PoolSettings.PRIMARY_DEFAULTS, config.primaryPool());
        assertEquals(8, config.maxWorkers());
        assertEquals(3, config.maxPerUser());
        assertEquals(new BackoffWindow(10, 20), config.backoffWindow());
        assertEquals(70.5, config.riskThreshold());
        assertEquals(40, config.healthThreshold());
        assertFalse(config.httpEnabled());
    }

    @Test
    void invalidValuesAreRejected(@TempDir Path dir) throws IOException {
        Path ini = dir.resolve("bad.ini");
        Files.writeString(ini, """
                [scheduler]
                max_per_user = 0
                """);

        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromIni(ini.toFile()));
    }

    @Test
    void missingFileIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromIni(new File("/no/such/file.ini")));
    }

    @Test
    void toStringHidesCredentials() {
        EngineConfig config = EngineConfig.defaults()
                .withPrimaryUrl("jdbc:postgresql://admin:secret@db:5432/autowarm");

        assertFalse(config.toString().contains("secret"));
    }
}
