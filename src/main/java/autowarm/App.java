package autowarm;

import autowarm.engine.config.Dependencies;
import autowarm.engine.config.EngineConfig;
import autowarm.engine.executor.TaskExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ServiceLoader;
import java.util.concurrent.CountDownLatch;

/**
 * Engine entry point.
 *
 * Usage: {@code java -jar autowarm-engine.jar [config.ini]}. Without an INI
 * file the configuration comes from AUTOWARM_* environment variables.
 * Task executors are discovered through {@link ServiceLoader}.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        EngineConfig config = args.length > 0
                ? EngineConfig.fromIni(new File(args[0]))
                : EngineConfig.fromEnv();

        Dependencies deps = Dependencies.create(config);

        for (TaskExecutor executor : ServiceLoader.load(TaskExecutor.class)) {
            deps.executors().register(executor);
            log.info("Registered executor {} for kind '{}'", executor.getClass().getName(), executor.kind());
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            deps.close();
            stopped.countDown();
        }, "autowarm-shutdown"));

        deps.start();
        log.info("Autowarm engine started");

        stopped.await();
    }
}
