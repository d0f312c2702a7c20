package autowarm.engine.api.v1;

import autowarm.engine.api.Controller;
import autowarm.engine.api.v1.dto.FailoverResponse;
import autowarm.engine.store.DurableStore;
import autowarm.engine.store.EndpointHealth;
import autowarm.engine.store.StorageUnavailableException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Storage operations.
 * GET /api/v1/storage/stats - connection pool statistics per endpoint
 * GET /api/v1/storage/replication - replication lag as reported by the primary
 * POST /api/v1/storage/failover?replica=name - promote a replica to primary
 */
public class StorageController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(StorageController.class);

    private static final String STATS_PATH = "/api/v1/storage/stats";
    private static final String REPLICATION_PATH = "/api/v1/storage/replication";
    private static final String FAILOVER_PATH = "/api/v1/storage/failover";

    private final DurableStore store;

    public StorageController(DurableStore store) {
        this.store = store;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return (method.equals(HttpMethod.GET) && (STATS_PATH.equals(path) || REPLICATION_PATH.equals(path)))
                || (method.equals(HttpMethod.POST) && FAILOVER_PATH.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (STATS_PATH.equals(path)) {
            return ControllerResponse.json(store.stats());
        }
        if (REPLICATION_PATH.equals(path)) {
            return ControllerResponse.json(store.replicationStatus());
        }
        return failover(req);
    }

    private ControllerResponse failover(FullHttpRequest req) {
        List<String> names = new QueryStringDecoder(req.uri()).parameters().get("replica");
        String replica = names != null && !names.isEmpty() && !names.get(0).isBlank() ? names.get(0) : null;

        try {
            EndpointHealth promoted = store.forceFailover(replica);
            log.warn("Manual failover via HTTP: {} is now primary", promoted.name());
            return ControllerResponse.json(new FailoverResponse(promoted,
                    "Replica " + promoted.name() + " promoted to primary"));
        } catch (StorageUnavailableException e) {
            return ControllerResponse.conflict(e.getMessage());
        }
    }
}
