package autowarm.engine.server;

import autowarm.engine.api.Controller;
import autowarm.engine.api.Controller.ControllerResponse;
import autowarm.engine.store.StorageUnavailableException;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Dispatches HTTP requests to registered controllers.
 *
 * Only /api/v1/* is served; everything else is 404.
 * Sharable: no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    private final List<Controller> controllers = new CopyOnWriteArrayList<>();

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        write(ctx, route(ctx, req));
    }

    /**
     * Find the controller for a request and turn its failures into error responses.
     */
    ControllerResponse route(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf('?')) : uri;

        try {
            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    return controller.handle(ctx, req, path);
                }
            }
            log.debug("No handler for: {} {}", method, path);
            return ControllerResponse.notFound("not found");

        } catch (IllegalArgumentException e) {
            log.warn("Validation error: {}", e.getMessage());
            return ControllerResponse.badRequest(e.getMessage());
        } catch (StorageUnavailableException e) {
            log.warn("{} {}: {}", method, path, e.getMessage());
            return ControllerResponse.unavailable(e.getMessage());
        } catch (Exception e) {
            log.error("Handler error: {} {}", method, path, e);
            return ControllerResponse.error(e.toString());
        }
    }

    private void write(ChannelHandlerContext ctx, ControllerResponse response) {
        writeSafe(ctx, response.status(), response.contentType(), response.body());
    }

    /**
     * Write a response; on failure fall back to a bare 500 or close the channel.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            byte[] bytes = (body != null ? body : "").getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(response);
        } catch (Exception e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            write(ctx, ControllerResponse.error("channel error"));
        } finally {
            ctx.close();
        }
    }
}
