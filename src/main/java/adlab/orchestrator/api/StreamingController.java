package adlab.orchestrator.api;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

/**
 * Controller that answers with a long-lived response written over time
 * (server-sent events) instead of a single {@link Controller.ControllerResponse}.
 */
public interface StreamingController {

    boolean matches(HttpMethod method, String path);

    /**
     * Start the response. Must not block the event loop. Exceptions thrown
     * before anything was written are mapped to an error response by the router.
     */
    void open(ChannelHandlerContext ctx, FullHttpRequest req, String path);
}
