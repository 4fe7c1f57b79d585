package jobstream.broker.api;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import jobstream.broker.api.Controller.ControllerResponse;

import java.util.Optional;

/**
 * Controller for long-lived responses that write to the channel themselves.
 */
public interface StreamController {

    boolean matches(HttpMethod method, String path);

    /**
     * Start streaming on the request's channel, or refuse with a plain response.
     *
     * @return the refusal, or empty once the controller owns the channel
     */
    Optional<ControllerResponse> attach(ChannelHandlerContext ctx, FullHttpRequest req, String path);
}
