package adlab.orchestrator.server;

import adlab.orchestrator.api.v1.dto.TaskRecordResponse;
import adlab.orchestrator.model.TaskRecord;
import adlab.orchestrator.stream.TaskEventSink;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.DefaultHttpContent;
import io.netty.handler.codec.http.DefaultHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.LastHttpContent;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import static io.netty.handler.codec.http.HttpResponseStatus.OK;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Writes stream events to a Netty channel as a chunked
 * {@code text/event-stream} response.
 */
public class SseEventSink implements TaskEventSink {

    public static final String UPDATE_EVENT = "update";
    public static final String TIMEOUT_EVENT = "timeout";
    static final String TIMEOUT_DATA = "{\"status\":\"timeout\",\"error\":\"Task processing timed out\"}";

    private final ChannelHandlerContext ctx;
    private final ObjectMapper mapper;

    public SseEventSink(ChannelHandlerContext ctx, ObjectMapper mapper) {
        this.ctx = ctx;
        this.mapper = mapper;
    }

    /**
     * Send the response head. Must be called before any event.
     */
    public void start() {
        HttpResponse response = new DefaultHttpResponse(HTTP_1_1, OK);
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/event-stream; charset=utf-8");
        response.headers().set(HttpHeaderNames.CACHE_CONTROL, HttpHeaderValues.NO_CACHE);
        response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
        HttpUtil.setTransferEncodingChunked(response, true);
        ctx.writeAndFlush(response);
    }

    @Override
    public void onUpdate(TaskRecord record) {
        String data;
        try {
            data = mapper.writeValueAsString(TaskRecordResponse.from(record, mapper));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
        write("event: " + UPDATE_EVENT + "\ndata: " + data + "\n\n");
    }

    @Override
    public void onTimeout() {
        write("event: " + TIMEOUT_EVENT + "\ndata: " + TIMEOUT_DATA + "\n\n");
    }

    @Override
    public void onHeartbeat() {
        write(": heartbeat\n\n");
    }

    @Override
    public void onComplete() {
        if (ctx.channel().isActive()) {
            ctx.writeAndFlush(LastHttpContent.EMPTY_LAST_CONTENT).addListener(ChannelFutureListener.CLOSE);
        }
    }

    private void write(String frame) {
        if (!ctx.channel().isActive()) {
            throw new IllegalStateException("Stream client disconnected");
        }
        ctx.writeAndFlush(new DefaultHttpContent(Unpooled.copiedBuffer(frame, StandardCharsets.UTF_8)));
    }
}
