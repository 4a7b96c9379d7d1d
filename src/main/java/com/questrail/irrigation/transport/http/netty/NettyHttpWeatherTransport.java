package com.questrail.irrigation.transport.http.netty;

import com.questrail.irrigation.transport.WeatherTransport;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpContentDecompressor;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.timeout.ReadTimeoutHandler;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * NettyHttpWeatherTransport
 * =============================================================================
 * Netty-backed implementation of the {@link WeatherTransport} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. One GET opens one
 * HTTP/1.1 connection ({@code Connection: close}); the aggregated response is
 * handed back as a UTF-8 string.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <h2>Lifecycle</h2>
 * The event loop group is created eagerly and released by {@link #close()}.
 */
public final class NettyHttpWeatherTransport implements WeatherTransport
{
    private static final int MAX_CONTENT_BYTES = 1 << 20;

    private final Duration timeout;
    private final EventLoopGroup group;
    private final SslContext sslContext;

    public NettyHttpWeatherTransport(Duration timeout)
    {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.group = new NioEventLoopGroup(1);
        try {
            this.sslContext = SslContextBuilder.forClient().build();
        }
        catch (IOException e) {
            group.shutdownGracefully();
            throw new IllegalStateException("Unable to initialise TLS client context", e);
        }
    }

    @Override
    public String get(URI uri) throws IOException
    {
        Objects.requireNonNull(uri, "uri");
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        boolean secure = scheme.equals("https");
        if (!secure && !scheme.equals("http")) {
            throw new IOException("Unsupported scheme: " + uri);
        }
        String host = uri.getHost();
        if (host == null) {
            throw new IOException("URI has no host: " + uri);
        }
        int port = uri.getPort() > 0 ? uri.getPort() : (secure ? 443 : 80);

        CompletableFuture<String> body = new CompletableFuture<>();
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (secure) {
                            p.addLast(sslContext.newHandler(ch.alloc(), host, port));
                        }
                        p.addLast(new ReadTimeoutHandler(timeout.toMillis(), TimeUnit.MILLISECONDS));
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpContentDecompressor());
                        p.addLast(new HttpObjectAggregator(MAX_CONTENT_BYTES));
                        p.addLast(new ResponseHandler(body));
                    }
                });

        Channel channel = null;
        try {
            ChannelFuture connect = bootstrap.connect(host, port);
            if (!connect.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new IOException("Timed out connecting to " + host + ":" + port);
            }
            if (!connect.isSuccess()) {
                throw new IOException("Unable to connect to " + host + ":" + port, connect.cause());
            }
            channel = connect.channel();
            channel.writeAndFlush(newRequest(uri, host));
            return body.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while fetching " + uri, e);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException("Request to " + uri + " failed", cause);
        }
        catch (TimeoutException e) {
            throw new IOException("Timed out waiting for " + uri, e);
        }
        finally {
            if (channel != null) {
                channel.close();
            }
        }
    }

    @Override
    public void close()
    {
        group.shutdownGracefully();
    }

    private static FullHttpRequest newRequest(URI uri, String host)
    {
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null) {
            path = path + "?" + uri.getRawQuery();
        }
        FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, path);
        request.headers().set(HttpHeaderNames.HOST, host);
        request.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        request.headers().set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON);
        request.headers().set(HttpHeaderNames.ACCEPT_ENCODING, HttpHeaderValues.GZIP);
        return request;
    }

    /**
     * ResponseHandler
     * -------------------------------------------------------------------------
     * Completes the pending future with the aggregated body, or with an
     * {@link IOException} on a non-2xx status, an exception, or a channel
     * that closes before a response arrived.
     */
    private static final class ResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse>
    {
        private final CompletableFuture<String> body;

        private ResponseHandler(CompletableFuture<String> body)
        {
            this.body = body;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse response)
        {
            int status = response.status().code();
            String content = response.content().toString(StandardCharsets.UTF_8);
            if (status < 200 || status >= 300) {
                body.completeExceptionally(new IOException("HTTP " + status + ": " + abbreviate(content)));
            }
            else {
                body.complete(content);
            }
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            body.completeExceptionally(new IOException("Connection closed before a response was received"));
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            body.completeExceptionally(cause instanceof IOException ? cause : new IOException(cause));
            ctx.close();
        }

        private static String abbreviate(String content)
        {
            return content.length() <= 200 ? content : content.substring(0, 200) + "...";
        }
    }
}
