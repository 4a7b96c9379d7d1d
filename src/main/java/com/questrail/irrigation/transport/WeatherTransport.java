package com.questrail.irrigation.transport;

import java.io.IOException;
import java.net.URI;

/**
 * WeatherTransport
 * -----------------------------------------------------------------------------
 * Minimal port for fetching a document from the weather provider.
 *
 * <p>Implementations perform I/O only. They do not parse payloads, throttle,
 * cache or retry; those concerns live in the gateway that owns the port.</p>
 *
 * <p>Implementations may be backed by Netty, the JDK client, or a test fake.</p>
 */
public interface WeatherTransport extends AutoCloseable
{
    /**
     * Performs an HTTP GET and returns the response body.
     *
     * @param uri absolute http or https URI
     * @return the response body decoded as UTF-8
     * @throws IOException on connection failure, timeout, or a non-2xx status
     */
    String get(URI uri) throws IOException;

    /**
     * Releases transport resources. Further calls to {@link #get(URI)} fail.
     */
    @Override
    void close();
}
