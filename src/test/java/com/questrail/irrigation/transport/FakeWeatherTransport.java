package com.questrail.irrigation.transport;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * FakeWeatherTransport
 * -----------------------------------------------------------------------------
 * Test-only {@link WeatherTransport}.
 *
 * <p>Records every requested URI and answers with queued bodies; an empty
 * queue or a queued failure answers with {@link IOException}.</p>
 */
public final class FakeWeatherTransport implements WeatherTransport {

    private final Deque<Object> responses = new ArrayDeque<>();
    private final List<URI> requested = new ArrayList<>();
    private boolean closed;

    @Override
    public synchronized String get(URI uri) throws IOException {
        Objects.requireNonNull(uri, "uri");
        requested.add(uri);
        Object next = responses.poll();
        if (next == null) {
            throw new IOException("no response queued for " + uri);
        }
        if (next instanceof IOException failure) {
            throw failure;
        }
        return (String) next;
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public synchronized FakeWeatherTransport respond(String body) {
        responses.add(body);
        return this;
    }

    public synchronized FakeWeatherTransport fail(String message) {
        responses.add(new IOException(message));
        return this;
    }

    public synchronized List<URI> requested() {
        return Collections.unmodifiableList(new ArrayList<>(requested));
    }

    public synchronized boolean isClosed() {
        return closed;
    }
}
