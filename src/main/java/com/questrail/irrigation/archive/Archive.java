package com.questrail.irrigation.archive;

import com.questrail.irrigation.api.RunStatus;
import com.questrail.irrigation.api.ScheduleRecord;
import com.questrail.irrigation.api.ValidationException;
import com.questrail.irrigation.api.WeatherAdjustment;
import com.questrail.irrigation.internal.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Archive
 * =============================================================================
 * Serialized access to the zone run history.
 *
 * <h2>Threading Model</h2>
 * A single worker thread owns the {@link ScheduleStore}. Callers on any thread
 * submit a request and block on that request's own future, so responses can
 * never be picked up by the wrong caller. Requests are executed strictly in
 * submission order.
 *
 * <h2>Failure isolation</h2>
 * A failing request is rolled back, logged (message at ERROR, stack trace at
 * DEBUG) and completed with {@link ArchiveException}; the worker keeps going.
 * Every submitted request is completed, including those still queued when
 * the archive stops.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   archive.start()   → opens the store, starts the worker
 *   archive.writeData / getData / openRuns
 *   archive.stop()    → drains queued requests, closes the store, joins the worker
 * </pre>
 */
public final class Archive {

    private static final Logger log = LoggerFactory.getLogger(Archive.class);

    private static final Request<Void> SHUTDOWN = new Request<>(0L, "shutdown", false, store -> null);

    private final Supplier<? extends ScheduleStore> storeFactory;
    private final WallClock clock;

    private final BlockingQueue<Request<?>> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong correlationIds = new AtomicLong();
    private final Object submitLock = new Object();

    private volatile Thread workerThread;

    public Archive(Supplier<? extends ScheduleStore> storeFactory, WallClock clock) {
        this.storeFactory = Objects.requireNonNull(storeFactory, "storeFactory");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Archive over a SQLite file, created on first start.
     */
    public static Archive sqlite(Path file, WallClock clock) {
        Objects.requireNonNull(file, "file");
        return new Archive(() -> SqliteScheduleStore.open(file), clock);
    }

    /**
     * Opens the store and starts the worker. Idempotent.
     *
     * @throws ArchiveException if the store cannot be opened
     */
    public void start() {
        synchronized (submitLock) {
            if (running.get()) {
                return;
            }
            ScheduleStore store = storeFactory.get();
            Thread worker = new Thread(() -> runWorker(store), "irrigation-archive");
            worker.setDaemon(true);
            workerThread = worker;
            running.set(true);
            worker.start();
        }
    }

    /**
     * Stops accepting requests, lets the worker finish everything queued so
     * far, then closes the store. Blocks until the worker exits.
     */
    public void stop() {
        boolean stopping;
        synchronized (submitLock) {
            stopping = running.compareAndSet(true, false);
            if (stopping) {
                queue.offer(SHUTDOWN);
            }
        }
        if (stopping) {
            Thread worker = workerThread;
            if (worker != null) {
                try {
                    worker.join(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            workerThread = null;
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public List<ScheduleRecord> getData() {
        return getData(0L, false);
    }

    public List<ScheduleRecord> getData(long maxAgeSeconds) {
        return getData(maxAgeSeconds, false);
    }

    /**
     * Reads run history.
     *
     * @param maxAgeSeconds {@code <= 0}: the latest run of every zone, newest
     *                      first; otherwise every run started within the last
     *                      {@code maxAgeSeconds}, oldest first
     * @param scheduledOnly keep only runs started by the scheduling engine
     */
    public List<ScheduleRecord> getData(long maxAgeSeconds, boolean scheduledOnly) {
        if (maxAgeSeconds <= 0) {
            return call("latest per zone", false, store -> store.latestPerZone(scheduledOnly));
        }
        long since = clock.now().getEpochSecond() - maxAgeSeconds;
        return call("runs since " + since, false, store -> store.startedSince(since, scheduledOnly));
    }

    /**
     * Records a zone transition.
     *
     * <p>{@code "on"} opens a run (a run still open for the zone is closed at
     * {@code timestamp} first). {@code "off"} closes the zone's open run and
     * returns {@code false} without touching the store when there is none.</p>
     *
     * @param weatherAdjustment stored with an {@code "on"} run; {@code null} means
     *                          {@link WeatherAdjustment#FULL_DURATION}
     * @throws ValidationException if {@code status} is not on/off or {@code zone < 1};
     *                             nothing is queued in that case
     * @throws ArchiveException    if the store rejected the write
     */
    public boolean writeData(long timestamp, int zone, String status, Double weatherAdjustment) {
        return writeData(timestamp, zone, RunStatus.parse(status), weatherAdjustment);
    }

    public boolean writeData(long timestamp, int zone, RunStatus status, Double weatherAdjustment) {
        if (status == null) {
            throw new ValidationException("Invalid status code 'null'");
        }
        if (zone < 1) {
            throw new ValidationException("Invalid zone " + zone);
        }
        if (timestamp < 0) {
            throw new ValidationException("Invalid timestamp " + timestamp);
        }
        double adjustment = weatherAdjustment == null ? WeatherAdjustment.FULL_DURATION : weatherAdjustment;

        if (status == RunStatus.ON) {
            return call("zone " + zone + " on", true, store -> {
                store.findOpen(zone).ifPresent(open -> store.close(open.id(), Math.max(timestamp, open.startTime())));
                store.insertOpen(zone, timestamp, adjustment);
                return true;
            });
        }
        return call("zone " + zone + " off", true, store -> {
            Optional<ScheduleRecord> open = store.findOpen(zone);
            if (open.isEmpty()) {
                return false;
            }
            store.close(open.get().id(), Math.max(timestamp, open.get().startTime()));
            return true;
        });
    }

    /**
     * Runs that have been opened and not yet closed, ordered by zone.
     */
    public List<ScheduleRecord> openRuns() {
        return call("open runs", false, ScheduleStore::openRuns);
    }

    private <T> T call(String description, boolean mutating, Function<ScheduleStore, T> command) {
        Request<T> request = new Request<>(correlationIds.incrementAndGet(), description, mutating, command);
        // Queued strictly before the shutdown marker or rejected.
        synchronized (submitLock) {
            if (!running.get()) {
                throw new IllegalStateException("Archive is not running");
            }
            queue.offer(request);
        }
        try {
            return request.future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ArchiveException("Interrupted waiting for archive request #" + request.id, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new ArchiveException("Archive request #" + request.id + " failed", cause);
        }
    }

    private void runWorker(ScheduleStore store) {
        try {
            while (true) {
                Request<?> request = queue.take();
                if (request == SHUTDOWN) {
                    break;
                }
                execute(store, request);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            synchronized (submitLock) {
                running.set(false);
            }
            try {
                store.close();
            } catch (RuntimeException e) {
                log.error("Closing schedule store failed: {}", e.toString());
                log.debug("Stack trace for store close", e);
            }
            failPending();
        }
    }

    private <T> void execute(ScheduleStore store, Request<T> request) {
        try {
            T result = request.command.apply(store);
            if (request.mutating) {
                store.commit();
            }
            request.future.complete(result);
        } catch (Throwable t) {
            if (request.mutating) {
                rollback(store, request);
            }
            log.error("Archive request #{} ({}) failed: {}", request.id, request.description, t.toString());
            log.debug("Stack trace for archive request #{}", request.id, t);
            request.future.completeExceptionally(t instanceof ArchiveException
                    ? t
                    : new ArchiveException("Archive request '" + request.description + "' failed", t));
        }
    }

    private static void rollback(ScheduleStore store, Request<?> request) {
        try {
            store.rollback();
        } catch (RuntimeException e) {
            log.error("Rollback of archive request #{} failed: {}", request.id, e.toString());
        }
    }

    private void failPending() {
        Request<?> request;
        while ((request = queue.poll()) != null) {
            if (request != SHUTDOWN) {
                request.future.completeExceptionally(new IllegalStateException("Archive is not running"));
            }
        }
    }

    private static final class Request<T> {
        final long id;
        final String description;
        final boolean mutating;
        final Function<ScheduleStore, T> command;
        final CompletableFuture<T> future = new CompletableFuture<>();

        Request(long id, String description, boolean mutating, Function<ScheduleStore, T> command) {
            this.id = id;
            this.description = description;
            this.mutating = mutating;
            this.command = command;
        }
    }
}
