package com.questrail.irrigation.archive;

import com.questrail.irrigation.api.ScheduleRecord;

import java.util.List;
import java.util.Optional;

/**
 * ScheduleStore
 * =============================================================================
 * Persistence port for zone run history.
 *
 * <h2>Binding constraints</h2>
 * <ul>
 *   <li>Implementations are NOT thread-safe; only the {@link Archive} worker
 *       thread may call them.</li>
 *   <li>Mutations are not visible to a fresh connection until {@link #commit()}.</li>
 *   <li>Every failure surfaces as {@link ArchiveException}.</li>
 * </ul>
 */
public interface ScheduleStore extends AutoCloseable {

    /**
     * Inserts an open run for {@code zone} and returns it with its generated id.
     */
    ScheduleRecord insertOpen(int zone, long startTime, double weatherAdjustment);

    /**
     * Most recent open run of {@code zone}, if any.
     */
    Optional<ScheduleRecord> findOpen(int zone);

    /**
     * Sets the stop time of run {@code id}.
     */
    void close(long id, long stopTime);

    /**
     * Latest run of every zone, newest first.
     */
    List<ScheduleRecord> latestPerZone(boolean scheduledOnly);

    /**
     * Runs started at or after {@code startTime}, in start order.
     */
    List<ScheduleRecord> startedSince(long startTime, boolean scheduledOnly);

    List<ScheduleRecord> openRuns();

    void commit();

    void rollback();

    @Override
    void close();
}
