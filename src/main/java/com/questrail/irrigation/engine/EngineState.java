package com.questrail.irrigation.engine;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Scheduling state owned by the engine thread.
 *
 * <p>Mutated only by {@link ScheduleProcessor}; other threads see copies via
 * {@link ScheduleProcessor#state()}.</p>
 */
public final class EngineState {

    private boolean blockActive;
    private final Set<Integer> processedInBlock = new TreeSet<>();
    private final Set<Integer> activatedInBlock = new TreeSet<>();
    private Duration delay = Duration.ZERO;
    private LocalDate delayedBlockDate;
    private Instant updatedEt;
    private Instant lastBlockStart;

    EngineState() {
    }

    private EngineState(EngineState other) {
        this.blockActive = other.blockActive;
        this.processedInBlock.addAll(other.processedInBlock);
        this.activatedInBlock.addAll(other.activatedInBlock);
        this.delay = other.delay;
        this.delayedBlockDate = other.delayedBlockDate;
        this.updatedEt = other.updatedEt;
        this.lastBlockStart = other.lastBlockStart;
    }

    public boolean blockActive() {
        return blockActive;
    }

    /** Zones already handled (started, capped or rained out) in the current block. */
    public Set<Integer> processedInBlock() {
        return Set.copyOf(processedInBlock);
    }

    /** Zones actually started in the current block; counted against the daily cap. */
    public Set<Integer> activatedInBlock() {
        return Set.copyOf(activatedInBlock);
    }

    /** Postponement of today's block start caused by freezing readings. */
    public Duration delay() {
        return delay;
    }

    /** Time of the last ET accrual, empty until the first one. */
    public Optional<Instant> updatedEt() {
        return Optional.ofNullable(updatedEt);
    }

    EngineState copy() {
        return new EngineState(this);
    }

    /**
     * Whether a block was already opened for this scheduled start; the start
     * window spans several ticks.
     */
    boolean alreadyStarted(Instant scheduledStart) {
        return scheduledStart.equals(lastBlockStart);
    }

    void openBlock(Instant scheduledStart) {
        lastBlockStart = scheduledStart;
        blockActive = true;
        processedInBlock.clear();
        activatedInBlock.clear();
    }

    void completeBlock() {
        blockActive = false;
        processedInBlock.clear();
        activatedInBlock.clear();
    }

    boolean isProcessed(int zone) {
        return processedInBlock.contains(zone);
    }

    void markProcessed(int zone) {
        processedInBlock.add(zone);
    }

    void markActivated(int zone) {
        processedInBlock.add(zone);
        activatedInBlock.add(zone);
    }

    boolean wasActivated(int zone) {
        return activatedInBlock.contains(zone);
    }

    int activatedCount() {
        return activatedInBlock.size();
    }

    /**
     * Date whose start time the current delay is relative to; a delayed block
     * may slip past midnight.
     */
    LocalDate blockDate(LocalDate today) {
        return delayedBlockDate != null ? delayedBlockDate : today;
    }

    void postpone(Duration step, LocalDate blockDate) {
        delay = delay.plus(step);
        delayedBlockDate = blockDate;
    }

    void clearDelay() {
        delay = Duration.ZERO;
        delayedBlockDate = null;
    }

    void etAccrued(Instant at) {
        updatedEt = at;
    }
}
