package io.barhistory.session;

import com.codahale.metrics.Meter;
import io.barhistory.budget.MemoryBudget;
import io.barhistory.config.HistoryConfig;
import io.barhistory.core.AttachParams;
import io.barhistory.core.Bar;
import io.barhistory.core.DataBlock;
import io.barhistory.core.Field;
import io.barhistory.core.HistoryException;
import io.barhistory.core.Period;
import io.barhistory.core.PullResult;
import io.barhistory.core.RetCode;
import io.barhistory.core.SplitAdjust;
import io.barhistory.core.SupportedParameters;
import io.barhistory.core.ValueAdjust;
import io.barhistory.metrics.Metrics;
import io.barhistory.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Pull state of one attached data source.
 * <p>
 * The pull loop is the only writer of the session's blocks and extremes. It completes {@link #completion()} after
 * its last write; readers must wait for that before touching the data. The cancellation flag is the only signal
 * flowing the other way.
 */
public final class DriverSession {
    private static final Logger log = LoggerFactory.getLogger(DriverSession.class);

    private final int attachIndex;
    private final AttachParams params;
    private final SupportedParameters supportedParameters;
    private final SessionListener owner;
    private final MemoryBudget budget;
    private final RetryPolicy retryPolicy;
    private final int initialBlockCapacity;
    private final int maxBarsPerBlock;
    private final Meter barsMeter;
    private final Meter retriesMeter;

    private final AtomicBoolean enoughValidDataProvided = new AtomicBoolean(false);
    private final CompletableFuture<SessionState> finishIndication = new CompletableFuture<>();
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CREATED);
    private volatile RetCode retCode = RetCode.SUCCESS;
    private volatile String errorMessage;

    private Period periodProvided;
    private Set<Field> fieldProvided = Set.of();
    private final List<DataBlock> owned = new ArrayList<>();
    private List<DataBlock> blocks = new ArrayList<>();
    private DataBlock current;
    private int nbBars;
    private long lowestTimestamp = Long.MAX_VALUE;
    private long highestTimestamp = Long.MIN_VALUE;

    private boolean barAddedSinceLastCall;
    private long lowestSinceLastCall = Long.MAX_VALUE;
    private long highestSinceLastCall = Long.MIN_VALUE;

    private final List<SplitAdjust> splitAdjusts = new ArrayList<>();
    private final List<ValueAdjust> valueAdjusts = new ArrayList<>();

    private boolean contributingDataSource;
    private boolean released;

    public DriverSession(int attachIndex, AttachParams params, SupportedParameters supportedParameters,
                         SessionListener owner, MemoryBudget budget, RetryPolicy retryPolicy,
                         HistoryConfig config, Metrics metrics) {
        this.attachIndex = attachIndex;
        this.params = Objects.requireNonNull(params);
        this.supportedParameters = Objects.requireNonNull(supportedParameters);
        this.owner = Objects.requireNonNull(owner);
        this.budget = Objects.requireNonNull(budget);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.initialBlockCapacity = config.initialBlockCapacity();
        this.maxBarsPerBlock = config.maxBarsPerBlock();
        this.barsMeter = metrics.meter(Metrics.PULL_BARS);
        this.retriesMeter = metrics.meter(Metrics.PULL_RETRIES);
    }

    /**
     * Runs the pull loop until the driver finishes, fails, or the session is cancelled. Never throws for driver
     * or invariant failures, errors included; those end in {@link SessionState#ERRORED} and are reported to the
     * owner, and the driver is asked to drop whatever it holds for this session.
     */
    public SessionState pullAll() {
        if (!state.compareAndSet(SessionState.CREATED, SessionState.PULLING)) {
            throw new IllegalStateException("session " + describe() + " was already pulled");
        }
        try {
            if (params.isEmptyRange()) {
                log.debug("{}: start is after end, nothing to pull", describe());
            } else {
                pullLoop();
            }
            current = null;
            state.set(SessionState.FINISHED);
            log.debug("{}: finished with {} bars in {} block(s)", describe(), nbBars, blocks.size());
        } catch (HistoryException e) {
            fail(e.retCode(), e.getMessage(), e);
        } catch (RuntimeException e) {
            fail(RetCode.INTERNAL_ERROR, "unexpected failure while pulling " + describe() + ": " + e, e);
        } catch (OutOfMemoryError e) {
            fail(RetCode.ALLOC_ERROR, describe() + ": out of memory while pulling", e);
        } catch (Error e) {
            // on a pool thread nobody would see it; recorded as fatal instead
            fail(RetCode.INTERNAL_ERROR, "unexpected failure while pulling " + describe() + ": " + e, e);
        } finally {
            finishIndication.complete(state.get());
        }
        return state.get();
    }

    private void pullLoop() throws HistoryException {
        Set<Field> wanted = params.allFieldsRequested() ? Field.all() : params.fields();
        while (true) {
            if (enoughValidDataProvided.get()) {
                state.set(SessionState.CANCELLING);
                log.debug("{}: cancelled after {} bars", describe(), nbBars);
                return;
            }
            PullResult r = pullOnce(wanted);
            if (r == null) {
                throw new HistoryException(RetCode.INTERNAL_ERROR, describe() + ": driver returned no result");
            }
            switch (r.status()) {
                case BAR -> accept(r);
                case FINISHED -> {
                    return;
                }
                case ERROR -> throw new HistoryException(RetCode.DRIVER_ERROR,
                        describe() + ": " + (r.message() == null ? "driver reported an error" : r.message()));
            }
        }
    }

    private PullResult pullOnce(Set<Field> wanted) throws HistoryException {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return params.driver().pull(this, params.start(), params.end(), wanted);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new HistoryException(RetCode.DRIVER_ERROR, describe() + ": interrupted while pulling", ie);
            } catch (Exception e) {
                if (enoughValidDataProvided.get()) {
                    log.debug("{}: pull failed after cancellation, keeping {} bars: {}", describe(), nbBars, e.toString());
                    return PullResult.finished();
                }
                if (!retryPolicy.shouldRetry(attempt, e)) {
                    throw new HistoryException(RetCode.DRIVER_ERROR,
                            describe() + ": pull failed after " + attempt + " attempt(s): " + e.getMessage(), e);
                }
                retriesMeter.mark();
                log.debug("{}: pull attempt {} failed, retrying: {}", describe(), attempt, e.toString());
                try {
                    Thread.sleep(retryPolicy.backoffMillis(attempt));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new HistoryException(RetCode.DRIVER_ERROR, describe() + ": interrupted during retry back-off", ie);
                }
            }
        }
    }

    private void accept(PullResult r) throws HistoryException {
        if (periodProvided == null) {
            if (r.fields().isEmpty()) {
                throw new HistoryException(RetCode.INTERNAL_ERROR, describe() + ": driver provided a bar without any field");
            }
            periodProvided = r.period();
            fieldProvided = r.fields();
        } else if (r.period() != periodProvided) {
            throw new HistoryException(RetCode.INTERNAL_ERROR,
                    describe() + ": period changed mid-stream from " + periodProvided + " to " + r.period());
        } else if (!r.fields().equals(fieldProvided)) {
            throw new HistoryException(RetCode.INTERNAL_ERROR,
                    describe() + ": fields changed mid-stream from " + fieldProvided + " to " + r.fields());
        }

        Bar bar = r.bar();
        long ts = bar.timestamp();
        if (params.start() != null && ts < params.start()) return;
        if (params.end() != null && ts > params.end()) return;
        if (nbBars > 0 && ts <= highestTimestamp) {
            throw new HistoryException(RetCode.INTERNAL_ERROR,
                    describe() + ": timestamp " + ts + " not after previous " + highestTimestamp);
        }

        ensureCapacity();
        current.append(bar);
        nbBars++;
        lowestTimestamp = Math.min(lowestTimestamp, ts);
        highestTimestamp = Math.max(highestTimestamp, ts);
        barAddedSinceLastCall = true;
        lowestSinceLastCall = Math.min(lowestSinceLastCall, ts);
        highestSinceLastCall = Math.max(highestSinceLastCall, ts);
        barsMeter.mark();
    }

    private void ensureCapacity() throws HistoryException {
        if (current == null) {
            current = allocateBlock(periodProvided, fieldProvided, Math.min(initialBlockCapacity, maxBarsPerBlock));
            blocks.add(current);
            return;
        }
        int cap = current.capacity();
        if (current.nbBars() < cap) return;
        if (cap < maxBarsPerBlock) {
            int newCap = (int) Math.min((long) cap * 2, maxBarsPerBlock);
            long granted = acquire(DataBlock.bytesFor(fieldProvided, newCap) - DataBlock.bytesFor(fieldProvided, cap));
            try {
                current.grow(newCap);
            } catch (OutOfMemoryError e) {
                budget.releaseMemory(granted);
                throw new HistoryException(RetCode.ALLOC_ERROR, describe() + ": cannot grow block to " + newCap + " bars", e);
            }
            current.recordAllocation(granted);
        } else {
            current = allocateBlock(periodProvided, fieldProvided, maxBarsPerBlock);
            blocks.add(current);
        }
    }

    /**
     * Allocates a block charged to the memory budget and owned by this session from the moment it exists.
     */
    public DataBlock allocateBlock(Period period, Set<Field> fields, int capacity) throws HistoryException {
        long granted = acquire(DataBlock.bytesFor(fields, capacity));
        DataBlock block;
        try {
            block = new DataBlock(period, fields, capacity);
        } catch (OutOfMemoryError e) {
            budget.releaseMemory(granted);
            throw new HistoryException(RetCode.ALLOC_ERROR, describe() + ": cannot allocate " + capacity + " bars", e);
        }
        block.recordAllocation(granted);
        owned.add(block);
        return block;
    }

    private long acquire(long bytes) throws HistoryException {
        if (bytes <= 0) return 0;
        long granted = budget.tryAcquireMemory(bytes);
        if (granted < bytes) {
            budget.releaseMemory(granted);
            throw new HistoryException(RetCode.ALLOC_ERROR,
                    describe() + ": memory budget refused " + bytes + " bytes (available " + budget.availableBytes() + ")");
        }
        return granted;
    }

    private void fail(RetCode code, String message, Throwable cause) {
        current = null;
        retCode = code;
        errorMessage = message;
        state.set(SessionState.ERRORED);
        log.warn("{} failed with {}: {}", describe(), code, message, cause);
        try {
            params.driver().cancel(this);
        } catch (RuntimeException e) {
            log.warn("{}: driver cancel after failure failed", describe(), e);
        }
        owner.onSessionError(this, code, message);
    }

    /**
     * Asks the session to stop pulling. Bars accepted so far are kept; the loop stops at its next iteration.
     */
    public void cancel() {
        if (enoughValidDataProvided.compareAndSet(false, true)) {
            try {
                params.driver().cancel(this);
            } catch (RuntimeException e) {
                log.warn("{}: driver cancel failed", describe(), e);
            }
        }
    }

    /** Drivers producing bars from their own loop may poll this to stop early. */
    public boolean isCancellationRequested() { return enoughValidDataProvided.get(); }

    /** Reported by the driver while pulling. */
    public void addSplitAdjust(long timestamp, double factor) {
        splitAdjusts.add(new SplitAdjust(timestamp, factor));
    }

    /** Reported by the driver while pulling. */
    public void addValueAdjust(long timestamp, double amount) {
        valueAdjusts.add(new ValueAdjust(timestamp, amount));
    }

    /**
     * Returns what was accepted since the previous call and resets the tracking. Meant for drivers deciding
     * whether the bars they delivered were in range.
     */
    public AddedDataInfo takeAddedDataInfo() {
        AddedDataInfo info = barAddedSinceLastCall
                ? new AddedDataInfo(true, lowestSinceLastCall, highestSinceLastCall)
                : AddedDataInfo.NONE;
        barAddedSinceLastCall = false;
        lowestSinceLastCall = Long.MAX_VALUE;
        highestSinceLastCall = Long.MIN_VALUE;
        return info;
    }

    /** Completes with the terminal state once the pull loop made its last write. */
    public CompletableFuture<SessionState> completion() { return finishIndication.copy(); }

    public SessionState state() { return state.get(); }
    public boolean isTerminal() { return finishIndication.isDone(); }
    public RetCode retCode() { return retCode; }
    public String errorMessage() { return errorMessage; }

    public int attachIndex() { return attachIndex; }
    public AttachParams params() { return params; }
    public SupportedParameters supportedParameters() { return supportedParameters; }

    public Period periodProvided() { requireTerminal(); return periodProvided == null ? params.period() : periodProvided; }
    public Set<Field> fieldProvided() { requireTerminal(); return fieldProvided; }
    public int nbBars() { requireTerminal(); return nbBars; }
    public long lowestTimestamp() { requireTerminal(); return lowestTimestamp; }
    public long highestTimestamp() { requireTerminal(); return highestTimestamp; }
    public List<DataBlock> blocks() { requireTerminal(); return Collections.unmodifiableList(blocks); }
    public List<SplitAdjust> splitAdjusts() { requireTerminal(); return Collections.unmodifiableList(splitAdjusts); }
    public List<ValueAdjust> valueAdjusts() { requireTerminal(); return Collections.unmodifiableList(valueAdjusts); }

    /**
     * Swaps the block sequence for one derived from it, e.g. after resampling. Blocks no longer referenced are
     * returned to the budget right away. New blocks must come from {@link #allocateBlock}.
     */
    public void replaceBlocks(List<DataBlock> replacement) {
        requireTerminal();
        List<DataBlock> next = new ArrayList<>(replacement);
        for (DataBlock b : next) {
            if (!owned.contains(b)) throw new IllegalArgumentException("block not allocated by " + describe());
        }
        for (DataBlock b : new ArrayList<>(owned)) {
            if (!next.contains(b)) {
                owned.remove(b);
                budget.releaseMemory(b.allocatedBytes());
                b.clear();
            }
        }
        blocks = next;
        nbBars = next.stream().mapToInt(DataBlock::nbBars).sum();
        if (nbBars > 0) {
            lowestTimestamp = next.get(0).firstTimestamp();
            highestTimestamp = next.get(next.size() - 1).lastTimestamp();
            periodProvided = next.get(0).period();
        }
    }

    public boolean isContributingDataSource() { return contributingDataSource; }
    public void markContributing() { contributingDataSource = true; }

    /** Returns every granted byte to the budget. Idempotent. */
    public void release() {
        if (state.get() != SessionState.CREATED) requireTerminal();
        if (released) return;
        released = true;
        for (DataBlock b : owned) {
            budget.releaseMemory(b.allocatedBytes());
            b.clear();
        }
        owned.clear();
        blocks = new ArrayList<>();
        splitAdjusts.clear();
        valueAdjusts.clear();
    }

    public boolean isReleased() { return released; }

    public String describe() { return "source#" + attachIndex + "(" + params.describe() + ")"; }

    private void requireTerminal() {
        if (!finishIndication.isDone()) {
            throw new IllegalStateException(describe() + " is still pulling");
        }
    }

    @Override
    public String toString() {
        return "DriverSession{" + describe() + ", state=" + state.get() + ", retCode=" + retCode + '}';
    }
}
