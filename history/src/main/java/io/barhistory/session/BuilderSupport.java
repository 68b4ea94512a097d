package io.barhistory.session;

import io.barhistory.budget.MemoryBudget;
import io.barhistory.config.HistoryConfig;
import io.barhistory.core.AttachParams;
import io.barhistory.core.Field;
import io.barhistory.core.HistoryException;
import io.barhistory.core.RetCode;
import io.barhistory.core.SupportedParameters;
import io.barhistory.merge.MergeOp;
import io.barhistory.metrics.Metrics;
import io.barhistory.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns every session and the merge plan of one build. Everything allocated while building is reachable from
 * here, so {@link #release()} is the single place where memory goes back to the budget.
 */
public final class BuilderSupport implements SessionListener {
    private static final Logger log = LoggerFactory.getLogger(BuilderSupport.class);

    private final MemoryBudget budget;
    private final RetryPolicy retryPolicy;
    private final HistoryConfig config;
    private final Metrics metrics;

    private final List<DriverSession> sessions = new ArrayList<>();
    private List<MergeOp> mergeOps = List.of();
    private int nbPriceBar;
    private Set<Field> commonFieldProvided = Set.of();

    // first non-success status reported by any session
    private final AtomicReference<RetCode> retCode = new AtomicReference<>(RetCode.SUCCESS);
    private volatile String firstErrorMessage;
    private final AtomicBoolean released = new AtomicBoolean(false);

    public BuilderSupport(MemoryBudget budget, RetryPolicy retryPolicy, HistoryConfig config, Metrics metrics) {
        this.budget = Objects.requireNonNull(budget);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.config = Objects.requireNonNull(config);
        this.metrics = Objects.requireNonNull(metrics);
    }

    public DriverSession attachSource(AttachParams params) throws HistoryException {
        if (released.get()) throw new HistoryException(RetCode.BAD_PARAM, "build already released");
        if (params == null) throw new HistoryException(RetCode.BAD_PARAM, "missing source parameters");
        if (params.driver() == null) throw new HistoryException(RetCode.BAD_PARAM, "missing driver for " + params.describe());
        if (params.period() == null) throw new HistoryException(RetCode.BAD_PARAM, "missing period for " + params.describe());
        if (!params.allFieldsRequested() && params.fields().isEmpty()) {
            throw new HistoryException(RetCode.BAD_PARAM, "empty field set for " + params.describe());
        }

        SupportedParameters supported;
        try {
            supported = params.driver().describeSupportedParameters();
        } catch (RuntimeException e) {
            throw new HistoryException(RetCode.DRIVER_ERROR, "driver of " + params.describe() + " cannot describe itself", e);
        }
        if (supported == null) supported = new SupportedParameters(Set.of(), Set.of());
        if (!params.allFieldsRequested() && !supported.fields().isEmpty() && !supported.fields().containsAll(params.fields())) {
            throw new HistoryException(RetCode.BAD_PARAM,
                    params.describe() + " requests " + params.fields() + " but driver supports " + supported.fields());
        }

        DriverSession session = new DriverSession(sessions.size(), params, supported, this, budget, retryPolicy, config, metrics);
        sessions.add(session);
        log.debug("attached {}", session.describe());
        return session;
    }

    /**
     * Runs every session's pull loop on {@code executor} (inline when {@code null}) and returns once all of them
     * reached a terminal state. An interrupt cancels the sessions but the barrier is still honoured.
     */
    public void pullAll(Executor executor) {
        for (DriverSession s : sessions) {
            if (executor == null) {
                s.pullAll();
                continue;
            }
            try {
                executor.execute(s::pullAll);
            } catch (RejectedExecutionException e) {
                log.debug("pull executor rejected {}, pulling inline", s.describe());
                s.pullAll();
            }
        }
        boolean interrupted = false;
        for (DriverSession s : sessions) {
            while (true) {
                try {
                    s.completion().get();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                    cancelAll();
                } catch (ExecutionException e) {
                    // the pull loop always completes normally; nothing left to wait for
                    break;
                }
            }
        }
        if (interrupted) Thread.currentThread().interrupt();
    }

    public void cancelAll() {
        for (DriverSession s : sessions) s.cancel();
    }

    /**
     * Applies the error policy once every session is terminal and returns the sessions that take part in
     * normalization and merge, in attach order.
     *
     * @throws HistoryException on a fatal error, a failed required source, or when no source finished
     */
    public List<DriverSession> eligibleSessions() throws HistoryException {
        requireAllTerminal();
        RetCode first = retCode.get();
        if (first.isFatal()) throw new HistoryException(first, firstErrorMessage);

        boolean anyFinished = false;
        for (DriverSession s : sessions) {
            if (s.state() != SessionState.FINISHED && s.state() != SessionState.ERRORED) {
                throw new HistoryException(RetCode.INTERNAL_ERROR, s.describe() + " stopped in state " + s.state());
            }
            if (s.state() == SessionState.ERRORED && s.retCode().isFatal()) {
                throw new HistoryException(s.retCode(), s.errorMessage());
            }
        }
        for (DriverSession s : sessions) {
            if (s.state() == SessionState.ERRORED && s.params().required()) {
                throw new HistoryException(s.retCode(), "required " + s.errorMessage());
            }
            anyFinished |= s.state() == SessionState.FINISHED;
        }
        if (!anyFinished) {
            throw new HistoryException(first == RetCode.SUCCESS ? RetCode.INTERNAL_ERROR : first,
                    "no data source completed; first error: " + firstErrorMessage);
        }

        List<DriverSession> eligible = new ArrayList<>();
        for (DriverSession s : sessions) {
            if (s.state() != SessionState.FINISHED || s.nbBars() == 0) continue;
            if (!s.params().allFieldsRequested() && !s.fieldProvided().containsAll(s.params().fields())) {
                log.warn("{} provides {} but {} was requested; source left out", s.describe(), s.fieldProvided(), s.params().fields());
                continue;
            }
            eligible.add(s);
        }
        return eligible;
    }

    /**
     * Records the merge plan, the final bar count and the fields common to every contributing session.
     */
    public void finalizeBuild(List<MergeOp> plan) {
        requireAllTerminal();
        this.mergeOps = List.copyOf(plan);
        this.nbPriceBar = plan.stream().mapToInt(MergeOp::nbElementToCopy).sum();
        Set<Field> common = null;
        for (DriverSession s : sessions) {
            if (!s.isContributingDataSource()) continue;
            if (common == null) {
                common = EnumSet.noneOf(Field.class);
                common.addAll(s.fieldProvided());
            } else {
                common.retainAll(s.fieldProvided());
            }
        }
        this.commonFieldProvided = common == null ? Set.of() : Field.copyOf(common);
    }

    /**
     * Columns of the final series: the common fields, narrowed to what was asked for unless some source
     * asked for everything.
     */
    public Set<Field> outputFields() {
        boolean anyAll = false;
        Set<Field> requested = EnumSet.noneOf(Field.class);
        for (DriverSession s : sessions) {
            if (s.params().allFieldsRequested()) anyAll = true;
            else requested.addAll(s.params().fields());
        }
        if (anyAll) return commonFieldProvided;
        Set<Field> out = EnumSet.noneOf(Field.class);
        out.addAll(commonFieldProvided);
        out.retainAll(requested);
        return Field.copyOf(out);
    }

    @Override
    public void onSessionError(DriverSession session, RetCode code, String message) {
        if (retCode.compareAndSet(RetCode.SUCCESS, code)) {
            firstErrorMessage = message;
        }
        metrics.meter(Metrics.SESSION_ERRORS).mark();
    }

    /** Visits every session once and returns its memory. Safe to call more than once. */
    public void release() {
        if (!released.compareAndSet(false, true)) return;
        for (DriverSession s : sessions) {
            if (s.isTerminal() || s.state() == SessionState.CREATED) {
                s.release();
            } else {
                log.error("{} still pulling at release; its blocks stay with the pull loop", s.describe());
            }
        }
        mergeOps = List.of();
    }

    public List<String> failedSources() {
        List<String> out = new ArrayList<>();
        for (DriverSession s : sessions) {
            if (s.state() == SessionState.ERRORED) out.add(s.describe() + ": " + s.retCode());
        }
        return out;
    }

    public List<DriverSession> sessions() { return Collections.unmodifiableList(sessions); }
    public List<MergeOp> mergeOps() { return mergeOps; }
    public int nbPriceBar() { return nbPriceBar; }
    public Set<Field> commonFieldProvided() { return commonFieldProvided; }
    public RetCode retCode() { return retCode.get(); }
    public String firstErrorMessage() { return firstErrorMessage; }
    public boolean isReleased() { return released.get(); }

    private void requireAllTerminal() {
        for (DriverSession s : sessions) {
            if (!s.isTerminal()) throw new IllegalStateException(s.describe() + " has not reached a terminal state");
        }
    }
}
