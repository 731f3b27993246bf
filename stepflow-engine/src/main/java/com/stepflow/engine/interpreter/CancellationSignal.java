package com.stepflow.engine.interpreter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Hierarchical cancellation flag. Cancelling a signal cancels every child created from it,
 * with the same reason; cancelling a child leaves the parent untouched.
 * 
 * Invariants:
 * - a signal is cancelled at most once; the first reason wins
 * - listeners run exactly once, outside the signal's lock
 */
public final class CancellationSignal {

    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    /**
     * Why a signal was cancelled.
     */
    public enum Reason {
        /**
         * Cancelled from outside, or a sibling branch failed.
         */
        ABORTED,

        /**
         * The execution-level timeout expired.
         */
        TIMEOUT
    }

    /**
     * Handle to remove a listener that is no longer needed.
     */
    @FunctionalInterface
    public interface Registration {
        void remove();
    }

    private final CancellationSignal parent;
    private final List<Runnable> listeners = new ArrayList<>();
    private Registration parentRegistration;
    private Reason reason;

    public CancellationSignal() {
        this(null);
    }

    private CancellationSignal(CancellationSignal parent) {
        this.parent = parent;
    }

    /**
     * Create a signal that is cancelled whenever this one is.
     */
    public CancellationSignal child() {
        CancellationSignal child = new CancellationSignal(this);
        Registration registration = onCancel(() -> child.cancel(reason()));
        synchronized (child) {
            child.parentRegistration = registration;
        }
        return child;
    }

    /**
     * Cancel this signal and its children.
     * 
     * @return true if this call cancelled the signal, false if it was already cancelled
     */
    public boolean cancel(Reason reason) {
        List<Runnable> toRun;
        synchronized (this) {
            if (this.reason != null) {
                return false;
            }
            this.reason = reason != null ? reason : Reason.ABORTED;
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }
        for (Runnable listener : toRun) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.error("Cancellation listener failed", e);
            }
        }
        return true;
    }

    /**
     * Register a listener. Runs immediately on the calling thread if already cancelled.
     */
    public Registration onCancel(Runnable listener) {
        synchronized (this) {
            if (reason == null) {
                listeners.add(listener);
                return () -> {
                    synchronized (CancellationSignal.this) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        listener.run();
        return () -> { };
    }

    /**
     * Stop following the parent. Called once a child's work is over so the parent does not
     * keep references to finished branches.
     */
    public void detach() {
        Registration registration;
        synchronized (this) {
            registration = parentRegistration;
            parentRegistration = null;
        }
        if (registration != null) {
            registration.remove();
        }
    }

    public synchronized boolean isCancelled() {
        return reason != null;
    }

    /**
     * @return The cancellation reason, or null while not cancelled
     */
    public synchronized Reason reason() {
        return reason;
    }

    public CancellationSignal parent() {
        return parent;
    }
}
