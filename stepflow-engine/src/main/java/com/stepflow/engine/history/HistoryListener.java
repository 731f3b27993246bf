package com.stepflow.engine.history;

import com.stepflow.core.model.HistoryEvent;

/**
 * Receives history events as they are recorded, e.g. to feed an external status store.
 * Called on interpreter threads; implementations must be fast and thread-safe.
 */
@FunctionalInterface
public interface HistoryListener {

    void onEvent(String executionId, HistoryEvent event);
}
